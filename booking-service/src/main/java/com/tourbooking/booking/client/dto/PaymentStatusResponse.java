package com.tourbooking.booking.client.dto;

import java.math.BigDecimal;

public record PaymentStatusResponse(String paymentId,
                                    String status,
                                    String paymentMethod,
                                    BigDecimal amount,
                                    String currency,
                                    String bookingReference) {

    /** Captured or authorized payments may be confirmed. */
    public boolean isCompleted() {
        return "captured".equalsIgnoreCase(status) || "authorized".equalsIgnoreCase(status);
    }
}
