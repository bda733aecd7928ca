package com.tourbooking.booking.client.dto;

import java.math.BigDecimal;

public record CreatePaymentSessionRequest(
        Long bookingId,
        String bookingReference,
        BigDecimal amount,
        String currency,
        String customerEmail,
        String idempotencyKey
) {
}
