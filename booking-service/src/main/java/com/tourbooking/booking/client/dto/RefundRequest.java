package com.tourbooking.booking.client.dto;

import java.math.BigDecimal;

public record RefundRequest(BigDecimal amount, String currency, String reason, String idempotencyKey) {
}
