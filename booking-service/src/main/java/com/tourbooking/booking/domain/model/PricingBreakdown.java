package com.tourbooking.booking.domain.model;

import java.math.BigDecimal;

/**
 * Amounts charged for a booking, each rounded to two decimals.
 * {@code total = subtotal + taxes + fees - discount}; commission is reported
 * separately and is not charged to the guest.
 */
public record PricingBreakdown(
        BigDecimal unitPrice,
        int quantity,
        BigDecimal subtotal,
        BigDecimal taxes,
        BigDecimal fees,
        BigDecimal discount,
        BigDecimal total,
        BigDecimal commission,
        String currency
) {
}
