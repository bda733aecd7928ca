package com.tourbooking.booking.domain.service;

import com.tourbooking.booking.domain.model.PricingBreakdown;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Booking price: subtotal plus tax and a flat booking fee, less an optional
 * voucher discount. Each amount is rounded half-up to cents as it is computed.
 */
@Component
public class PricingCalculator {

    @Value("${booking.pricing.tax-rate:0.09}")
    private BigDecimal taxRate;

    @Value("${booking.pricing.booking-fee:2.50}")
    private BigDecimal bookingFee;

    @Value("${booking.pricing.voucher-discount-rate:0.10}")
    private BigDecimal voucherDiscountRate;

    @Value("${booking.pricing.commission-rate:0.08}")
    private BigDecimal commissionRate;

    public PricingBreakdown price(BigDecimal unitPrice, int quantity, String currency, String voucherCode) {
        BigDecimal unit = cents(unitPrice);
        BigDecimal subtotal = cents(unit.multiply(BigDecimal.valueOf(quantity)));
        BigDecimal taxes = cents(subtotal.multiply(taxRate));
        BigDecimal fees = cents(bookingFee);
        BigDecimal discount = voucherCode == null || voucherCode.isBlank()
                ? cents(BigDecimal.ZERO)
                : cents(subtotal.multiply(voucherDiscountRate));
        BigDecimal total = cents(subtotal.add(taxes).add(fees).subtract(discount));
        BigDecimal commission = cents(subtotal.multiply(commissionRate));
        return new PricingBreakdown(unit, quantity, subtotal, taxes, fees, discount, total, commission, currency);
    }

    private static BigDecimal cents(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
