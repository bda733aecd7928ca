package com.tourbooking.booking.api.dto;

import com.tourbooking.booking.domain.model.BookingCreation;
import com.tourbooking.booking.domain.model.PricingBreakdown;

/**
 * Result of a create call. {@code paymentRetryAvailable} means capacity is held
 * but the payment session could not be opened yet.
 */
public record BookingCreatedResponse(
        BookingResponse booking,
        PricingBreakdown pricing,
        boolean paymentRetryAvailable
) {
    public static BookingCreatedResponse from(BookingCreation creation) {
        return new BookingCreatedResponse(
                BookingResponse.from(creation.booking()),
                creation.pricing(),
                creation.paymentRetryAvailable());
    }
}
