package com.tourbooking.booking.domain.model;

/**
 * Result of starting a booking. {@code paymentRetryAvailable} is set when the
 * payment collaborator could not open a session; the booking stays pending
 * and the session can be requested again until the hold expires.
 */
public record BookingCreation(Booking booking, PricingBreakdown pricing, boolean paymentRetryAvailable) {
}
