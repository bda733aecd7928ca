package com.tourbooking.booking.api.dto;

/**
 * Payment callback body. Without a reference the payment session recorded on the booking is checked.
 */
public record ConfirmBookingRequest(String paymentReference) {
}
