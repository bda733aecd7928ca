package com.tourbooking.booking.domain.model;

public record CancellationResult(Booking booking, int ticketsCancelled, RefundOutcome refund) {
}
