package com.tourbooking.booking.domain.model;

import java.time.Instant;

public record TicketValidation(
        String ticketNumber,
        Long bookingId,
        Long resourceId,
        String validatedBy,
        Instant validatedAt
) {
}
