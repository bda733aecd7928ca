package com.tourbooking.booking.api.dto;

import com.tourbooking.booking.domain.model.Ticket;

import java.time.Instant;

public record TicketResponse(
        String ticketNumber,
        Long bookingId,
        Long resourceId,
        String holderName,
        Instant validFrom,
        Instant validUntil,
        String payload,
        Ticket.TicketStatus status,
        Instant validatedAt
) {
    public static TicketResponse from(Ticket ticket) {
        return new TicketResponse(
                ticket.getTicketNumber(),
                ticket.getBookingId(),
                ticket.getResourceId(),
                ticket.getHolderName(),
                ticket.getValidFrom(),
                ticket.getValidUntil(),
                ticket.getPayload(),
                ticket.getStatus(),
                ticket.getValidatedAt()
        );
    }
}
