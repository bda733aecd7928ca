package com.tourbooking.booking.domain.model;

import java.time.Instant;

/**
 * Content of a signed ticket payload. Times are epoch seconds so the
 * encoded form is stable across serializer settings.
 */
public record TicketClaims(
        String ticketNumber,
        Long resourceId,
        long validFrom,
        long validUntil,
        long issuedAt
) {
    public static TicketClaims of(Ticket ticket, Instant issuedAt) {
        return new TicketClaims(
                ticket.getTicketNumber(),
                ticket.getResourceId(),
                ticket.getValidFrom().getEpochSecond(),
                ticket.getValidUntil().getEpochSecond(),
                issuedAt.getEpochSecond());
    }

    public Instant validFromInstant() {
        return Instant.ofEpochSecond(validFrom);
    }

    public Instant validUntilInstant() {
        return Instant.ofEpochSecond(validUntil);
    }
}
