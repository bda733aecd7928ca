package com.tourbooking.booking.api.dto;

import com.tourbooking.booking.domain.model.TicketClaims;

import java.time.Instant;

public record TicketClaimsResponse(
        String ticketNumber,
        Long resourceId,
        Instant validFrom,
        Instant validUntil,
        Instant issuedAt
) {
    public static TicketClaimsResponse from(TicketClaims claims) {
        return new TicketClaimsResponse(
                claims.ticketNumber(),
                claims.resourceId(),
                claims.validFromInstant(),
                claims.validUntilInstant(),
                Instant.ofEpochSecond(claims.issuedAt()));
    }
}
