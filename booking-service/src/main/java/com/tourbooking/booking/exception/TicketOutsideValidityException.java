package com.tourbooking.booking.exception;

import org.springframework.http.HttpStatus;

import java.time.Instant;

public class TicketOutsideValidityException extends TicketRejectedException {

    public TicketOutsideValidityException(String ticketNumber, Instant validFrom, Instant validUntil) {
        super(String.format("Ticket %s is only valid from %s until %s", ticketNumber, validFrom, validUntil),
                "OUTSIDE_VALIDITY", HttpStatus.CONFLICT);
    }
}
