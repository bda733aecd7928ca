package com.tourbooking.booking.exception;

import org.springframework.http.HttpStatus;

public class WrongLocationException extends TicketRejectedException {

    public WrongLocationException(String ticketNumber, Long expectedResourceId) {
        super(String.format("Ticket not valid for this location (%s, location %d)", ticketNumber, expectedResourceId),
                "WRONG_LOCATION", HttpStatus.CONFLICT);
    }
}
