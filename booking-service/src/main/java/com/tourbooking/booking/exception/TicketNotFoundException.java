package com.tourbooking.booking.exception;

import org.springframework.http.HttpStatus;

public class TicketNotFoundException extends TicketRejectedException {

    public TicketNotFoundException(String ticketNumber) {
        super("Ticket " + ticketNumber + " not found", "TICKET_NOT_FOUND", HttpStatus.NOT_FOUND);
    }
}
