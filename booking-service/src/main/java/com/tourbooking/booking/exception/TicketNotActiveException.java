package com.tourbooking.booking.exception;

import com.tourbooking.booking.domain.model.Ticket;
import org.springframework.http.HttpStatus;

public class TicketNotActiveException extends TicketRejectedException {

    public TicketNotActiveException(String ticketNumber, Ticket.TicketStatus status) {
        super("Ticket " + ticketNumber + " is " + status.name().toLowerCase(), "TICKET_NOT_ACTIVE", HttpStatus.CONFLICT);
    }
}
