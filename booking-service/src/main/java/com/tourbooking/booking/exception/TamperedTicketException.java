package com.tourbooking.booking.exception;

import org.springframework.http.HttpStatus;

public class TamperedTicketException extends TicketRejectedException {

    public TamperedTicketException(String detail) {
        super("Invalid ticket (" + detail + ")", "TAMPERED_OR_INVALID", HttpStatus.BAD_REQUEST);
    }

    public TamperedTicketException(String detail, Throwable cause) {
        super("Invalid ticket (" + detail + ")", cause, "TAMPERED_OR_INVALID", HttpStatus.BAD_REQUEST);
    }
}
