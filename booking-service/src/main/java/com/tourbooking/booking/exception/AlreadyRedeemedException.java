package com.tourbooking.booking.exception;

import org.springframework.http.HttpStatus;

public class AlreadyRedeemedException extends TicketRejectedException {

    public AlreadyRedeemedException(String ticketNumber) {
        super("Ticket already used (" + ticketNumber + ")", "ALREADY_REDEEMED", HttpStatus.CONFLICT);
    }
}
