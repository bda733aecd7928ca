package com.tourbooking.booking.exception;

import com.tourbooking.common.exception.BusinessException;
import org.springframework.http.HttpStatus;

public class CannotCancelRedeemedException extends BusinessException {

    public CannotCancelRedeemedException(String ticketNumber) {
        super("Ticket " + ticketNumber + " has already been used and cannot be cancelled",
                "CANNOT_CANCEL_REDEEMED", HttpStatus.CONFLICT);
    }
}
