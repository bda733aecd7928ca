package com.tourbooking.booking.exception;

import com.tourbooking.common.exception.BusinessException;
import org.springframework.http.HttpStatus;

/**
 * A ticket was refused at the point of scan. Subclasses carry the message
 * shown to front-line staff.
 */
public abstract class TicketRejectedException extends BusinessException {

    protected TicketRejectedException(String message, String errorCode, HttpStatus status) {
        super(message, errorCode, status);
    }

    protected TicketRejectedException(String message, Throwable cause, String errorCode, HttpStatus status) {
        super(message, cause, errorCode, status);
    }
}
