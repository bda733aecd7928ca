package com.tourbooking.booking.exception;

import com.tourbooking.common.exception.ServiceUnavailableException;

/**
 * Payment, notification or Redis could not be reached. The booking is left in
 * a state from which the same call can be retried.
 */
public class CollaboratorUnavailableException extends ServiceUnavailableException {

    public CollaboratorUnavailableException(String collaborator, Throwable cause) {
        super(collaborator, collaborator + " is unavailable, please retry shortly", cause);
    }
}
