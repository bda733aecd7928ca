package com.tourbooking.booking.exception;

import com.tourbooking.common.exception.BusinessException;
import org.springframework.http.HttpStatus;

public class CancellationNotAllowedException extends BusinessException {

    public CancellationNotAllowedException(String bookingReference) {
        super("Booking " + bookingReference + " cannot be cancelled", "CANCELLATION_NOT_ALLOWED", HttpStatus.CONFLICT);
    }
}
