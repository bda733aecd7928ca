package com.tourbooking.booking.exception;

import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.common.exception.BusinessException;
import org.springframework.http.HttpStatus;

public class InvalidBookingStateException extends BusinessException {

    public InvalidBookingStateException(Long bookingId, Booking.BookingStatus actual, String action) {
        super(String.format("Cannot %s booking %d in status %s", action, bookingId, actual),
                "INVALID_BOOKING_STATE", HttpStatus.CONFLICT);
    }
}
