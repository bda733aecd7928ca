package com.tourbooking.booking.exception;

import com.tourbooking.common.exception.BusinessException;
import org.springframework.http.HttpStatus;

import java.time.Instant;

public class CutoffPassedException extends BusinessException {

    public CutoffPassedException(String action, Instant cutoff) {
        super(String.format("Too late to %s: cutoff was %s", action, cutoff), "CUTOFF_PASSED", HttpStatus.CONFLICT);
    }
}
