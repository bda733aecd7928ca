package com.tourbooking.booking.exception;

import com.tourbooking.common.exception.BusinessException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A compensating action failed after an earlier saga step failed. The original
 * failure is the cause; the compensation failure is attached as suppressed.
 */
@Getter
public class CompensationFailedException extends BusinessException {

    private final Long bookingId;

    public CompensationFailedException(Long bookingId, String compensation, Throwable original, Throwable compensationFailure) {
        super(String.format("Compensation '%s' failed for booking %d after: %s",
                        compensation, bookingId, original.getMessage()),
                original, "COMPENSATION_FAILED", HttpStatus.INTERNAL_SERVER_ERROR);
        this.bookingId = bookingId;
        addSuppressed(compensationFailure);
    }
}
