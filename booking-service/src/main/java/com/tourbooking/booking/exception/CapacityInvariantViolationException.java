package com.tourbooking.booking.exception;

import com.tourbooking.booking.domain.model.SlotKey;
import com.tourbooking.common.exception.BusinessException;
import org.springframework.http.HttpStatus;

public class CapacityInvariantViolationException extends BusinessException {

    public CapacityInvariantViolationException(SlotKey slotKey, String detail) {
        super("Capacity counters inconsistent for slot " + slotKey + ": " + detail,
                "CAPACITY_INVARIANT_VIOLATION", HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
