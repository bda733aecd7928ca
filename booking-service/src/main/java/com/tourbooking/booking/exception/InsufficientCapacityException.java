package com.tourbooking.booking.exception;

import com.tourbooking.booking.domain.model.SlotKey;
import com.tourbooking.common.exception.BusinessException;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class InsufficientCapacityException extends BusinessException {

    private final int requested;
    private final int available;

    public InsufficientCapacityException(SlotKey slotKey, int requested, int available) {
        super(String.format("Slot %s is not available: requested %d, only %d left", slotKey, requested, available),
                "INSUFFICIENT_CAPACITY", HttpStatus.CONFLICT);
        this.requested = requested;
        this.available = available;
    }
}
