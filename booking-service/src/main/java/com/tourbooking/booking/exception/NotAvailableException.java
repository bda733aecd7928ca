package com.tourbooking.booking.exception;

import com.tourbooking.booking.domain.model.SlotKey;
import com.tourbooking.common.exception.BusinessException;
import org.springframework.http.HttpStatus;

public class NotAvailableException extends BusinessException {

    public NotAvailableException(SlotKey slotKey, String reason) {
        super(String.format("Slot %s is not available: %s", slotKey, reason), "NOT_AVAILABLE", HttpStatus.CONFLICT);
    }
}
