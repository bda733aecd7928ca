package com.tourbooking.booking.exception;

import com.tourbooking.common.exception.BusinessException;

public class InvalidQuantityException extends BusinessException {

    public InvalidQuantityException(int quantity, int min, int max) {
        super(String.format("Quantity %d is outside the allowed range %d-%d", quantity, min, max), "INVALID_QUANTITY");
    }

    public InvalidQuantityException(int quantity) {
        super("Quantity must be positive, was " + quantity, "INVALID_QUANTITY");
    }
}
