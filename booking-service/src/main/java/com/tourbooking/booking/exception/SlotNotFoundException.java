package com.tourbooking.booking.exception;

import com.tourbooking.booking.domain.model.SlotKey;
import com.tourbooking.common.exception.ResourceNotFoundException;

/**
 * No active inventory row exists for the key. Usually a catalog configuration gap.
 */
public class SlotNotFoundException extends ResourceNotFoundException {

    public SlotNotFoundException(SlotKey slotKey) {
        super("No availability configured for slot " + slotKey, "SLOT_NOT_FOUND");
    }
}
