package com.tourbooking.booking.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record SlotSnapshot(
        Long resourceId,
        LocalDate date,
        String timeslot,
        int totalCapacity,
        int availableCapacity,
        int bookedCapacity,
        int reservedCapacity,
        BigDecimal finalPrice,
        String currency
) {
    public static SlotSnapshot of(InventorySlot slot) {
        return new SlotSnapshot(
                slot.getResourceId(),
                slot.getSlotDate(),
                slot.getTimeslot(),
                slot.getTotalCapacity(),
                slot.getAvailableCapacity(),
                slot.getBookedCapacity(),
                slot.getReservedCapacity(),
                slot.getFinalPrice(),
                slot.getCurrency());
    }
}
