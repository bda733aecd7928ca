package com.tourbooking.booking.domain.model;

import java.math.BigDecimal;

/**
 * Read model served by the capacity ledger, cached in Redis for a short TTL.
 */
public record AvailabilityView(
        boolean available,
        String reason,
        Capacity capacity,
        Pricing pricing,
        Restrictions restrictions,
        boolean soldOut
) {
    public static final String NOT_CONFIGURED = "No availability configured for this date/timeslot";
    public static final String SOLD_OUT = "Sold out";

    public static AvailabilityView notConfigured() {
        return new AvailabilityView(false, NOT_CONFIGURED, null, null, null, false);
    }

    public static AvailabilityView of(InventorySlot slot) {
        int available = slot.getAvailableCapacity();
        boolean soldOut = available <= 0;
        return new AvailabilityView(
                !soldOut,
                soldOut ? SOLD_OUT : null,
                new Capacity(slot.getTotalCapacity(), available, slot.getBookedCapacity(), slot.getReservedCapacity()),
                new Pricing(slot.getBasePrice(), slot.getFinalPrice(), slot.getCurrency()),
                new Restrictions(slot.getMinBooking(), slot.getMaxBooking(), slot.getCutoffHours()),
                soldOut);
    }

    public record Capacity(int total, int available, int booked, int reserved) {
    }

    public record Pricing(BigDecimal basePrice, BigDecimal finalPrice, String currency) {
    }

    public record Restrictions(int minBooking, int maxBooking, int cutoffHours) {
    }
}
