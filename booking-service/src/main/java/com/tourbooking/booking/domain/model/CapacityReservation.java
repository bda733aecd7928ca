package com.tourbooking.booking.domain.model;

public record CapacityReservation(Long bookingId, SlotKey slotKey, int quantity) {

    public static CapacityReservation of(CapacityCommitment commitment) {
        return new CapacityReservation(commitment.getBookingId(), commitment.slotKey(), commitment.getQuantity());
    }
}
