package com.tourbooking.booking.domain.model;

public record CreateBookingCommand(
        Long userId,
        SlotKey slotKey,
        int quantity,
        String guestName,
        String guestEmail,
        String guestPhone,
        String voucherCode
) {
}
