package com.tourbooking.booking.api.dto;

import com.tourbooking.booking.domain.model.CreateBookingCommand;
import com.tourbooking.booking.domain.model.SlotKey;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record CreateBookingRequest(
        @NotNull(message = "User ID cannot be null")
        Long userId,

        @NotNull(message = "Resource ID cannot be null")
        Long resourceId,

        @NotNull(message = "Date cannot be null")
        LocalDate date,

        @Size(max = 32, message = "Timeslot must be at most 32 characters")
        String timeslot,

        @Positive(message = "Quantity must be positive")
        @NotNull(message = "Quantity cannot be null")
        Integer quantity,

        @NotBlank(message = "Guest name cannot be blank")
        String guestName,

        @NotBlank(message = "Guest email cannot be blank")
        @Email(message = "Guest email must be a valid address")
        String guestEmail,

        @Size(max = 32, message = "Guest phone must be at most 32 characters")
        String guestPhone,

        @Size(max = 64, message = "Voucher code must be at most 64 characters")
        String voucherCode
) {
    public CreateBookingCommand toCommand() {
        return new CreateBookingCommand(
                userId,
                new SlotKey(resourceId, date, timeslot),
                quantity,
                guestName,
                guestEmail,
                guestPhone,
                voucherCode);
    }
}
