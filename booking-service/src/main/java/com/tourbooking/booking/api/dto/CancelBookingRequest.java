package com.tourbooking.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CancelBookingRequest(
        @NotBlank(message = "Actor ID cannot be blank")
        String actorId,

        @Size(max = 500, message = "Reason must be at most 500 characters")
        String reason
) {
}
