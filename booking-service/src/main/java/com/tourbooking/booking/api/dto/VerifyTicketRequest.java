package com.tourbooking.booking.api.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyTicketRequest(
        @NotBlank(message = "Payload cannot be blank")
        String payload
) {
}
