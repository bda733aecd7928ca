package com.tourbooking.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ValidateTicketRequest(
        @NotBlank(message = "Payload cannot be blank")
        String payload,

        @NotNull(message = "Resource ID cannot be null")
        Long resourceId,

        @NotBlank(message = "Validator ID cannot be blank")
        String validatorId
) {
}
