package com.tourbooking.booking.api.dto;

import com.tourbooking.booking.domain.model.CancellationResult;
import com.tourbooking.booking.domain.model.RefundOutcome;

public record CancellationResponse(
        BookingResponse booking,
        int ticketsCancelled,
        RefundOutcome refund
) {
    public static CancellationResponse from(CancellationResult result) {
        return new CancellationResponse(
                BookingResponse.from(result.booking()),
                result.ticketsCancelled(),
                result.refund());
    }
}
