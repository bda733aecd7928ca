package com.tourbooking.booking.api.exception;

import com.tourbooking.booking.exception.CapacityInvariantViolationException;
import com.tourbooking.booking.exception.CompensationFailedException;
import com.tourbooking.booking.exception.InsufficientCapacityException;
import com.tourbooking.booking.exception.TicketRejectedException;
import com.tourbooking.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Booking-specific refinements over the shared {@code GlobalExceptionHandler}.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingExceptionHandler {

    /** Gate rejections are routine; staff see the message as is. */
    @ExceptionHandler(TicketRejectedException.class)
    public ResponseEntity<BaseResponse<Void>> handleTicketRejected(TicketRejectedException ex) {
        log.info("Ticket rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(ex.getStatus())
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(InsufficientCapacityException.class)
    public ResponseEntity<BaseResponse<Void>> handleInsufficientCapacity(InsufficientCapacityException ex) {
        log.warn("Insufficient capacity: {}", ex.getMessage());
        return ResponseEntity.status(ex.getStatus())
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(), Map.of(
                        "requested", String.valueOf(ex.getRequested()),
                        "available", String.valueOf(ex.getAvailable()))));
    }

    @ExceptionHandler(CompensationFailedException.class)
    public ResponseEntity<BaseResponse<Void>> handleCompensationFailed(CompensationFailedException ex) {
        log.error("Compensation failed for booking {}: {}", ex.getBookingId(), ex.getMessage(), ex);
        return ResponseEntity.status(ex.getStatus())
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode(),
                        Map.of("bookingId", String.valueOf(ex.getBookingId()))));
    }

    @ExceptionHandler(CapacityInvariantViolationException.class)
    public ResponseEntity<BaseResponse<Void>> handleCapacityInvariant(CapacityInvariantViolationException ex) {
        log.error("Capacity ledger out of balance: {}", ex.getMessage(), ex);
        return ResponseEntity.status(ex.getStatus())
                .body(BaseResponse.error("Booking could not be completed", ex.getErrorCode()));
    }
}
