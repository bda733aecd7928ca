package com.tourbooking.booking.api.controller;

import com.tourbooking.booking.api.dto.BookingCreatedResponse;
import com.tourbooking.booking.api.dto.BookingResponse;
import com.tourbooking.booking.api.dto.CancelBookingRequest;
import com.tourbooking.booking.api.dto.CancellationResponse;
import com.tourbooking.booking.api.dto.ConfirmBookingRequest;
import com.tourbooking.booking.api.dto.CreateBookingRequest;
import com.tourbooking.booking.api.dto.TicketResponse;
import com.tourbooking.booking.domain.model.BookingCreation;
import com.tourbooking.booking.domain.service.BookingService;
import com.tourbooking.booking.saga.BookingOrchestrator;
import com.tourbooking.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for bookings. Writes go through the saga orchestrator, reads through {@link BookingService}.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingOrchestrator orchestrator;
    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingCreatedResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request) {
        BookingCreation creation = orchestrator.create(request.toCommand());
        BookingCreatedResponse body = BookingCreatedResponse.from(creation);
        if (creation.paymentRetryAvailable()) {
            // Capacity is held; the client retries the payment session.
            return ResponseEntity.status(HttpStatus.ACCEPTED)
                    .body(BaseResponse.success("Booking held, payment session unavailable. Please retry payment.", body));
        }
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Booking created successfully", body));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBookingById(id)));
    }

    @GetMapping("/reference/{reference}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBookingByReference(@PathVariable String reference) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBookingByReference(reference)));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getBookingsByUser(
            @PathVariable Long userId) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getBookingsByUserId(userId)));
    }

    @PostMapping("/{id}/payment-session")
    public ResponseEntity<BaseResponse<BookingResponse>> retryPaymentSession(@PathVariable Long id) {
        BookingResponse response = BookingResponse.from(orchestrator.retryPaymentSession(id));
        return ResponseEntity.ok(BaseResponse.success("Payment session ready", response));
    }

    @PostMapping("/{id}/confirm")
    public ResponseEntity<BaseResponse<BookingResponse>> confirmBooking(
            @PathVariable Long id,
            @RequestBody(required = false) ConfirmBookingRequest request) {
        String paymentReference = request == null ? null : request.paymentReference();
        BookingResponse response = BookingResponse.from(orchestrator.confirm(id, paymentReference));
        return ResponseEntity.ok(BaseResponse.success("Booking confirmed", response));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<BaseResponse<CancellationResponse>> cancelBooking(
            @PathVariable Long id,
            @Valid @RequestBody CancelBookingRequest request) {
        CancellationResponse response = CancellationResponse.from(
                orchestrator.cancel(id, request.actorId(), request.reason()));
        return ResponseEntity.ok(BaseResponse.success("Booking cancelled", response));
    }

    @GetMapping("/{id}/tickets")
    public ResponseEntity<BaseResponse<List<TicketResponse>>> getTickets(@PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(bookingService.getTickets(id)));
    }
}
