package com.tourbooking.booking.domain.service;

import com.tourbooking.booking.api.dto.BookingResponse;
import com.tourbooking.booking.api.dto.TicketResponse;
import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.domain.repository.BookingRepository;
import com.tourbooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read side for bookings and their tickets. State changes go through
 * {@link com.tourbooking.booking.saga.BookingOrchestrator}.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingService {

    private final BookingRepository bookingRepository;
    private final TicketIssuer ticketIssuer;

    public Booking getBooking(Long id) {
        return bookingRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", id));
    }

    public BookingResponse getBookingById(Long id) {
        return BookingResponse.from(getBooking(id));
    }

    public BookingResponse getBookingByReference(String reference) {
        return bookingRepository.findByBookingReference(reference)
                .map(BookingResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", reference));
    }

    public List<BookingResponse> getBookingsByUserId(Long userId) {
        return bookingRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(BookingResponse::from)
                .toList();
    }

    public List<TicketResponse> getTickets(Long bookingId) {
        getBooking(bookingId);
        return ticketIssuer.findByBooking(bookingId).stream()
                .map(TicketResponse::from)
                .toList();
    }
}
