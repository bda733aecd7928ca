package com.tourbooking.booking.api.dto;

import com.tourbooking.booking.domain.model.Booking;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record BookingResponse(
        Long id,
        String bookingReference,
        Long userId,
        Long resourceId,
        LocalDate date,
        String timeslot,
        Integer quantity,
        BigDecimal unitPrice,
        BigDecimal totalAmount,
        String currency,
        Booking.BookingStatus status,
        Booking.PaymentStatus paymentStatus,
        String paymentUrl,
        Instant holdExpiresAt,
        Instant cancellationDeadline,
        Instant confirmedAt,
        Instant ticketsIssuedAt,
        Instant deliveredAt,
        Instant cancelledAt,
        Boolean requiresAttention,
        LocalDateTime createdAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getBookingReference(),
                booking.getUserId(),
                booking.getResourceId(),
                booking.getSlotDate(),
                booking.getTimeslot(),
                booking.getQuantity(),
                booking.getUnitPrice(),
                booking.getTotalAmount(),
                booking.getCurrency(),
                booking.getStatus(),
                booking.getPaymentStatus(),
                booking.getPaymentUrl(),
                booking.getHoldExpiresAt(),
                booking.getCancellationDeadline(),
                booking.getConfirmedAt(),
                booking.getTicketsIssuedAt(),
                booking.getDeliveredAt(),
                booking.getCancelledAt(),
                booking.getRequiresAttention(),
                booking.getCreatedAt()
        );
    }
}
