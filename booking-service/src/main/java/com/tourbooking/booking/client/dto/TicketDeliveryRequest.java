package com.tourbooking.booking.client.dto;

import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.domain.model.Ticket;

import java.time.Instant;
import java.util.List;

public record TicketDeliveryRequest(
        String bookingReference,
        String recipientEmail,
        String recipientName,
        List<DeliveredTicket> tickets
) {
    public static TicketDeliveryRequest of(Booking booking, List<Ticket> tickets) {
        return new TicketDeliveryRequest(
                booking.getBookingReference(),
                booking.getGuestEmail(),
                booking.getGuestName(),
                tickets.stream()
                        .map(t -> new DeliveredTicket(t.getTicketNumber(), t.getPayload(), t.getValidFrom(), t.getValidUntil()))
                        .toList());
    }

    public record DeliveredTicket(String ticketNumber, String payload, Instant validFrom, Instant validUntil) {
    }
}
