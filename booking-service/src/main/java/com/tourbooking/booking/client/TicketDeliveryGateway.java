package com.tourbooking.booking.client;

import com.tourbooking.booking.client.dto.TicketDeliveryRequest;
import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.domain.model.Ticket;
import com.tourbooking.booking.exception.CollaboratorUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class TicketDeliveryGateway {

    static final String NOTIFICATION_SERVICE = "notification-service";

    private final NotificationClient notificationClient;

    @CircuitBreaker(name = NOTIFICATION_SERVICE, fallbackMethod = "deliverFallback")
    @Retry(name = NOTIFICATION_SERVICE)
    public void deliver(Booking booking, List<Ticket> tickets) {
        notificationClient.sendTickets(TicketDeliveryRequest.of(booking, tickets));
        log.info("Delivered {} ticket(s) for booking {} to {}",
                tickets.size(), booking.getBookingReference(), booking.getGuestEmail());
    }

    private void deliverFallback(Booking booking, List<Ticket> tickets, Throwable t) {
        log.warn("Ticket delivery for booking {} failed: {}", booking.getBookingReference(), t.toString());
        throw new CollaboratorUnavailableException(NOTIFICATION_SERVICE, t);
    }
}
