package com.tourbooking.booking.events;

import com.tourbooking.booking.domain.model.Booking;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes booking lifecycle events to Kafka, keyed by booking id.
 * Publishing is fire-and-forget: a failed send is logged and never fails
 * the saga step that triggered it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    static final String TOPIC_BOOKING_CONFIRMED = "booking-confirmed";
    static final String TOPIC_BOOKING_CANCELLED = "booking-cancelled";
    static final String TOPIC_BOOKING_EXPIRED = "booking-expired";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;

    public void publishBookingConfirmed(Booking booking) {
        BookingConfirmedEvent event = BookingConfirmedEvent.builder()
                .bookingId(booking.getId())
                .bookingReference(booking.getBookingReference())
                .userId(booking.getUserId())
                .resourceId(booking.getResourceId())
                .slotDate(booking.getSlotDate())
                .timeslot(booking.getTimeslot())
                .quantity(booking.getQuantity())
                .totalAmount(booking.getTotalAmount())
                .commission(booking.getCommission())
                .currency(booking.getCurrency())
                .timestamp(Instant.now(clock))
                .build();
        publishEvent(TOPIC_BOOKING_CONFIRMED, String.valueOf(booking.getId()), event);
    }

    public void publishBookingCancelled(Booking booking, Booking.BookingStatus previousStatus,
                                        String cancelledBy, String reason, boolean refundRequested) {
        BookingCancelledEvent event = BookingCancelledEvent.builder()
                .bookingId(booking.getId())
                .bookingReference(booking.getBookingReference())
                .userId(booking.getUserId())
                .resourceId(booking.getResourceId())
                .previousStatus(previousStatus.name())
                .cancelledBy(cancelledBy)
                .reason(reason)
                .refundRequested(refundRequested)
                .timestamp(Instant.now(clock))
                .build();
        publishEvent(TOPIC_BOOKING_CANCELLED, String.valueOf(booking.getId()), event);
    }

    public void publishBookingExpired(Booking booking) {
        BookingExpiredEvent event = BookingExpiredEvent.builder()
                .bookingId(booking.getId())
                .bookingReference(booking.getBookingReference())
                .userId(booking.getUserId())
                .resourceId(booking.getResourceId())
                .quantity(booking.getQuantity())
                .timestamp(Instant.now(clock))
                .build();
        publishEvent(TOPIC_BOOKING_EXPIRED, String.valueOf(booking.getId()), event);
    }

    private void publishEvent(String topic, String key, Object event) {
        log.debug("Publishing event to topic {}: {}", topic, event);
        CompletableFuture<SendResult<String, Object>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to hand event for key {} to Kafka topic {}", key, topic, e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex == null) {
                log.info("Event published to topic {}: key={}, offset={}",
                        topic, key, result.getRecordMetadata().offset());
            } else {
                log.error("Failed to publish event to topic {} for key {}", topic, key, ex);
            }
        });
    }
}
