package com.tourbooking.booking.events;

import com.tourbooking.booking.domain.model.Booking;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingEventPublisherTest {

    private static final Instant NOW = Instant.parse("2026-06-01T08:00:00Z");

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private BookingEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new BookingEventPublisher(kafkaTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("a cancellation is published to booking-cancelled keyed by booking id")
    void publishBookingCancelled() {
        CompletableFuture<SendResult<String, Object>> pending = new CompletableFuture<>();
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(pending);

        publisher.publishBookingCancelled(booking(), Booking.BookingStatus.CONFIRMED, "user-1", "Change of plans", true);

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("booking-cancelled"), eq("1"), event.capture());
        BookingCancelledEvent cancelled = (BookingCancelledEvent) event.getValue();
        assertThat(cancelled.getPreviousStatus()).isEqualTo("CONFIRMED");
        assertThat(cancelled.isRefundRequested()).isTrue();
        assertThat(cancelled.getTimestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("a broker failure never reaches the caller")
    void publish_brokerFailure() {
        CompletableFuture<SendResult<String, Object>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(failed);

        assertThatCode(() -> publisher.publishBookingExpired(booking())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("a send that throws synchronously is logged, not propagated")
    void publish_sendThrows() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("no metadata"));

        assertThatCode(() -> publisher.publishBookingConfirmed(booking())).doesNotThrowAnyException();
    }

    private static Booking booking() {
        return Booking.builder()
                .id(1L)
                .bookingReference("BK-2026-123456")
                .userId(100L)
                .resourceId(7L)
                .slotDate(LocalDate.of(2026, 7, 1))
                .quantity(2)
                .build();
    }
}
