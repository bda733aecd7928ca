package com.tourbooking.booking.saga;

import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.domain.model.CapacityCommitment;
import com.tourbooking.booking.domain.model.CapacityCommitment.CommitmentState;
import com.tourbooking.booking.domain.repository.BookingRepository;
import com.tourbooking.booking.domain.repository.CapacityCommitmentRepository;
import com.tourbooking.booking.domain.service.CapacityLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SagaRecoveryJobTest {

    private static final Instant NOW = Instant.parse("2026-06-01T08:00:00Z");

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private CapacityCommitmentRepository commitmentRepository;
    @Mock
    private CapacityLedger capacityLedger;
    @Mock
    private BookingOrchestrator orchestrator;

    private SagaRecoveryJob job;

    @BeforeEach
    void setUp() {
        job = new SagaRecoveryJob(bookingRepository, commitmentRepository, capacityLedger, orchestrator,
                Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(job, "recoveryEnabled", true);
        ReflectionTestUtils.setField(job, "expiryGraceSeconds", 60L);
        ReflectionTestUtils.setField(job, "recoveryThresholdMinutes", 5L);
        ReflectionTestUtils.setField(job, "maxDeliveryAttempts", 5);
    }

    @Test
    @DisplayName("recover expires pending bookings whose hold ran out, continuing past failures")
    void recover_expiresStaleHolds() {
        // given
        when(bookingRepository.findByStatusAndHoldExpiresAtBefore(Booking.BookingStatus.PENDING, NOW.minusSeconds(60)))
                .thenReturn(List.of(booking(1L), booking(2L)));
        when(orchestrator.expire(1L)).thenThrow(new IllegalStateException("db hiccup"));

        // when
        job.recover();

        // then
        verify(orchestrator).expire(1L);
        verify(orchestrator).expire(2L);
    }

    @Test
    @DisplayName("recover re-drives fulfilment of confirmed bookings that were never delivered")
    void recover_redrivesFulfilment() {
        Booking undelivered = booking(3L);
        when(bookingRepository.findUndelivered(Booking.BookingStatus.CONFIRMED, 5, NOW.minusSeconds(300)))
                .thenReturn(List.of(undelivered));
        when(orchestrator.fulfil(3L)).thenReturn(undelivered);

        job.recover();

        verify(orchestrator).fulfil(3L);
    }

    @Test
    @DisplayName("recover releases capacity reserved for bookings that are gone, expired or cancelled")
    void recover_releasesOrphans() {
        CapacityCommitment orphan = CapacityCommitment.builder()
                .bookingId(4L)
                .state(CommitmentState.RESERVED)
                .build();
        when(commitmentRepository.findOrphaned(CommitmentState.RESERVED,
                List.of(Booking.BookingStatus.PENDING, Booking.BookingStatus.CONFIRMED),
                LocalDateTime.of(2026, 6, 1, 7, 55))).thenReturn(List.of(orphan));

        job.recover();

        verify(capacityLedger).release(4L);
    }

    @Test
    @DisplayName("recover leaves a confirmed booking's reservation to the fulfilment re-drive")
    void recover_keepsReservationOfConfirmedBooking() {
        // given: paid recently, capacity confirm failed, commitment still RESERVED
        Booking confirmed = booking(5L);
        confirmed.setStatus(Booking.BookingStatus.CONFIRMED);
        confirmed.setConfirmedAt(NOW.minusSeconds(60));

        // when
        job.recover();

        // then
        verify(commitmentRepository).findOrphaned(eq(CommitmentState.RESERVED),
                argThat(live -> live.contains(Booking.BookingStatus.CONFIRMED)
                        && live.contains(Booking.BookingStatus.PENDING)),
                any(LocalDateTime.class));
        verify(capacityLedger, never()).release(confirmed.getId());
    }

    @Test
    @DisplayName("recover does nothing when disabled")
    void recover_disabled() {
        ReflectionTestUtils.setField(job, "recoveryEnabled", false);

        job.recover();

        verifyNoInteractions(bookingRepository, commitmentRepository, capacityLedger, orchestrator);
    }

    @Test
    @DisplayName("recover with nothing to do touches no booking")
    void recover_nothingToDo() {
        job.recover();

        verify(orchestrator, never()).expire(any());
        verify(orchestrator, never()).fulfil(any());
        verify(capacityLedger, never()).release(any());
    }

    private static Booking booking(Long id) {
        return Booking.builder()
                .id(id)
                .status(Booking.BookingStatus.PENDING)
                .deliveryAttempts(1)
                .build();
    }
}
