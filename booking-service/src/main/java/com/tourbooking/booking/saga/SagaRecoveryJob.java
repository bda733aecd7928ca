package com.tourbooking.booking.saga;

import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.domain.model.CapacityCommitment;
import com.tourbooking.booking.domain.model.CapacityCommitment.CommitmentState;
import com.tourbooking.booking.domain.repository.BookingRepository;
import com.tourbooking.booking.domain.repository.CapacityCommitmentRepository;
import com.tourbooking.booking.domain.service.CapacityLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Reconciles whatever the request path and the Redis expiry events left behind:
 * <ul>
 *   <li>pending bookings past their hold expiry are expired</li>
 *   <li>confirmed bookings without delivered tickets are fulfilled again</li>
 *   <li>reserved capacity whose booking is gone, expired or cancelled is released</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SagaRecoveryJob {

    static final List<Booking.BookingStatus> LIVE_STATUSES =
            List.of(Booking.BookingStatus.PENDING, Booking.BookingStatus.CONFIRMED);

    private final BookingRepository bookingRepository;
    private final CapacityCommitmentRepository commitmentRepository;
    private final CapacityLedger capacityLedger;
    private final BookingOrchestrator orchestrator;
    private final Clock clock;

    @Value("${booking.saga.recovery-enabled:true}")
    private boolean recoveryEnabled;

    /** Slack after hold expiry before the job steps in for the keyspace event. */
    @Value("${booking.saga.expiry-grace-seconds:60}")
    private long expiryGraceSeconds;

    @Value("${booking.saga.recovery-threshold-minutes:5}")
    private long recoveryThresholdMinutes;

    @Value("${booking.delivery.max-attempts:5}")
    private int maxDeliveryAttempts;

    @Scheduled(fixedDelayString = "${booking.saga.recovery-interval-ms:60000}")
    public void recover() {
        if (!recoveryEnabled) return;
        expireStaleHolds();
        redriveFulfilment();
        releaseOrphanedCapacity();
    }

    void expireStaleHolds() {
        Instant threshold = Instant.now(clock).minusSeconds(expiryGraceSeconds);
        List<Booking> stale = bookingRepository.findByStatusAndHoldExpiresAtBefore(Booking.BookingStatus.PENDING, threshold);
        if (stale.isEmpty()) return;
        log.info("Saga recovery: expiring {} pending booking(s) past their hold", stale.size());
        for (Booking booking : stale) {
            try {
                orchestrator.expire(booking.getId());
            } catch (RuntimeException e) {
                log.error("Recovery could not expire booking {}", booking.getId(), e);
            }
        }
    }

    void redriveFulfilment() {
        Instant threshold = Instant.now(clock).minus(Duration.ofMinutes(recoveryThresholdMinutes));
        List<Booking> undelivered = bookingRepository.findUndelivered(
                Booking.BookingStatus.CONFIRMED, maxDeliveryAttempts, threshold);
        if (undelivered.isEmpty()) return;
        log.info("Saga recovery: re-driving fulfilment for {} booking(s)", undelivered.size());
        for (Booking booking : undelivered) {
            try {
                Booking result = orchestrator.fulfil(booking.getId());
                if (result.getDeliveredAt() == null && result.getDeliveryAttempts() >= maxDeliveryAttempts) {
                    log.error("Booking {} still undelivered after {} attempts; giving up, manual delivery required",
                            booking.getId(), result.getDeliveryAttempts());
                }
            } catch (RuntimeException e) {
                log.error("Recovery could not fulfil booking {}", booking.getId(), e);
            }
        }
    }

    void releaseOrphanedCapacity() {
        LocalDateTime threshold = LocalDateTime.now(clock).minusMinutes(recoveryThresholdMinutes);
        List<CapacityCommitment> orphaned = commitmentRepository.findOrphaned(
                CommitmentState.RESERVED, LIVE_STATUSES, threshold);
        if (orphaned.isEmpty()) return;
        log.warn("Saga recovery: releasing {} orphaned reservation(s)", orphaned.size());
        for (CapacityCommitment commitment : orphaned) {
            try {
                capacityLedger.release(commitment.getBookingId());
            } catch (RuntimeException e) {
                log.error("Recovery could not release capacity of booking {}", commitment.getBookingId(), e);
            }
        }
    }
}
