package com.tourbooking.booking.domain.service;

import com.tourbooking.booking.domain.model.AvailabilityView;
import com.tourbooking.booking.domain.model.CapacityCommitment;
import com.tourbooking.booking.domain.model.CapacityCommitment.CommitmentState;
import com.tourbooking.booking.domain.model.CapacityReservation;
import com.tourbooking.booking.domain.model.InventorySlot;
import com.tourbooking.booking.domain.model.SlotKey;
import com.tourbooking.booking.domain.model.SlotSnapshot;
import com.tourbooking.booking.domain.repository.CapacityCommitmentRepository;
import com.tourbooking.booking.domain.repository.InventorySlotRepository;
import com.tourbooking.booking.exception.CapacityInvariantViolationException;
import com.tourbooking.booking.exception.InsufficientCapacityException;
import com.tourbooking.booking.exception.InvalidQuantityException;
import com.tourbooking.booking.exception.SlotNotFoundException;
import com.tourbooking.common.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative capacity counters per slot.
 *
 * <p>Every counter change is a single guarded UPDATE (see
 * {@link InventorySlotRepository}) paired, in the same transaction, with a
 * conditional transition of the booking's {@link CapacityCommitment}. The
 * commitment row is what makes confirm, release and cancel safe to repeat.
 *
 * <p>Nothing else in the service writes capacity counters.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CapacityLedger {

    private final InventorySlotRepository slotRepository;
    private final CapacityCommitmentRepository commitmentRepository;
    private final AvailabilityCache availabilityCache;

    /**
     * Read-through: cache first, then database. Unknown or inactive slots
     * report unavailable rather than throwing.
     */
    @Transactional(readOnly = true)
    public AvailabilityView checkAvailability(SlotKey slotKey) {
        Optional<AvailabilityView> cached = availabilityCache.get(slotKey);
        if (cached.isPresent()) {
            return cached.get();
        }
        Optional<InventorySlot> slot = findSlot(slotKey).filter(InventorySlot::getActive);
        if (slot.isEmpty()) {
            return AvailabilityView.notConfigured();
        }
        AvailabilityView view = AvailabilityView.of(slot.get());
        availabilityCache.put(slotKey, view);
        return view;
    }

    /**
     * Moves {@code quantity} into reserved capacity for the booking. Calling it
     * again for a booking that already holds capacity returns the existing reservation.
     */
    @Transactional
    public CapacityReservation reserve(Long bookingId, SlotKey slotKey, int quantity) {
        if (quantity <= 0) {
            throw new InvalidQuantityException(quantity);
        }
        Optional<CapacityCommitment> existing = commitmentRepository.findById(bookingId);
        if (existing.isPresent()) {
            CapacityCommitment commitment = existing.get();
            if (commitment.getState() == CommitmentState.RESERVED || commitment.getState() == CommitmentState.CONFIRMED) {
                log.info("Booking {} already holds {} on {}", bookingId, commitment.getQuantity(), commitment.slotKey());
                return CapacityReservation.of(commitment);
            }
            throw new BusinessException("Capacity for booking " + bookingId + " was already "
                    + commitment.getState().name().toLowerCase(), "COMMITMENT_CLOSED");
        }

        int updated = slotRepository.reserveCapacity(slotKey.resourceId(), slotKey.date(), slotKey.timeslot(), quantity);
        if (updated == 0) {
            InventorySlot slot = findSlot(slotKey)
                    .filter(InventorySlot::getActive)
                    .orElseThrow(() -> new SlotNotFoundException(slotKey));
            throw new InsufficientCapacityException(slotKey, quantity, Math.max(0, slot.getAvailableCapacity()));
        }

        CapacityCommitment commitment = commitmentRepository.save(CapacityCommitment.builder()
                .bookingId(bookingId)
                .resourceId(slotKey.resourceId())
                .slotDate(slotKey.date())
                .timeslot(slotKey.timeslot())
                .quantity(quantity)
                .state(CommitmentState.RESERVED)
                .build());
        evictOnCommit(slotKey);
        log.info("Reserved {} on {} for booking {}", quantity, slotKey, bookingId);
        return CapacityReservation.of(commitment);
    }

    /**
     * Moves the booking's quantity from reserved to booked. No-op when already confirmed.
     */
    @Transactional
    public void confirm(Long bookingId) {
        CapacityCommitment commitment = commitmentRepository.findById(bookingId)
                .orElseThrow(() -> new BusinessException("No capacity reserved for booking " + bookingId,
                        "COMMITMENT_NOT_FOUND"));
        if (commitmentRepository.transition(bookingId, CommitmentState.RESERVED, CommitmentState.CONFIRMED) == 0) {
            CommitmentState state = reloadState(bookingId);
            if (state == CommitmentState.CONFIRMED) {
                log.debug("Capacity for booking {} already confirmed", bookingId);
                return;
            }
            throw new BusinessException("Capacity for booking " + bookingId + " cannot be confirmed from state "
                    + state, "COMMITMENT_CLOSED");
        }
        SlotKey slotKey = commitment.slotKey();
        int quantity = commitment.getQuantity();
        if (slotRepository.confirmCapacity(slotKey.resourceId(), slotKey.date(), slotKey.timeslot(), quantity) == 0) {
            log.error("Reserved capacity on {} is below {} while confirming booking {}", slotKey, quantity, bookingId);
            throw new CapacityInvariantViolationException(slotKey,
                    "reserved capacity below " + quantity + " on confirm of booking " + bookingId);
        }
        evictOnCommit(slotKey);
        log.info("Confirmed {} on {} for booking {}", quantity, slotKey, bookingId);
    }

    /**
     * Returns reserved capacity to the pool. Safe to call repeatedly, and after
     * the booking was confirmed (then nothing happens).
     *
     * @return true if this call released capacity
     */
    @Transactional
    public boolean release(Long bookingId) {
        Optional<CapacityCommitment> commitment = commitmentRepository.findById(bookingId);
        if (commitment.isEmpty()) {
            log.debug("Nothing reserved for booking {}", bookingId);
            return false;
        }
        if (commitmentRepository.transition(bookingId, CommitmentState.RESERVED, CommitmentState.RELEASED) == 0) {
            log.debug("Release for booking {} skipped, commitment is {}", bookingId, reloadState(bookingId));
            return false;
        }
        SlotKey slotKey = commitment.get().slotKey();
        int quantity = commitment.get().getQuantity();
        if (slotRepository.releaseReserved(slotKey.resourceId(), slotKey.date(), slotKey.timeslot(), quantity) == 0) {
            log.error("Reserved capacity on {} is below {} while releasing booking {}; flooring at zero",
                    slotKey, quantity, bookingId);
            slotRepository.floorReserved(slotKey.resourceId(), slotKey.date(), slotKey.timeslot());
        }
        evictOnCommit(slotKey);
        log.info("Released {} on {} for booking {}", quantity, slotKey, bookingId);
        return true;
    }

    /**
     * Returns booked capacity of a confirmed booking to the pool. Safe to call repeatedly.
     *
     * @return true if this call cancelled capacity
     */
    @Transactional
    public boolean cancel(Long bookingId) {
        Optional<CapacityCommitment> commitment = commitmentRepository.findById(bookingId);
        if (commitment.isEmpty()) {
            log.debug("Nothing booked for booking {}", bookingId);
            return false;
        }
        if (commitmentRepository.transition(bookingId, CommitmentState.CONFIRMED, CommitmentState.CANCELLED) == 0) {
            log.debug("Cancel for booking {} skipped, commitment is {}", bookingId, reloadState(bookingId));
            return false;
        }
        SlotKey slotKey = commitment.get().slotKey();
        int quantity = commitment.get().getQuantity();
        if (slotRepository.cancelBooked(slotKey.resourceId(), slotKey.date(), slotKey.timeslot(), quantity) == 0) {
            log.error("Booked capacity on {} is below {} while cancelling booking {}; flooring at zero",
                    slotKey, quantity, bookingId);
            slotRepository.floorBooked(slotKey.resourceId(), slotKey.date(), slotKey.timeslot());
        }
        evictOnCommit(slotKey);
        log.info("Cancelled {} on {} for booking {}", quantity, slotKey, bookingId);
        return true;
    }

    @Transactional(readOnly = true)
    public List<SlotSnapshot> getRange(Long resourceId, LocalDate startDate, LocalDate endDate) {
        if (endDate.isBefore(startDate)) {
            throw new BusinessException("End date " + endDate + " is before start date " + startDate,
                    "INVALID_DATE_RANGE");
        }
        return slotRepository
                .findByResourceIdAndSlotDateBetweenAndActiveTrueOrderBySlotDateAscTimeslotAsc(resourceId, startDate, endDate)
                .stream()
                .map(SlotSnapshot::of)
                .toList();
    }

    private Optional<InventorySlot> findSlot(SlotKey slotKey) {
        return slotRepository.findByResourceIdAndSlotDateAndTimeslot(
                slotKey.resourceId(), slotKey.date(), slotKey.timeslot());
    }

    private CommitmentState reloadState(Long bookingId) {
        return commitmentRepository.findById(bookingId).map(CapacityCommitment::getState).orElse(null);
    }

    /**
     * Evicts now and once more after commit, so a reader that cached the
     * pre-commit row in between does not outlive this transaction.
     */
    private void evictOnCommit(SlotKey slotKey) {
        availabilityCache.evict(slotKey);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    availabilityCache.evict(slotKey);
                }
            });
        }
    }
}
