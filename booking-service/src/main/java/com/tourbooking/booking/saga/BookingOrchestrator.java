package com.tourbooking.booking.saga;

import com.tourbooking.booking.client.PaymentGateway;
import com.tourbooking.booking.client.TicketDeliveryGateway;
import com.tourbooking.booking.client.dto.PaymentSessionResponse;
import com.tourbooking.booking.client.dto.PaymentStatusResponse;
import com.tourbooking.booking.client.dto.RefundResponse;
import com.tourbooking.booking.domain.model.AvailabilityView;
import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.domain.model.Booking.BookingStatus;
import com.tourbooking.booking.domain.model.Booking.PaymentStatus;
import com.tourbooking.booking.domain.model.BookingCreation;
import com.tourbooking.booking.domain.model.CancellationResult;
import com.tourbooking.booking.domain.model.CreateBookingCommand;
import com.tourbooking.booking.domain.model.PricingBreakdown;
import com.tourbooking.booking.domain.model.RefundOutcome;
import com.tourbooking.booking.domain.model.SlotKey;
import com.tourbooking.booking.domain.model.Ticket;
import com.tourbooking.booking.domain.repository.BookingRepository;
import com.tourbooking.booking.domain.service.CapacityLedger;
import com.tourbooking.booking.domain.service.HoldRegistry;
import com.tourbooking.booking.domain.service.PricingCalculator;
import com.tourbooking.booking.domain.service.TicketIssuer;
import com.tourbooking.booking.events.BookingEventPublisher;
import com.tourbooking.booking.exception.CancellationNotAllowedException;
import com.tourbooking.booking.exception.CannotCancelRedeemedException;
import com.tourbooking.booking.exception.CollaboratorUnavailableException;
import com.tourbooking.booking.exception.CompensationFailedException;
import com.tourbooking.booking.exception.CutoffPassedException;
import com.tourbooking.booking.exception.InsufficientCapacityException;
import com.tourbooking.booking.exception.InvalidBookingStateException;
import com.tourbooking.booking.exception.InvalidQuantityException;
import com.tourbooking.booking.exception.NotAvailableException;
import com.tourbooking.booking.exception.PaymentNotCompletedException;
import com.tourbooking.common.exception.ResourceNotFoundException;
import com.tourbooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Saga orchestrator for the booking lifecycle.
 *
 * <pre>
 * create:  check availability -> price -> persist PENDING -> reserve capacity -> place hold -> payment session
 * confirm: verify payment -> PENDING to CONFIRMED -> drop hold -> confirm capacity -> issue tickets -> deliver
 * cancel:  PENDING/CONFIRMED to CANCELLED + release/cancel capacity + cancel tickets (one transaction) -> refund
 * expire:  PENDING to EXPIRED -> drop hold -> release capacity
 * </pre>
 *
 * Status changes are conditional updates, so hold expiry racing a confirm
 * resolves to whichever lands first. Each step can be re-run from the
 * current state; {@link SagaRecoveryJob} does that for anything left behind.
 * Once payment is taken nothing rolls it back except an explicit refund.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingOrchestrator {

    static final String ATTENTION_FULFILMENT = "FULFILMENT_INCOMPLETE";
    static final String ATTENTION_REFUND = "REFUND_FAILED";

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int REFERENCE_ATTEMPTS = 5;

    private final BookingRepository bookingRepository;
    private final CapacityLedger capacityLedger;
    private final HoldRegistry holdRegistry;
    private final PricingCalculator pricingCalculator;
    private final TicketIssuer ticketIssuer;
    private final PaymentGateway paymentGateway;
    private final TicketDeliveryGateway ticketDeliveryGateway;
    private final BookingEventPublisher bookingEventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Value("${booking.hold.ttl-minutes:15}")
    private long holdTtlMinutes;

    @Value("${booking.cancellation.deadline-hours:24}")
    private long cancellationDeadlineHours;

    @Value("${booking.zone:Europe/Amsterdam}")
    private String zone;

    /**
     * Starts a booking: reserves capacity behind a timed hold and asks the
     * payment collaborator for a session. If that collaborator is down the
     * booking stays pending and {@link #retryPaymentSession} can be used
     * until the hold expires.
     */
    public BookingCreation create(CreateBookingCommand command) {
        SlotKey slotKey = command.slotKey();
        int quantity = command.quantity();
        log.info("Creating booking for user {} on {} x{}", command.userId(), slotKey, quantity);

        // Step 1: availability, quantity bounds and cutoff
        AvailabilityView availability = capacityLedger.checkAvailability(slotKey);
        if (!availability.available()) {
            throw new NotAvailableException(slotKey, availability.reason());
        }
        AvailabilityView.Restrictions restrictions = availability.restrictions();
        if (quantity < restrictions.minBooking() || quantity > restrictions.maxBooking()) {
            throw new InvalidQuantityException(quantity, restrictions.minBooking(), restrictions.maxBooking());
        }
        Instant now = Instant.now(clock);
        Instant startsAt = slotKey.startsAt(ZoneId.of(zone));
        Instant cutoff = startsAt.minus(Duration.ofHours(restrictions.cutoffHours()));
        if (!now.isBefore(cutoff)) {
            throw new CutoffPassedException("book", cutoff);
        }
        if (availability.capacity().available() < quantity) {
            throw new InsufficientCapacityException(slotKey, quantity, availability.capacity().available());
        }

        // Step 2: price and persist as PENDING
        PricingBreakdown pricing = pricingCalculator.price(availability.pricing().finalPrice(), quantity,
                availability.pricing().currency(), command.voucherCode());
        Duration holdTtl = Duration.ofMinutes(holdTtlMinutes);
        Booking booking = bookingRepository.save(Booking.builder()
                .bookingReference(nextBookingReference(now))
                .userId(command.userId())
                .resourceId(slotKey.resourceId())
                .slotDate(slotKey.date())
                .timeslot(slotKey.timeslot())
                .quantity(quantity)
                .unitPrice(pricing.unitPrice())
                .subtotal(pricing.subtotal())
                .taxes(pricing.taxes())
                .fees(pricing.fees())
                .discount(pricing.discount())
                .totalAmount(pricing.total())
                .commission(pricing.commission())
                .currency(pricing.currency())
                .voucherCode(command.voucherCode())
                .guestName(command.guestName())
                .guestEmail(command.guestEmail())
                .guestPhone(command.guestPhone())
                .status(BookingStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .allowCancellation(true)
                .cancellationDeadline(startsAt.minus(Duration.ofHours(
                        Math.max(restrictions.cutoffHours(), cancellationDeadlineHours))))
                .holdExpiresAt(now.plus(holdTtl))
                .build());

        // Step 3: reserve capacity; compensation deletes the booking
        try {
            capacityLedger.reserve(booking.getId(), slotKey, quantity);
        } catch (RuntimeException e) {
            log.warn("Reserve failed for booking {}: {}", booking.getId(), e.getMessage());
            discardBooking(booking, e);
            throw e;
        }

        // Step 4: timed hold; compensation releases capacity and deletes the booking
        try {
            holdRegistry.place(booking.getId(), slotKey, quantity, holdTtl);
        } catch (RuntimeException e) {
            log.error("Hold placement failed for booking {}, releasing capacity", booking.getId(), e);
            releaseAndDiscard(booking, e);
            throw e;
        }

        // Step 5: payment session; failure keeps the booking pending
        boolean sessionOpened = openPaymentSession(booking);
        log.info("Booking {} ({}) pending payment until {}",
                booking.getId(), booking.getBookingReference(), booking.getHoldExpiresAt());
        return new BookingCreation(booking, pricing, !sessionOpened);
    }

    public Booking retryPaymentSession(Long bookingId) {
        Booking booking = load(bookingId);
        if (booking.getStatus() != BookingStatus.PENDING) {
            throw new InvalidBookingStateException(bookingId, booking.getStatus(), "open a payment session for");
        }
        if (booking.getPaymentUrl() != null) {
            return booking;
        }
        if (!openPaymentSession(booking)) {
            throw new CollaboratorUnavailableException("payment-service", null);
        }
        return booking;
    }

    /**
     * Confirms a pending booking once its payment is captured or authorized,
     * then fulfils it. A repeated confirm returns the confirmed booking and
     * re-drives any fulfilment still outstanding.
     */
    public Booking confirm(Long bookingId, String paymentReference) {
        Booking booking = load(bookingId);
        if (booking.getStatus() == BookingStatus.CONFIRMED) {
            log.info("Booking {} already confirmed", bookingId);
            return booking.isFulfilled() ? booking : fulfil(bookingId);
        }

        String paymentId = resolvePaymentId(booking, paymentReference);
        PaymentStatusResponse payment = paymentGateway.getPayment(paymentId);
        if (!payment.isCompleted()) {
            throw new PaymentNotCompletedException(paymentId, payment.status());
        }
        String mismatch = paymentMismatch(booking, payment);
        if (mismatch != null) {
            log.warn("Payment {} rejected for booking {}: {}", paymentId, bookingId, mismatch);
            throw new PaymentNotCompletedException(paymentId, mismatch);
        }

        if (booking.getStatus() != BookingStatus.PENDING) {
            refundLateCapture(booking, paymentId);
            throw new InvalidBookingStateException(bookingId, booking.getStatus(), "confirm");
        }
        if (bookingRepository.markConfirmed(bookingId, paymentId, Instant.now(clock)) == 0) {
            Booking current = load(bookingId);
            if (current.getStatus() == BookingStatus.CONFIRMED) {
                log.info("Booking {} confirmed concurrently", bookingId);
                return current;
            }
            // lost the race against expiry or cancellation
            refundLateCapture(current, paymentId);
            throw new InvalidBookingStateException(bookingId, current.getStatus(), "confirm");
        }
        log.info("Booking {} confirmed with payment {}", bookingId, paymentId);

        if (!holdRegistry.remove(bookingId)) {
            log.debug("Hold for booking {} already gone at confirm", bookingId);
        }
        Booking confirmed = load(bookingId);
        bookingEventPublisher.publishBookingConfirmed(confirmed);
        return fulfil(bookingId);
    }

    /**
     * Confirms capacity, issues tickets and delivers them. Every step is
     * idempotent. A failure leaves the booking CONFIRMED and flagged for
     * attention; the recovery job retries it.
     */
    public Booking fulfil(Long bookingId) {
        Booking booking = load(bookingId);
        if (booking.getStatus() != BookingStatus.CONFIRMED) {
            log.debug("Booking {} is {}, nothing to fulfil", bookingId, booking.getStatus());
            return booking;
        }
        try {
            capacityLedger.confirm(bookingId);
            List<Ticket> tickets = ticketIssuer.issue(booking);
            bookingRepository.markTicketsIssued(bookingId, Instant.now(clock));
            ticketDeliveryGateway.deliver(booking, tickets);
            bookingRepository.markDelivered(bookingId, Instant.now(clock));
        } catch (RuntimeException e) {
            log.error("Fulfilment of booking {} incomplete, flagged for retry", bookingId, e);
            bookingRepository.markFulfilmentFailed(bookingId, ATTENTION_FULFILMENT, truncate(e.getMessage()));
        }
        return load(bookingId);
    }

    /**
     * Cancels a pending or confirmed booking before its cancellation deadline.
     * Status, capacity and tickets change in one transaction; the refund is
     * requested afterwards and its outcome reported rather than thrown.
     */
    public CancellationResult cancel(Long bookingId, String actorId, String reason) {
        Booking booking = load(bookingId);
        BookingStatus previous = booking.getStatus();
        if (previous != BookingStatus.PENDING && previous != BookingStatus.CONFIRMED) {
            throw new InvalidBookingStateException(bookingId, previous, "cancel");
        }
        if (!Boolean.TRUE.equals(booking.getAllowCancellation())) {
            throw new CancellationNotAllowedException(booking.getBookingReference());
        }
        if (booking.getCancellationDeadline() != null && Instant.now(clock).isAfter(booking.getCancellationDeadline())) {
            throw new CutoffPassedException("cancel", booking.getCancellationDeadline());
        }
        ticketIssuer.findRedeemed(bookingId).ifPresent(ticket -> {
            throw new CannotCancelRedeemedException(ticket.getTicketNumber());
        });

        Integer ticketsCancelled = transactionTemplate.execute(status -> {
            if (bookingRepository.markCancelled(bookingId, previous, actorId, reason, Instant.now(clock)) == 0) {
                throw new InvalidBookingStateException(bookingId, load(bookingId).getStatus(), "cancel");
            }
            if (previous == BookingStatus.PENDING) {
                capacityLedger.release(bookingId);
            } else {
                capacityLedger.cancel(bookingId);
            }
            return ticketIssuer.cancelForBooking(bookingId, reason);
        });
        log.info("Booking {} cancelled by {} (was {}): {}", bookingId, actorId, previous, reason);

        holdRegistry.remove(bookingId);
        RefundOutcome refund = booking.getPaymentStatus() == PaymentStatus.PAID
                ? requestRefund(booking, reason)
                : RefundOutcome.notRequired();
        bookingEventPublisher.publishBookingCancelled(booking, previous, actorId, reason, refund.requested());
        return new CancellationResult(load(bookingId), ticketsCancelled == null ? 0 : ticketsCancelled, refund);
    }

    /**
     * Expires a pending booking whose hold ran out. No-op for any other status.
     *
     * @return true if this call expired the booking
     */
    public boolean expire(Long bookingId) {
        if (bookingRepository.transitionStatus(bookingId, BookingStatus.PENDING, BookingStatus.EXPIRED) == 0) {
            log.debug("Booking {} not pending, expiry skipped", bookingId);
            return false;
        }
        holdRegistry.remove(bookingId);
        capacityLedger.release(bookingId);
        log.info("Booking {} expired, capacity released", bookingId);
        bookingRepository.findById(bookingId).ifPresent(bookingEventPublisher::publishBookingExpired);
        return true;
    }

    /**
     * The session recorded at create is authoritative; a caller may only name
     * a payment when none was recorded.
     */
    private String resolvePaymentId(Booking booking, String paymentReference) {
        boolean referenceGiven = paymentReference != null && !paymentReference.isBlank();
        String recorded = booking.getPaymentId();
        if (recorded != null) {
            if (referenceGiven && !recorded.equals(paymentReference)) {
                log.warn("Confirm of booking {} named payment {} but session {} is on record",
                        booking.getId(), paymentReference, recorded);
                throw new PaymentNotCompletedException(paymentReference, "not issued for this booking");
            }
            return recorded;
        }
        if (!referenceGiven) {
            throw new PaymentNotCompletedException("none", "not started");
        }
        return paymentReference;
    }

    /** @return why the payment cannot settle this booking, or null if it can */
    private static String paymentMismatch(Booking booking, PaymentStatusResponse payment) {
        if (!booking.getBookingReference().equals(payment.bookingReference())) {
            return "issued for booking " + payment.bookingReference();
        }
        if (payment.amount() == null || payment.amount().compareTo(booking.getTotalAmount()) != 0
                || !booking.getCurrency().equalsIgnoreCase(payment.currency())) {
            return String.format("for %s %s, expected %s %s", payment.amount(), payment.currency(),
                    booking.getTotalAmount(), booking.getCurrency());
        }
        return null;
    }

    private boolean openPaymentSession(Booking booking) {
        try {
            PaymentSessionResponse session = paymentGateway.createSession(booking);
            bookingRepository.recordPaymentSession(booking.getId(), session.paymentId(), session.redirectUrl());
            booking.setPaymentId(session.paymentId());
            booking.setPaymentUrl(session.redirectUrl());
            return true;
        } catch (CollaboratorUnavailableException e) {
            log.warn("No payment session for booking {}, left pending for retry: {}", booking.getId(), e.getMessage());
            return false;
        }
    }

    private RefundOutcome requestRefund(Booking booking, String reason) {
        try {
            RefundResponse refund = paymentGateway.refund(booking, reason);
            bookingRepository.recordRefund(booking.getId(), PaymentStatus.REFUNDED, refund.refundId(), false, null);
            log.info("Refund {} requested for booking {}", refund.refundId(), booking.getId());
            return RefundOutcome.succeeded(refund.refundId());
        } catch (RuntimeException e) {
            log.error("Refund for booking {} failed; manual follow-up required", booking.getId(), e);
            bookingRepository.recordRefund(booking.getId(), PaymentStatus.REFUND_FAILED, null, true, ATTENTION_REFUND);
            return RefundOutcome.failed(e.getMessage());
        }
    }

    /** Payment arrived for a booking that already expired or was cancelled. */
    private void refundLateCapture(Booking booking, String paymentId) {
        if (booking.getPaymentStatus() == PaymentStatus.REFUNDED) {
            log.info("Late payment {} for booking {} already refunded ({})",
                    paymentId, booking.getId(), booking.getRefundId());
            return;
        }
        log.warn("Payment {} captured for booking {} in status {}; refunding",
                paymentId, booking.getId(), booking.getStatus());
        booking.setPaymentId(paymentId);
        requestRefund(booking, "Payment received after booking " + booking.getStatus().name().toLowerCase());
    }

    private void discardBooking(Booking booking, RuntimeException cause) {
        try {
            bookingRepository.delete(booking);
        } catch (RuntimeException deleteFailure) {
            log.error("Could not delete booking {} after failed reserve", booking.getId(), deleteFailure);
            throw new CompensationFailedException(booking.getId(), "delete booking", cause, deleteFailure);
        }
    }

    private void releaseAndDiscard(Booking booking, RuntimeException cause) {
        try {
            capacityLedger.release(booking.getId());
            bookingRepository.delete(booking);
        } catch (RuntimeException compensationFailure) {
            log.error("Could not undo reservation of booking {}", booking.getId(), compensationFailure);
            throw new CompensationFailedException(booking.getId(), "release capacity", cause, compensationFailure);
        }
    }

    private Booking load(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    /** {@code BK-YYYY-NNNNNN}, retried on the rare collision. */
    private String nextBookingReference(Instant now) {
        int year = LocalDate.ofInstant(now, ZoneId.of(zone)).getYear();
        for (int attempt = 0; attempt < REFERENCE_ATTEMPTS; attempt++) {
            String reference = String.format("%s-%d-%06d", Constants.BOOKING_REFERENCE_PREFIX, year, RANDOM.nextInt(1_000_000));
            if (!bookingRepository.existsByBookingReference(reference)) {
                return reference;
            }
        }
        throw new IllegalStateException("Could not allocate a unique booking reference");
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= 1000 ? message : message.substring(0, 1000);
    }
}
