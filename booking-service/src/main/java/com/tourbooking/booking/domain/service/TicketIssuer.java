package com.tourbooking.booking.domain.service;

import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.domain.model.Ticket;
import com.tourbooking.booking.domain.model.Ticket.TicketStatus;
import com.tourbooking.booking.domain.model.TicketClaims;
import com.tourbooking.booking.domain.model.TicketValidation;
import com.tourbooking.booking.domain.repository.TicketRepository;
import com.tourbooking.booking.exception.AlreadyRedeemedException;
import com.tourbooking.booking.exception.CannotCancelRedeemedException;
import com.tourbooking.booking.exception.InvalidBookingStateException;
import com.tourbooking.booking.exception.TicketNotActiveException;
import com.tourbooking.booking.exception.TicketNotFoundException;
import com.tourbooking.booking.exception.TicketOutsideValidityException;
import com.tourbooking.booking.exception.WrongLocationException;
import com.tourbooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Issues one ticket per guest for a confirmed booking and redeems them at the gate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketIssuer {

    private final TicketRepository ticketRepository;
    private final TicketPayloadCodec payloadCodec;
    private final Clock clock;

    @Value("${booking.ticket.zone:Europe/Amsterdam}")
    private String zone;

    @Value("${booking.ticket.validity:P1D}")
    private Duration validity;

    /**
     * Creates the booking's tickets, or returns the existing ones if they were
     * already issued. Tickets are valid from the start of the slot date in the
     * configured zone for {@code booking.ticket.validity}.
     */
    @Transactional
    public List<Ticket> issue(Booking booking) {
        if (booking.getStatus() != Booking.BookingStatus.CONFIRMED) {
            throw new InvalidBookingStateException(booking.getId(), booking.getStatus(), "issue tickets for");
        }
        List<Ticket> existing = ticketRepository.findByBookingIdOrderByTicketNumberAsc(booking.getId());
        if (!existing.isEmpty()) {
            log.debug("Tickets for booking {} already issued", booking.getId());
            return existing;
        }

        Instant issuedAt = Instant.now(clock);
        Instant validFrom = booking.getSlotDate().atStartOfDay(ZoneId.of(zone)).toInstant();
        Instant validUntil = validFrom.plus(validity);
        List<Ticket> tickets = new ArrayList<>(booking.getQuantity());
        for (int i = 1; i <= booking.getQuantity(); i++) {
            Ticket ticket = Ticket.builder()
                    .ticketNumber(ticketNumber(booking.getBookingReference(), i))
                    .bookingId(booking.getId())
                    .resourceId(booking.getResourceId())
                    .holderName(booking.getGuestName())
                    .holderEmail(booking.getGuestEmail())
                    .validFrom(validFrom)
                    .validUntil(validUntil)
                    .status(TicketStatus.ACTIVE)
                    .build();
            ticket.setPayload(payloadCodec.encode(TicketClaims.of(ticket, issuedAt)));
            tickets.add(ticket);
        }
        List<Ticket> saved = ticketRepository.saveAll(tickets);
        log.info("Issued {} ticket(s) for booking {}", saved.size(), booking.getBookingReference());
        return saved;
    }

    /**
     * Offline check: signature and claims only, no database access.
     */
    public TicketClaims verify(String payload) {
        return payloadCodec.decode(payload);
    }

    /**
     * Redeems a scanned ticket. Checks run in order: signature, existence,
     * location, validity window, status; the final ACTIVE to VALIDATED change
     * is a single conditional update, so concurrent scans redeem at most once.
     */
    @Transactional
    public TicketValidation validate(String payload, Long expectedResourceId, String validatorId) {
        TicketClaims claims = payloadCodec.decode(payload);
        Ticket ticket = ticketRepository.findByTicketNumber(claims.ticketNumber())
                .orElseThrow(() -> new TicketNotFoundException(claims.ticketNumber()));
        if (!ticket.getResourceId().equals(expectedResourceId)) {
            throw new WrongLocationException(ticket.getTicketNumber(), expectedResourceId);
        }
        Instant now = Instant.now(clock);
        if (now.isBefore(ticket.getValidFrom()) || !now.isBefore(ticket.getValidUntil())) {
            throw new TicketOutsideValidityException(ticket.getTicketNumber(), ticket.getValidFrom(), ticket.getValidUntil());
        }
        if (ticket.getStatus() == TicketStatus.VALIDATED) {
            throw new AlreadyRedeemedException(ticket.getTicketNumber());
        }
        if (ticket.getStatus() != TicketStatus.ACTIVE) {
            throw new TicketNotActiveException(ticket.getTicketNumber(), ticket.getStatus());
        }
        if (ticketRepository.redeem(ticket.getTicketNumber(), validatorId, now) == 0) {
            throw new AlreadyRedeemedException(ticket.getTicketNumber());
        }
        log.info("Ticket {} validated by {} at resource {}", ticket.getTicketNumber(), validatorId, expectedResourceId);
        return new TicketValidation(ticket.getTicketNumber(), ticket.getBookingId(), ticket.getResourceId(),
                validatorId, now);
    }

    /**
     * Cancels every given ticket that is still active. Fails as a whole if any
     * id is unknown or any of them has been used, including one redeemed while
     * this runs.
     *
     * @return number of tickets this call cancelled
     */
    @Transactional
    public int cancel(List<Long> ticketIds, String reason) {
        List<Ticket> tickets = ticketRepository.findAllById(ticketIds);
        Set<Long> found = tickets.stream().map(Ticket::getId).collect(Collectors.toSet());
        for (Long id : ticketIds) {
            if (!found.contains(id)) {
                throw new TicketNotFoundException(String.valueOf(id));
            }
        }
        for (Ticket ticket : tickets) {
            if (ticket.getStatus() == TicketStatus.VALIDATED) {
                throw new CannotCancelRedeemedException(ticket.getTicketNumber());
            }
        }
        Instant now = Instant.now(clock);
        int cancelled = 0;
        for (Ticket ticket : tickets) {
            if (ticket.getStatus() != TicketStatus.ACTIVE) {
                continue;
            }
            if (ticketRepository.cancelIfActive(ticket.getId(), reason, now) == 1) {
                cancelled++;
            } else if (isValidated(ticket.getId())) {
                throw new CannotCancelRedeemedException(ticket.getTicketNumber());
            }
        }
        log.info("Cancelled {} of {} ticket(s): {}", cancelled, tickets.size(), reason);
        return cancelled;
    }

    @Transactional
    public int cancelForBooking(Long bookingId, String reason) {
        List<Long> ids = ticketRepository.findByBookingIdOrderByTicketNumberAsc(bookingId).stream()
                .map(Ticket::getId)
                .toList();
        return ids.isEmpty() ? 0 : cancel(ids, reason);
    }

    @Transactional(readOnly = true)
    public Optional<Ticket> findRedeemed(Long bookingId) {
        return ticketRepository.findFirstByBookingIdAndStatus(bookingId, TicketStatus.VALIDATED);
    }

    @Transactional(readOnly = true)
    public List<Ticket> findByBooking(Long bookingId) {
        return ticketRepository.findByBookingIdOrderByTicketNumberAsc(bookingId);
    }

    /**
     * {@code BK-2025-123456} becomes {@code HB-2025-123456-01}, {@code -02}, ...
     */
    static String ticketNumber(String bookingReference, int sequence) {
        String base = bookingReference.startsWith(Constants.BOOKING_REFERENCE_PREFIX)
                ? Constants.TICKET_NUMBER_PREFIX + bookingReference.substring(Constants.BOOKING_REFERENCE_PREFIX.length())
                : bookingReference;
        return String.format("%s-%02d", base, sequence);
    }

    private boolean isValidated(Long ticketId) {
        return ticketRepository.findById(ticketId)
                .map(t -> t.getStatus() == TicketStatus.VALIDATED)
                .orElse(false);
    }
}
