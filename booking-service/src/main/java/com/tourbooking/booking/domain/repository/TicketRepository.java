package com.tourbooking.booking.domain.repository;

import com.tourbooking.booking.domain.model.Ticket;
import com.tourbooking.booking.domain.model.Ticket.TicketStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TicketRepository extends JpaRepository<Ticket, Long> {

    Optional<Ticket> findByTicketNumber(String ticketNumber);

    List<Ticket> findByBookingIdOrderByTicketNumberAsc(Long bookingId);

    Optional<Ticket> findFirstByBookingIdAndStatus(Long bookingId, TicketStatus status);

    /**
     * Redemption: ACTIVE to VALIDATED in one statement. Exactly one of any
     * number of concurrent callers gets 1.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Ticket t
           SET t.status = :validated,
               t.validatedAt = :at,
               t.validatedBy = :validatorId
           WHERE t.ticketNumber = :ticketNumber
             AND t.status = :active
           """)
    int redeem(@Param("ticketNumber") String ticketNumber,
               @Param("validatorId") String validatorId,
               @Param("at") Instant at,
               @Param("active") TicketStatus active,
               @Param("validated") TicketStatus validated);

    default int redeem(String ticketNumber, String validatorId, Instant at) {
        return redeem(ticketNumber, validatorId, at, TicketStatus.ACTIVE, TicketStatus.VALIDATED);
    }

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Ticket t
           SET t.status = :cancelled,
               t.cancelledAt = :at,
               t.cancellationReason = :reason
           WHERE t.id = :id
             AND t.status = :active
           """)
    int cancelIfActive(@Param("id") Long id,
                       @Param("reason") String reason,
                       @Param("at") Instant at,
                       @Param("active") TicketStatus active,
                       @Param("cancelled") TicketStatus cancelled);

    default int cancelIfActive(Long id, String reason, Instant at) {
        return cancelIfActive(id, reason, at, TicketStatus.ACTIVE, TicketStatus.CANCELLED);
    }
}
