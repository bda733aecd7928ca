package com.tourbooking.booking.domain.repository;

import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.domain.model.CapacityCommitment;
import com.tourbooking.booking.domain.model.CapacityCommitment.CommitmentState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface CapacityCommitmentRepository extends JpaRepository<CapacityCommitment, Long> {

    /**
     * Conditional state change; 0 rows means another caller already moved it.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE CapacityCommitment c
           SET c.state = :to
           WHERE c.bookingId = :bookingId
             AND c.state = :from
           """)
    int transition(@Param("bookingId") Long bookingId,
                   @Param("from") CommitmentState from,
                   @Param("to") CommitmentState to);

    /**
     * Reserved capacity whose booking is gone, expired or cancelled: left behind
     * when a compensation or an expiry stopped half way. Bookings in any of the
     * {@code live} statuses keep their reservation; a confirmed booking's
     * capacity is settled by the fulfilment re-drive, never released here.
     */
    @Query("""
           SELECT c FROM CapacityCommitment c
           WHERE c.state = :reserved
             AND c.createdAt < :before
             AND NOT EXISTS (
                 SELECT b.id FROM Booking b
                 WHERE b.id = c.bookingId AND b.status IN :live)
           """)
    List<CapacityCommitment> findOrphaned(@Param("reserved") CommitmentState reserved,
                                          @Param("live") Collection<Booking.BookingStatus> live,
                                          @Param("before") LocalDateTime before);
}
