package com.tourbooking.booking.domain.repository;

import com.tourbooking.booking.domain.model.Booking;
import com.tourbooking.booking.domain.model.Booking.BookingStatus;
import com.tourbooking.booking.domain.model.Booking.PaymentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Status changes are compare-and-set updates on the current status, so the
 * hold expiry path and the confirm path can race safely: the first to land
 * wins and the other sees 0 rows.
 */
public interface BookingRepository extends JpaRepository<Booking, Long> {
    List<Booking> findByUserIdOrderByCreatedAtDesc(Long userId);

    Optional<Booking> findByBookingReference(String bookingReference);

    boolean existsByBookingReference(String bookingReference);

    /** For saga recovery: pending bookings whose hold should already have expired. */
    List<Booking> findByStatusAndHoldExpiresAtBefore(BookingStatus status, Instant before);

    /** For saga recovery: confirmed bookings whose tickets were never delivered. */
    @Query("""
           SELECT b FROM Booking b
           WHERE b.status = :status
             AND b.deliveredAt IS NULL
             AND b.deliveryAttempts < :maxAttempts
             AND b.confirmedAt < :before
           ORDER BY b.confirmedAt
           """)
    List<Booking> findUndelivered(@Param("status") BookingStatus status,
                                  @Param("maxAttempts") int maxAttempts,
                                  @Param("before") Instant before);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :to WHERE b.id = :id AND b.status = :from")
    int transitionStatus(@Param("id") Long id,
                         @Param("from") BookingStatus from,
                         @Param("to") BookingStatus to);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Booking b
           SET b.status = :confirmed,
               b.paymentStatus = :paid,
               b.paymentId = :paymentId,
               b.paidAt = :at,
               b.confirmedAt = :at
           WHERE b.id = :id
             AND b.status = :pending
           """)
    int markConfirmed(@Param("id") Long id,
                      @Param("paymentId") String paymentId,
                      @Param("at") Instant at,
                      @Param("pending") BookingStatus pending,
                      @Param("confirmed") BookingStatus confirmed,
                      @Param("paid") PaymentStatus paid);

    default int markConfirmed(Long id, String paymentId, Instant at) {
        return markConfirmed(id, paymentId, at, BookingStatus.PENDING, BookingStatus.CONFIRMED, PaymentStatus.PAID);
    }

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Booking b
           SET b.status = :cancelled,
               b.cancelledAt = :at,
               b.cancelledBy = :actor,
               b.cancellationReason = :reason
           WHERE b.id = :id
             AND b.status = :from
           """)
    int markCancelled(@Param("id") Long id,
                      @Param("from") BookingStatus from,
                      @Param("actor") String actor,
                      @Param("reason") String reason,
                      @Param("at") Instant at,
                      @Param("cancelled") BookingStatus cancelled);

    default int markCancelled(Long id, BookingStatus from, String actor, String reason, Instant at) {
        return markCancelled(id, from, actor, reason, at, BookingStatus.CANCELLED);
    }

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.paymentId = :paymentId, b.paymentUrl = :paymentUrl WHERE b.id = :id")
    int recordPaymentSession(@Param("id") Long id,
                             @Param("paymentId") String paymentId,
                             @Param("paymentUrl") String paymentUrl);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.ticketsIssuedAt = :at WHERE b.id = :id AND b.ticketsIssuedAt IS NULL")
    int markTicketsIssued(@Param("id") Long id, @Param("at") Instant at);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Booking b
           SET b.deliveredAt = :at,
               b.deliveryAttempts = b.deliveryAttempts + 1,
               b.lastDeliveryError = NULL,
               b.requiresAttention = false,
               b.attentionReason = NULL
           WHERE b.id = :id
           """)
    int markDelivered(@Param("id") Long id, @Param("at") Instant at);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Booking b
           SET b.deliveryAttempts = b.deliveryAttempts + 1,
               b.lastDeliveryError = :error,
               b.requiresAttention = true,
               b.attentionReason = :reason
           WHERE b.id = :id
           """)
    int markFulfilmentFailed(@Param("id") Long id, @Param("reason") String reason, @Param("error") String error);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE Booking b
           SET b.paymentStatus = :paymentStatus,
               b.refundId = :refundId,
               b.requiresAttention = :requiresAttention,
               b.attentionReason = :reason
           WHERE b.id = :id
           """)
    int recordRefund(@Param("id") Long id,
                     @Param("paymentStatus") PaymentStatus paymentStatus,
                     @Param("refundId") String refundId,
                     @Param("requiresAttention") boolean requiresAttention,
                     @Param("reason") String reason);
}
