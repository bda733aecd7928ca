package com.tourbooking.booking.domain.repository;

import com.tourbooking.booking.domain.model.InventorySlot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Capacity counters are changed only by the guarded single-statement updates
 * below. Each returns the number of rows affected: 1 when the guard held,
 * 0 when it did not (or the slot does not exist). Row locking by the database
 * serializes concurrent updates on one slot and re-checks the guard.
 */
public interface InventorySlotRepository extends JpaRepository<InventorySlot, Long> {

    Optional<InventorySlot> findByResourceIdAndSlotDateAndTimeslot(Long resourceId, LocalDate slotDate, String timeslot);

    List<InventorySlot> findByResourceIdAndSlotDateBetweenAndActiveTrueOrderBySlotDateAscTimeslotAsc(
            Long resourceId, LocalDate startDate, LocalDate endDate);

    /**
     * Adds {@code quantity} to reserved capacity if the slot is active and has
     * at least that much free capacity.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE InventorySlot s
           SET s.reservedCapacity = s.reservedCapacity + :quantity
           WHERE s.resourceId = :resourceId
             AND s.slotDate = :date
             AND s.timeslot = :timeslot
             AND s.active = true
             AND s.totalCapacity - s.bookedCapacity - s.reservedCapacity >= :quantity
           """)
    int reserveCapacity(@Param("resourceId") Long resourceId,
                        @Param("date") LocalDate date,
                        @Param("timeslot") String timeslot,
                        @Param("quantity") int quantity);

    /** Moves {@code quantity} from reserved to booked. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE InventorySlot s
           SET s.reservedCapacity = s.reservedCapacity - :quantity,
               s.bookedCapacity = s.bookedCapacity + :quantity
           WHERE s.resourceId = :resourceId
             AND s.slotDate = :date
             AND s.timeslot = :timeslot
             AND s.reservedCapacity >= :quantity
           """)
    int confirmCapacity(@Param("resourceId") Long resourceId,
                        @Param("date") LocalDate date,
                        @Param("timeslot") String timeslot,
                        @Param("quantity") int quantity);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE InventorySlot s
           SET s.reservedCapacity = s.reservedCapacity - :quantity
           WHERE s.resourceId = :resourceId
             AND s.slotDate = :date
             AND s.timeslot = :timeslot
             AND s.reservedCapacity >= :quantity
           """)
    int releaseReserved(@Param("resourceId") Long resourceId,
                        @Param("date") LocalDate date,
                        @Param("timeslot") String timeslot,
                        @Param("quantity") int quantity);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE InventorySlot s
           SET s.bookedCapacity = s.bookedCapacity - :quantity
           WHERE s.resourceId = :resourceId
             AND s.slotDate = :date
             AND s.timeslot = :timeslot
             AND s.bookedCapacity >= :quantity
           """)
    int cancelBooked(@Param("resourceId") Long resourceId,
                     @Param("date") LocalDate date,
                     @Param("timeslot") String timeslot,
                     @Param("quantity") int quantity);

    /** Used only after {@link #releaseReserved} refused to go negative. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE InventorySlot s
           SET s.reservedCapacity = 0
           WHERE s.resourceId = :resourceId
             AND s.slotDate = :date
             AND s.timeslot = :timeslot
           """)
    int floorReserved(@Param("resourceId") Long resourceId,
                      @Param("date") LocalDate date,
                      @Param("timeslot") String timeslot);

    /** Used only after {@link #cancelBooked} refused to go negative. */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE InventorySlot s
           SET s.bookedCapacity = 0
           WHERE s.resourceId = :resourceId
             AND s.slotDate = :date
             AND s.timeslot = :timeslot
           """)
    int floorBooked(@Param("resourceId") Long resourceId,
                    @Param("date") LocalDate date,
                    @Param("timeslot") String timeslot);
}
