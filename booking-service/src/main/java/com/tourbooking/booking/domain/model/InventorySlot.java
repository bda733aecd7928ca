package com.tourbooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Capacity counters for one bookable slot.
 * Counters are written only through the guarded updates in
 * {@link com.tourbooking.booking.domain.repository.InventorySlotRepository}.
 */
@Entity
@Table(name = "inventory_slots",
        uniqueConstraints = @UniqueConstraint(name = "uk_inventory_slot_key",
                columnNames = {"resource_id", "slot_date", "timeslot"}),
        indexes = @Index(name = "idx_inventory_slot_date", columnList = "slot_date"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventorySlot {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "resource_id", nullable = false)
    private Long resourceId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Builder.Default
    @Column(name = "timeslot", nullable = false, length = 32)
    private String timeslot = "";

    @Column(name = "total_capacity", nullable = false)
    private Integer totalCapacity;

    @Builder.Default
    @Column(name = "booked_capacity", nullable = false)
    private Integer bookedCapacity = 0;

    @Builder.Default
    @Column(name = "reserved_capacity", nullable = false)
    private Integer reservedCapacity = 0;

    @Column(name = "base_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal basePrice;

    @Column(name = "final_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal finalPrice;

    @Builder.Default
    @Column(name = "currency", nullable = false, length = 3)
    private String currency = "EUR";

    @Builder.Default
    @Column(name = "min_booking", nullable = false)
    private Integer minBooking = 1;

    @Builder.Default
    @Column(name = "max_booking", nullable = false)
    private Integer maxBooking = 10;

    @Builder.Default
    @Column(name = "cutoff_hours", nullable = false)
    private Integer cutoffHours = 0;

    @Builder.Default
    @Column(name = "active", nullable = false)
    private Boolean active = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (timeslot == null) {
            timeslot = "";
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public int getAvailableCapacity() {
        return totalCapacity - bookedCapacity - reservedCapacity;
    }

    public SlotKey slotKey() {
        return new SlotKey(resourceId, slotDate, timeslot);
    }
}
