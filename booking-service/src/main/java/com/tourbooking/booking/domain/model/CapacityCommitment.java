package com.tourbooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Records how much capacity a booking holds against which slot. Each counter
 * change is paired with a conditional state transition of this row in the
 * same transaction, so a duplicate confirm/release/cancel changes nothing.
 */
@Entity
@Table(name = "capacity_commitments", indexes = {
        @Index(name = "idx_commitment_state", columnList = "state,created_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CapacityCommitment {

    @Id
    @Column(name = "booking_id")
    private Long bookingId;

    @Column(name = "resource_id", nullable = false)
    private Long resourceId;

    @Column(name = "slot_date", nullable = false)
    private LocalDate slotDate;

    @Column(name = "timeslot", nullable = false, length = 32)
    private String timeslot;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private CommitmentState state;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    public SlotKey slotKey() {
        return new SlotKey(resourceId, slotDate, timeslot);
    }

    public enum CommitmentState {
        RESERVED,
        CONFIRMED,
        RELEASED,
        CANCELLED
    }
}
