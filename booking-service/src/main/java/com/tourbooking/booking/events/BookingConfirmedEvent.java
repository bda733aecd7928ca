package com.tourbooking.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Published on {@code booking-confirmed} once payment is verified.
 * Consumed by analytics and marketing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingConfirmedEvent {
    private Long bookingId;
    private String bookingReference;
    private Long userId;
    private Long resourceId;
    private LocalDate slotDate;
    private String timeslot;
    private Integer quantity;
    private BigDecimal totalAmount;
    private BigDecimal commission;
    private String currency;
    private Instant timestamp;
}
