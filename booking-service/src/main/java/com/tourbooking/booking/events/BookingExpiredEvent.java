package com.tourbooking.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Published when a pending booking's hold runs out before payment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingExpiredEvent {
    private Long bookingId;
    private String bookingReference;
    private Long userId;
    private Long resourceId;
    private Integer quantity;
    private Instant timestamp;
}
