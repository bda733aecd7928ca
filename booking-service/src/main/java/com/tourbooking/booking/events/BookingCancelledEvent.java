package com.tourbooking.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCancelledEvent {
    private Long bookingId;
    private String bookingReference;
    private Long userId;
    private Long resourceId;
    private String previousStatus;
    private String cancelledBy;
    private String reason;
    private boolean refundRequested;
    private Instant timestamp;
}
