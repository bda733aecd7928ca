package com.tourbooking.booking.domain.model;

import java.time.Instant;

/**
 * Short-lived claim on reserved capacity, stored in Redis until it is
 * resolved or its TTL elapses.
 */
public record Hold(Long bookingId, SlotKey slotKey, int quantity, Instant expiresAt) {
}
