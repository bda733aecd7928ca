package com.tourbooking.common.util;

/**
 * Key prefixes and reference formats shared across services.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String HOLD_KEY_PREFIX = "hold:";
    public static final String AVAILABILITY_CACHE_PREFIX = "availability:";

    public static final String BOOKING_REFERENCE_PREFIX = "BK";
    public static final String TICKET_NUMBER_PREFIX = "HB";

    public static final String REDIS_EXPIRED_EVENTS_PATTERN = "__keyevent@*__:expired";
}
