package com.tourbooking.booking.domain.model;

import com.tourbooking.common.util.Constants;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Identity of a capacity slot: resource x date x optional timeslot.
 * A whole-day slot carries an empty timeslot so the key is never null in storage.
 */
public record SlotKey(Long resourceId, LocalDate date, String timeslot) {

    public SlotKey {
        Objects.requireNonNull(resourceId, "resourceId");
        Objects.requireNonNull(date, "date");
        timeslot = timeslot == null ? "" : timeslot.trim();
    }

    public static SlotKey wholeDay(Long resourceId, LocalDate date) {
        return new SlotKey(resourceId, date, "");
    }

    public String cacheKey() {
        String base = Constants.AVAILABILITY_CACHE_PREFIX + resourceId + ":" + date;
        return timeslot.isEmpty() ? base : base + ":" + timeslot;
    }

    /**
     * Moment the slot begins. Timeslots look like {@code 10:00} or {@code 10:00-12:00};
     * anything unparseable, and whole-day slots, start at midnight.
     */
    public Instant startsAt(ZoneId zone) {
        return date.atTime(startTime()).atZone(zone).toInstant();
    }

    private LocalTime startTime() {
        if (timeslot.isEmpty()) {
            return LocalTime.MIDNIGHT;
        }
        int dash = timeslot.indexOf('-');
        String first = dash > 0 ? timeslot.substring(0, dash).trim() : timeslot;
        try {
            return LocalTime.parse(first);
        } catch (DateTimeParseException e) {
            return LocalTime.MIDNIGHT;
        }
    }

    @Override
    public String toString() {
        return resourceId + "/" + date + (timeslot.isEmpty() ? "" : "/" + timeslot);
    }
}
