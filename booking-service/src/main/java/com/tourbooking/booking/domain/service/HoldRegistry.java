package com.tourbooking.booking.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tourbooking.booking.domain.model.Hold;
import com.tourbooking.booking.domain.model.SlotKey;
import com.tourbooking.booking.exception.CollaboratorUnavailableException;
import com.tourbooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Reservation holds as Redis keys {@code hold:{bookingId}} with a TTL. Redis
 * drops the key on expiry and publishes a keyspace event, which
 * {@link com.tourbooking.booking.saga.HoldExpirationListener} turns into a
 * booking expiry. A missing hold is never an error here; callers decide what
 * it means from the booking status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HoldRegistry {

    static final String REDIS = "redis";

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Hold place(Long bookingId, SlotKey slotKey, int quantity, Duration ttl) {
        Hold hold = new Hold(bookingId, slotKey, quantity, Instant.now(clock).plus(ttl));
        try {
            stringRedisTemplate.opsForValue().set(keyFor(bookingId), objectMapper.writeValueAsString(hold), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Hold for booking " + bookingId + " could not be serialized", e);
        } catch (DataAccessException e) {
            log.error("Failed to place hold for booking {}", bookingId, e);
            throw new CollaboratorUnavailableException(REDIS, e);
        }
        log.debug("Placed hold for booking {} on {} until {}", bookingId, slotKey, hold.expiresAt());
        return hold;
    }

    public Optional<Hold> get(Long bookingId) {
        try {
            String json = stringRedisTemplate.opsForValue().get(keyFor(bookingId));
            return json == null ? Optional.empty() : Optional.of(objectMapper.readValue(json, Hold.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable hold for booking {}: {}", bookingId, e.getMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            throw new CollaboratorUnavailableException(REDIS, e);
        }
    }

    /**
     * @return true only for the caller whose delete actually removed the key
     */
    public boolean remove(Long bookingId) {
        try {
            boolean removed = Boolean.TRUE.equals(stringRedisTemplate.delete(keyFor(bookingId)));
            log.debug("Hold for booking {} {}", bookingId, removed ? "removed" : "already gone");
            return removed;
        } catch (DataAccessException e) {
            // the TTL still removes it; expiry of a non-pending booking is a no-op
            log.warn("Failed to remove hold for booking {}: {}", bookingId, e.getMessage());
            return false;
        }
    }

    public static String keyFor(Long bookingId) {
        return Constants.HOLD_KEY_PREFIX + bookingId;
    }

    /**
     * Booking id encoded in a hold key, or empty for any other key.
     */
    public static Optional<Long> bookingIdFromKey(String key) {
        if (key == null || !key.startsWith(Constants.HOLD_KEY_PREFIX)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(key.substring(Constants.HOLD_KEY_PREFIX.length())));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
