package com.tourbooking.booking.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tourbooking.booking.domain.model.AvailabilityView;
import com.tourbooking.booking.domain.model.SlotKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis read-through cache for {@link AvailabilityView}. Advisory only:
 * every failure is logged and treated as a miss, and entries are evicted on
 * writes rather than updated.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityCache {

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${booking.availability.cache-ttl-seconds:300}")
    private long cacheTtlSeconds;

    public Optional<AvailabilityView> get(SlotKey slotKey) {
        try {
            String json = stringRedisTemplate.opsForValue().get(slotKey.cacheKey());
            if (json == null) {
                return Optional.empty();
            }
            log.debug("Availability cache hit for {}", slotKey);
            return Optional.of(objectMapper.readValue(json, AvailabilityView.class));
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Availability cache read failed for {}, reading database: {}", slotKey, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(SlotKey slotKey, AvailabilityView view) {
        try {
            stringRedisTemplate.opsForValue().set(slotKey.cacheKey(), objectMapper.writeValueAsString(view),
                    Duration.ofSeconds(cacheTtlSeconds));
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Availability cache write failed for {}: {}", slotKey, e.getMessage());
        }
    }

    public void evict(SlotKey slotKey) {
        try {
            stringRedisTemplate.delete(slotKey.cacheKey());
        } catch (DataAccessException e) {
            // entry still expires on its TTL
            log.warn("Availability cache eviction failed for {}: {}", slotKey, e.getMessage());
        }
    }
}
