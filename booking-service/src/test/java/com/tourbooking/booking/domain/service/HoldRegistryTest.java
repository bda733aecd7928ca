package com.tourbooking.booking.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tourbooking.booking.domain.model.Hold;
import com.tourbooking.booking.domain.model.SlotKey;
import com.tourbooking.booking.exception.CollaboratorUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HoldRegistryTest {

    private static final Instant NOW = Instant.parse("2026-06-01T10:00:00Z");
    private static final SlotKey SLOT = new SlotKey(7L, LocalDate.of(2026, 7, 1), "10:00");

    @Mock
    private StringRedisTemplate stringRedisTemplate;
    @Mock
    private ValueOperations<String, String> valueOps;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private HoldRegistry holdRegistry;

    @BeforeEach
    void setUp() {
        lenient().when(stringRedisTemplate.opsForValue()).thenReturn(valueOps);
        holdRegistry = new HoldRegistry(stringRedisTemplate, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("place stores the hold under hold:{bookingId} with the given TTL")
    void place_storesWithTtl() {
        // when
        Hold hold = holdRegistry.place(42L, SLOT, 2, Duration.ofMinutes(15));

        // then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("hold:42"), json.capture(), eq(Duration.ofMinutes(15)));
        assertThat(hold.expiresAt()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
        assertThat(json.getValue()).contains("\"bookingId\":42");
    }

    @Test
    @DisplayName("get reads back what place stored")
    void get_readsStoredHold() throws Exception {
        // given
        Hold stored = new Hold(42L, SLOT, 2, NOW.plusSeconds(900));
        when(valueOps.get("hold:42")).thenReturn(objectMapper.writeValueAsString(stored));

        // when
        Optional<Hold> hold = holdRegistry.get(42L);

        // then
        assertThat(hold).contains(stored);
    }

    @Test
    @DisplayName("get treats an unreadable value as no hold")
    void get_unreadableValue() {
        when(valueOps.get("hold:42")).thenReturn("{not json");

        assertThat(holdRegistry.get(42L)).isEmpty();
    }

    @Test
    @DisplayName("place fails with 503 when Redis is down")
    void place_redisDown() {
        doThrow(new RedisConnectionFailureException("down"))
                .when(valueOps).set(anyString(), anyString(), any(Duration.class));

        assertThatThrownBy(() -> holdRegistry.place(42L, SLOT, 2, Duration.ofMinutes(15)))
                .isInstanceOf(CollaboratorUnavailableException.class);
    }

    @Test
    @DisplayName("remove reports whether this call deleted the key")
    void remove_reportsDeletion() {
        when(stringRedisTemplate.delete("hold:42")).thenReturn(true, false);

        assertThat(holdRegistry.remove(42L)).isTrue();
        assertThat(holdRegistry.remove(42L)).isFalse();
    }

    @Test
    @DisplayName("remove reports false when Redis is down")
    void remove_redisDown() {
        when(stringRedisTemplate.delete("hold:42")).thenThrow(new RedisConnectionFailureException("down"));

        assertThat(holdRegistry.remove(42L)).isFalse();
    }

    @Test
    @DisplayName("bookingIdFromKey accepts only hold keys")
    void bookingIdFromKey() {
        assertThat(HoldRegistry.bookingIdFromKey("hold:42")).contains(42L);
        assertThat(HoldRegistry.bookingIdFromKey("availability:7:2026-07-01")).isEmpty();
        assertThat(HoldRegistry.bookingIdFromKey("hold:abc")).isEmpty();
        assertThat(HoldRegistry.bookingIdFromKey(null)).isEmpty();
    }
}
