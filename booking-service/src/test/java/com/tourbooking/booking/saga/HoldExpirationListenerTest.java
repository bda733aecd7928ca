package com.tourbooking.booking.saga;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.connection.DefaultMessage;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HoldExpirationListenerTest {

    private static final byte[] CHANNEL = "__keyevent@0__:expired".getBytes(StandardCharsets.UTF_8);

    @Mock
    private BookingOrchestrator orchestrator;

    @InjectMocks
    private HoldExpirationListener listener;

    @Test
    @DisplayName("an expired hold key expires its booking")
    void onMessage_holdKey() {
        listener.onMessage(message("hold:42"), null);

        verify(orchestrator).expire(42L);
    }

    @Test
    @DisplayName("other expired keys are ignored")
    void onMessage_otherKey() {
        listener.onMessage(message("availability:7:2026-07-01"), null);

        verifyNoInteractions(orchestrator);
    }

    @Test
    @DisplayName("a failing expiry does not escape the listener")
    void onMessage_expiryFails() {
        when(orchestrator.expire(42L)).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> listener.onMessage(message("hold:42"), null)).doesNotThrowAnyException();
    }

    private static DefaultMessage message(String key) {
        return new DefaultMessage(CHANNEL, key.getBytes(StandardCharsets.UTF_8));
    }
}
