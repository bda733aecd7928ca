package com.tourbooking.booking.saga;

import com.tourbooking.booking.domain.service.HoldRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Turns Redis {@code expired} keyspace events for {@code hold:{bookingId}}
 * into booking expiry. Events are best effort; {@link SagaRecoveryJob}
 * expires anything a lost event leaves pending.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HoldExpirationListener implements MessageListener {

    private final BookingOrchestrator orchestrator;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String expiredKey = new String(message.getBody(), StandardCharsets.UTF_8);
        Optional<Long> bookingId = HoldRegistry.bookingIdFromKey(expiredKey);
        if (bookingId.isEmpty()) {
            return;
        }
        log.info("Hold expired for booking {}", bookingId.get());
        try {
            orchestrator.expire(bookingId.get());
        } catch (RuntimeException e) {
            log.error("Expiry of booking {} failed, recovery job will retry", bookingId.get(), e);
        }
    }
}
