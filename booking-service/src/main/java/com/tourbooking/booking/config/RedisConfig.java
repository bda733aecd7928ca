package com.tourbooking.booking.config;

import com.tourbooking.booking.saga.HoldExpirationListener;
import com.tourbooking.common.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Subscribes the hold listener to key expiry events. Redis only emits them
 * when {@code notify-keyspace-events} includes {@code Ex}.
 */
@Slf4j
@Configuration
public class RedisConfig {

    @Value("${booking.hold.configure-keyspace-notifications:true}")
    private boolean configureKeyspaceNotifications;

    @Bean
    public RedisMessageListenerContainer holdExpiryListenerContainer(RedisConnectionFactory connectionFactory,
                                                                     HoldExpirationListener listener) {
        if (configureKeyspaceNotifications) {
            enableExpiryNotifications(connectionFactory);
        }
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(listener, new PatternTopic(Constants.REDIS_EXPIRED_EVENTS_PATTERN));
        return container;
    }

    private void enableExpiryNotifications(RedisConnectionFactory connectionFactory) {
        try (RedisConnection connection = connectionFactory.getConnection()) {
            connection.serverCommands().setConfig("notify-keyspace-events", "Ex");
            log.info("Enabled Redis keyspace notifications for expired keys");
        } catch (DataAccessException e) {
            // Managed Redis often forbids CONFIG; the recovery job still expires holds.
            log.warn("Could not enable Redis keyspace notifications: {}", e.getMessage());
        }
    }
}
