package com.flagship.split_ledger.observability;

import com.flagship.split_ledger.outbox.OutboxEventRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Actuator health contributors beyond the auto-configured ones.
 */
public class HealthIndicators {

    /**
     * WARNING above 1000 unpublished ledger events, DOWN above 10000.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long WARNING_THRESHOLD = 1_000;
        private static final long CRITICAL_THRESHOLD = 10_000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                Health.Builder builder;
                if (backlog < WARNING_THRESHOLD) {
                    builder = Health.up();
                } else if (backlog < CRITICAL_THRESHOLD) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.down();
                }
                return builder.withDetail("backlog", backlog).build();
            } catch (DataAccessException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so an outage degrades
     * rather than fails the service.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final RedisConnectionFactory connectionFactory;

        public RedisHealthIndicator(RedisConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
        }

        @Override
        public Health health() {
            try (RedisConnection connection = connectionFactory.getConnection()) {
                String pong = connection.ping();
                return "PONG".equals(pong)
                    ? Health.up().build()
                    : Health.status("DEGRADED").withDetail("response", String.valueOf(pong)).build();
            } catch (RuntimeException e) {
                return Health.status("DEGRADED")
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("fallback", "idempotency keys are checked in the database")
                    .build();
            }
        }
    }
}
