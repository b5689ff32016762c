package com.flagship.pledge_compliance.observability;

import com.flagship.pledge_compliance.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators.
 *
 * Redis is reported DEGRADED rather than DOWN: pledge idempotency falls back to
 * the database unique key when the cache is unreachable.
 */
public class HealthIndicators {

    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(maxRetries);

                Health.Builder builder;
                if (backlog >= BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.down();
                } else if (backlog >= BACKLOG_WARNING_THRESHOLD || deadLettered > 0) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }
                return builder
                        .withDetail("backlogSize", backlog)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
            if (factory == null) {
                return degraded("No connection factory configured");
            }
            try (RedisConnection connection = factory.getConnection()) {
                String pong = connection.ping();
                return "PONG".equals(pong)
                        ? Health.up().withDetail("response", pong).build()
                        : degraded("Unexpected ping response: " + pong);
            } catch (Exception e) {
                return degraded(describe(e));
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Idempotency checks fall back to the database")
                    .build();
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                int metricCount = kafkaTemplate.metrics().size();
                return metricCount > 0
                        ? Health.up().withDetail("metricsCount", metricCount).build()
                        : Health.down().withDetail("error", "No Kafka producer connection yet").build();
            } catch (Exception e) {
                return Health.down().withDetail("error", describe(e)).build();
            }
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
