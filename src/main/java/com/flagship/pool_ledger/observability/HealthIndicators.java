package com.flagship.pool_ledger.observability;

import com.flagship.pool_ledger.external.EpochOracle;
import com.flagship.pool_ledger.outbox.OutboxService;
import com.flagship.pool_ledger.pool.PoolEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the pool ledger.
 *
 * These health checks determine if the service is ready to accept traffic.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxService outboxService;
        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        public OutboxHealthIndicator(OutboxService outboxService) {
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            long backlogSize = outboxService.countUnpublished();

            Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("published", outboxService.getPublishedCount())
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }

    /**
     * Down when the epoch oracle cannot be read: deposits, withdrawals and claims would all fail.
     * Reports how far the oracle is ahead of the last processed epoch.
     */
    @Component("epochOracleHealth")
    public static class EpochOracleHealthIndicator implements HealthIndicator {

        private final EpochOracle epochOracle;
        private final PoolEngine poolEngine;

        public EpochOracleHealthIndicator(EpochOracle epochOracle, PoolEngine poolEngine) {
            this.epochOracle = epochOracle;
            this.poolEngine = poolEngine;
        }

        @Override
        public Health health() {
            try {
                long observed = epochOracle.currentEpoch();
                long processed = poolEngine.lastProcessedEpoch();
                return Health.up()
                        .withDetail("currentEpoch", observed)
                        .withDetail("lastProcessedEpoch", processed)
                        .withDetail("lag", Math.max(0, observed - processed))
                        .build();
            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Health indicator for Redis connectivity.
     * Used for idempotency key fast-path.
     */
    @Component("redisHealth")
    @ConditionalOnProperty(name = "pool.idempotency.redis-enabled", havingValue = "true", matchIfMissing = true)
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", "Idempotency receipts are still kept in process")
                            .build();
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();

                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return Health.down()
                            .withDetail("response", result != null ? result : "null")
                            .build();
                }

            } catch (Exception e) {
                // Redis being down is acceptable (in-process receipts still apply)
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Idempotency receipts are still kept in process")
                        .build();
            }
        }
    }
}
