package com.flagship.pool_ledger.observability;

import com.flagship.pool_ledger.outbox.OutboxService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the event outbox.
 *
 * - Backlog size: how many events are waiting to be published
 * - Oldest event age: how long the oldest event has been waiting
 * - Dead-lettered count: events that exceeded max retries
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxService outboxService;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    // Cached values updated periodically
    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong failedEventCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", failedEventCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    /**
     * Refreshes the cached metric values. Called periodically by the scheduler.
     */
    public void refreshMetrics() {
        long unpublished = outboxService.countUnpublished();
        backlogSize.set(unpublished);

        outboxService.findOldestUnpublishedCreatedAt()
                .ifPresentOrElse(
                        oldest -> {
                            long ageSeconds = Duration.between(oldest, Instant.now()).getSeconds();
                            oldestEventAgeSeconds.set(Math.max(0, ageSeconds));
                        },
                        () -> oldestEventAgeSeconds.set(0)
                );

        long failed = outboxService.countDeadLettered(maxRetries);
        failedEventCount.set(failed);

        log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                unpublished, oldestEventAgeSeconds.get(), failed);
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "event_type", eventType
        ).increment();
    }
}
