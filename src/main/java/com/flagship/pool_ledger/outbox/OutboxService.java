package com.flagship.pool_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pool_ledger.pool.event.PoolEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for writing pool events to the outbox.
 *
 * Called inside the transaction that commits the pool state, so the rule holds:
 * "If the operation commits, its events are guaranteed to be written."
 * Nothing is ever dropped; published rows are purged after {@code outbox.retention-hours}.
 *
 * Events are NOT published directly to Kafka here. That's done by the
 * OutboxPublisher, which runs as a background process.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Value("${outbox.retention-hours:168}")
    private long retentionHours;

    /**
     * Saves the events of one operation within the current transaction.
     *
     * IMPORTANT: This method must be called within an existing transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void saveEvents(List<PoolEvent> events) {
        for (PoolEvent event : events) {
            OutboxEvent outboxEvent = OutboxEvent.create(event.getEventId(), event.getSubject().toString(),
                event.getEventType(), serializePayload(event));
            repository.save(OutboxEventEntity.fromDomain(outboxEvent));
            log.debug("Saved outbox event: type={}, subject={}", event.getEventType(), event.getSubject());
        }
    }

    /**
     * Oldest unpublished events first, skipping dead-lettered ones.
     * Uses SELECT FOR UPDATE SKIP LOCKED to allow concurrent publishers.
     *
     * @param limit Maximum number of events to fetch
     * @param maxRetries Retry count at which an event counts as dead-lettered
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit, int maxRetries) {
        return repository.findUnpublishedEventsForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * Records a failed publish attempt.
     *
     * @return the event after the attempt, or empty if it no longer exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<OutboxEvent> markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            OutboxEventEntity saved = repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, saved.getRetryCount(), errorMessage);
            return saved.toDomain();
        });
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    @Transactional(readOnly = true)
    public long countDeadLettered(int maxRetries) {
        return repository.countDeadLettered(maxRetries);
    }

    @Transactional(readOnly = true)
    public Optional<Instant> findOldestUnpublishedCreatedAt() {
        return repository.findOldestUnpublishedCreatedAt();
    }

    @Transactional(readOnly = true)
    public long getPublishedCount() {
        return repository.countByPublishedAtIsNotNull();
    }

    /**
     * Deletes published events past the retention window. Unpublished events are never deleted.
     */
    @Scheduled(fixedRateString = "${outbox.cleanup-interval-ms:3600000}")
    @Transactional
    public void purgePublished() {
        Instant cutoff = Instant.now().minus(Duration.ofHours(retentionHours));
        int deleted = repository.deletePublishedEventsBefore(cutoff);
        if (deleted > 0) {
            log.info("Purged {} published outbox events older than {}", deleted, cutoff);
        }
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
