package com.flagship.pool_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in the outbox for publication to Kafka.
 *
 * Outbox rows are written in the same transaction as the pool state they describe, so an
 * operation that rolls back leaves nothing behind and one that commits always has its
 * events stored.
 */
@Value
public class OutboxEvent {
    UUID id;
    String subject;            // participant address, used as the Kafka key
    String eventType;          // e.g., "Deposited"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent create(UUID id, String subject, String eventType, String payload) {
        return new OutboxEvent(id, subject, eventType, payload, Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
