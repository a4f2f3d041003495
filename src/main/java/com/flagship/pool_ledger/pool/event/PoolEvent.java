package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for pool events.
 *
 * Events are facts: each one describes a state change that has already been applied.
 */
public interface PoolEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * The principal this event is about. Used as the Kafka partition key.
     */
    Address getSubject();

    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
