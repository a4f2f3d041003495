package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Event published when the operator names a successor, or clears the proposal
 * (candidate is the zero address).
 */
@Value
public class OperatorProposedEvent implements PoolEvent {
    UUID eventId;
    Address operator;
    Address candidate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OperatorProposed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return operator;
    }

    public static OperatorProposedEvent of(Address operator, Address candidate) {
        return new OperatorProposedEvent(UUID.randomUUID(), operator, candidate, Instant.now());
    }
}
