package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class FeeUpdatedEvent implements PoolEvent {
    UUID eventId;
    Address operator;
    int previousFeeBps;
    int feeBps;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FeeUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return operator;
    }

    public static FeeUpdatedEvent of(Address operator, int previousFeeBps, int feeBps) {
        return new FeeUpdatedEvent(UUID.randomUUID(), operator, previousFeeBps, feeBps, Instant.now());
    }
}
