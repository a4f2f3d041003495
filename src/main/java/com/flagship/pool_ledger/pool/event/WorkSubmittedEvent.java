package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class WorkSubmittedEvent implements PoolEvent {
    UUID eventId;
    Address operator;
    int payloadSize;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WorkSubmitted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return operator;
    }

    public static WorkSubmittedEvent of(Address operator, int payloadSize) {
        return new WorkSubmittedEvent(UUID.randomUUID(), operator, payloadSize, Instant.now());
    }
}
