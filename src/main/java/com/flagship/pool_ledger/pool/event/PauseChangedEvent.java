package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PauseChangedEvent implements PoolEvent {
    UUID eventId;
    Address operator;
    boolean paused;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PauseChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return operator;
    }

    public static PauseChangedEvent of(Address operator, boolean paused) {
        return new PauseChangedEvent(UUID.randomUUID(), operator, paused, Instant.now());
    }
}
