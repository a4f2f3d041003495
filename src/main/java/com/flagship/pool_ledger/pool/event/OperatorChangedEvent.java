package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class OperatorChangedEvent implements PoolEvent {
    UUID eventId;
    Address previousOperator;
    Address operator;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OperatorChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return operator;
    }

    public static OperatorChangedEvent of(Address previousOperator, Address operator) {
        return new OperatorChangedEvent(UUID.randomUUID(), previousOperator, operator, Instant.now());
    }
}
