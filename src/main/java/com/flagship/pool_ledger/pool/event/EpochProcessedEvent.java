package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when the epoch cursor advances.
 * Only emitted for real transitions, never for redundant calls at the same epoch.
 */
@Value
public class EpochProcessedEvent implements PoolEvent {
    UUID eventId;
    Address triggeredBy;
    long previousEpoch;
    long epoch;
    BigInteger promotedAmount;
    int promotedParticipants;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EpochProcessed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return triggeredBy;
    }

    public static EpochProcessedEvent of(Address triggeredBy, long previousEpoch, long epoch,
                                         BigInteger promotedAmount, int promotedParticipants) {
        return new EpochProcessedEvent(UUID.randomUUID(), triggeredBy, previousEpoch, epoch, promotedAmount,
            promotedParticipants, Instant.now());
    }
}
