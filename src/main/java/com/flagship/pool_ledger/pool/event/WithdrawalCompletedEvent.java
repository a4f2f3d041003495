package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when matured withdrawal records are paid out.
 */
@Value
public class WithdrawalCompletedEvent implements PoolEvent {
    UUID eventId;
    Address owner;
    BigInteger amount;
    int releasedRecords;
    long epoch;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WithdrawalCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return owner;
    }

    public static WithdrawalCompletedEvent of(Address owner, BigInteger amount, int releasedRecords, long epoch) {
        return new WithdrawalCompletedEvent(UUID.randomUUID(), owner, amount, releasedRecords, epoch, Instant.now());
    }
}
