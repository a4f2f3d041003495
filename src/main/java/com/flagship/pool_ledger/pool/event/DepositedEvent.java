package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when funds enter the pool as pending stake.
 * {@code lockEpoch} is the epoch at which the depositor's whole pending batch becomes locked.
 */
@Value
public class DepositedEvent implements PoolEvent {
    UUID eventId;
    Address depositor;
    BigInteger amount;
    long lockEpoch;
    Instant occurredAt;

    public static final String EVENT_TYPE = "Deposited";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return depositor;
    }

    public static DepositedEvent of(Address depositor, BigInteger amount, long lockEpoch) {
        return new DepositedEvent(UUID.randomUUID(), depositor, amount, lockEpoch, Instant.now());
    }
}
