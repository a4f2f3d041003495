package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when stake leaves the reward-earning pool and joins the withdrawal queue.
 */
@Value
public class WithdrawalRequestedEvent implements PoolEvent {
    UUID eventId;
    Address owner;
    BigInteger amount;
    BigInteger fromPending;
    BigInteger fromLocked;
    long availableEpoch;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WithdrawalRequested";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return owner;
    }

    public static WithdrawalRequestedEvent of(Address owner, BigInteger fromPending, BigInteger fromLocked,
                                              long availableEpoch) {
        return new WithdrawalRequestedEvent(UUID.randomUUID(), owner, fromPending.add(fromLocked),
            fromPending, fromLocked, availableEpoch, Instant.now());
    }
}
