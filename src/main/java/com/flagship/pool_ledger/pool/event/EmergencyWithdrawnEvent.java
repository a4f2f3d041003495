package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Event published when a participant sweeps everything out through the emergency exit.
 */
@Value
public class EmergencyWithdrawnEvent implements PoolEvent {
    UUID eventId;
    Address owner;
    BigInteger total;
    BigInteger pending;
    BigInteger locked;
    BigInteger queued;
    BigInteger unclaimedReward;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EmergencyWithdrawn";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return owner;
    }

    public static EmergencyWithdrawnEvent of(Address owner, BigInteger pending, BigInteger locked,
                                             BigInteger queued, BigInteger unclaimedReward) {
        BigInteger total = pending.add(locked).add(queued).add(unclaimedReward);
        return new EmergencyWithdrawnEvent(UUID.randomUUID(), owner, total, pending, locked, queued,
            unclaimedReward, Instant.now());
    }
}
