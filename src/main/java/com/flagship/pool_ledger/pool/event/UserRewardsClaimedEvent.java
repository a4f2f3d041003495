package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
public class UserRewardsClaimedEvent implements PoolEvent {
    UUID eventId;
    Address owner;
    BigInteger amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "UserRewardsClaimed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return owner;
    }

    public static UserRewardsClaimedEvent of(Address owner, BigInteger amount) {
        return new UserRewardsClaimedEvent(UUID.randomUUID(), owner, amount, Instant.now());
    }
}
