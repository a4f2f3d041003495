package com.flagship.pool_ledger.pool.event;

import com.flagship.pool_ledger.pool.Address;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Event published for every settlement claim, including claims that yielded nothing.
 *
 * {@code undistributed} is the part of the depositor share left in custody by floor
 * rounding, or all of it when nothing was locked.
 */
@Value
public class RewardsClaimedEvent implements PoolEvent {
    UUID eventId;
    Address caller;
    List<Long> epochIds;
    BigInteger totalReward;
    BigInteger operatorFee;
    BigInteger distributed;
    BigInteger undistributed;
    int recipients;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RewardsClaimed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public Address getSubject() {
        return caller;
    }

    public static RewardsClaimedEvent of(Address caller, List<Long> epochIds, BigInteger totalReward,
                                         BigInteger operatorFee, BigInteger distributed,
                                         BigInteger undistributed, int recipients) {
        return new RewardsClaimedEvent(UUID.randomUUID(), caller, List.copyOf(epochIds), totalReward,
            operatorFee, distributed, undistributed, recipients, Instant.now());
    }
}
