package com.flagship.pool_ledger.pool;

import lombok.Getter;

import java.math.BigInteger;

/**
 * Per-depositor balances.
 *
 * Invariant: {@code active == (pendingAmount > 0 || lockedAmount > 0)}, and while active
 * {@code rosterIndex} is this participant's slot in {@link PoolState#getRoster()}.
 * Mutated only by the pool components through {@link PoolState}.
 */
@Getter
public class Participant {

    private final Address identity;
    private BigInteger pendingAmount = BigInteger.ZERO;
    private BigInteger lockedAmount = BigInteger.ZERO;
    private long lockEpoch;
    private int rosterIndex = -1;
    private boolean active;
    private BigInteger unclaimedReward = BigInteger.ZERO;

    Participant(Address identity) {
        this.identity = identity;
    }

    /**
     * Rebuilds a participant from stored balances.
     */
    public static Participant restore(Address identity,
                                      BigInteger pendingAmount,
                                      BigInteger lockedAmount,
                                      long lockEpoch,
                                      int rosterIndex,
                                      boolean active,
                                      BigInteger unclaimedReward) {
        Participant participant = new Participant(identity);
        participant.pendingAmount = pendingAmount;
        participant.lockedAmount = lockedAmount;
        participant.lockEpoch = lockEpoch;
        participant.rosterIndex = rosterIndex;
        participant.active = active;
        participant.unclaimedReward = unclaimedReward;
        return participant;
    }

    Participant copy() {
        Participant copy = new Participant(identity);
        copy.pendingAmount = pendingAmount;
        copy.lockedAmount = lockedAmount;
        copy.lockEpoch = lockEpoch;
        copy.rosterIndex = rosterIndex;
        copy.active = active;
        copy.unclaimedReward = unclaimedReward;
        return copy;
    }

    boolean sameBalancesAs(Participant other) {
        return pendingAmount.equals(other.pendingAmount)
            && lockedAmount.equals(other.lockedAmount)
            && lockEpoch == other.lockEpoch
            && rosterIndex == other.rosterIndex
            && active == other.active
            && unclaimedReward.equals(other.unclaimedReward);
    }

    boolean hasStake() {
        return pendingAmount.signum() > 0 || lockedAmount.signum() > 0;
    }

    void setPendingAmount(BigInteger pendingAmount) {
        this.pendingAmount = pendingAmount;
    }

    void setLockedAmount(BigInteger lockedAmount) {
        this.lockedAmount = lockedAmount;
    }

    void setLockEpoch(long lockEpoch) {
        this.lockEpoch = lockEpoch;
    }

    void setRosterIndex(int rosterIndex) {
        this.rosterIndex = rosterIndex;
    }

    void setActive(boolean active) {
        this.active = active;
    }

    void setUnclaimedReward(BigInteger unclaimedReward) {
        this.unclaimedReward = unclaimedReward;
    }
}
