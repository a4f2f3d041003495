package com.flagship.pool_ledger.pool;

import lombok.Value;

import java.math.BigInteger;

/**
 * Splits a settlement reward into the operator fee and pro-rata depositor credits.
 *
 * Only locked stake participates. Each share is floored, so up to one base unit per
 * recipient stays in custody as untracked dust.
 */
public class RewardDistributor {

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(OperatorState.BPS_DENOMINATOR);

    /**
     * Credits {@code totalReward} minus the operator fee to the unclaimed rewards of every
     * locked holder, proportionally to {@code lockedAmount / totalLocked}. Paying the fee
     * out is left to the caller.
     */
    public Allocation allocate(PoolState state, BigInteger totalReward) {
        if (totalReward.signum() < 0) {
            throw new IllegalArgumentException("Reward cannot be negative: " + totalReward);
        }
        if (totalReward.signum() == 0) {
            return Allocation.empty();
        }

        BigInteger operatorFee = totalReward
            .multiply(BigInteger.valueOf(state.getOperatorState().getFeeBps()))
            .divide(BPS_DENOMINATOR);
        BigInteger depositorReward = totalReward.subtract(operatorFee);
        BigInteger totalLocked = state.getTotalLocked();

        if (totalLocked.signum() == 0) {
            return new Allocation(totalReward, operatorFee, BigInteger.ZERO, depositorReward, 0);
        }

        BigInteger distributed = BigInteger.ZERO;
        int recipients = 0;
        for (Address identity : state.getRoster()) {
            Participant participant = state.getParticipants().get(identity);
            BigInteger locked = participant.getLockedAmount();
            if (locked.signum() == 0) {
                continue;
            }
            BigInteger share = depositorReward.multiply(locked).divide(totalLocked);
            if (share.signum() > 0) {
                participant.setUnclaimedReward(participant.getUnclaimedReward().add(share));
                distributed = distributed.add(share);
                recipients++;
            }
        }
        state.setTotalUnclaimedReward(state.getTotalUnclaimedReward().add(distributed));

        return new Allocation(totalReward, operatorFee, distributed, depositorReward.subtract(distributed), recipients);
    }

    /**
     * Zeroes the owner's unclaimed reward and returns it.
     *
     * @throws PoolException {@link PoolErrorCode#NO_REWARDS} if there is nothing to pay
     */
    public BigInteger takeUnclaimed(PoolState state, Address owner) {
        Participant participant = state.findParticipant(owner)
            .filter(p -> p.getUnclaimedReward().signum() > 0)
            .orElseThrow(() -> new PoolException(PoolErrorCode.NO_REWARDS, "No unclaimed rewards for " + owner));

        BigInteger reward = participant.getUnclaimedReward();
        participant.setUnclaimedReward(BigInteger.ZERO);
        state.setTotalUnclaimedReward(state.getTotalUnclaimedReward().subtract(reward));
        state.pruneIfDormant(participant);
        return reward;
    }

    @Value
    public static class Allocation {
        BigInteger totalReward;
        BigInteger operatorFee;
        BigInteger distributed;
        BigInteger undistributed;
        int recipients;

        static Allocation empty() {
            return new Allocation(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, 0);
        }
    }
}
