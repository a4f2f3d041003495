package com.flagship.pool_ledger.pool;

import lombok.Value;

import java.math.BigInteger;

/**
 * Promotes pending stake to locked once its lock epoch has arrived.
 *
 * The transition is idempotent and monotonic: observing an epoch at or below the cursor
 * changes nothing, so redundant or repeated calls from different operations converge on
 * the same state.
 */
public class EpochProcessor {

    public EpochTransition process(PoolState state, long observedEpoch) {
        long previous = state.getLastProcessedEpoch();
        if (observedEpoch <= previous) {
            return EpochTransition.unchanged(previous);
        }

        BigInteger promoted = BigInteger.ZERO;
        int promotedParticipants = 0;
        for (Address identity : state.getRoster()) {
            Participant participant = state.getParticipants().get(identity);
            BigInteger pending = participant.getPendingAmount();
            if (pending.signum() > 0 && participant.getLockEpoch() <= observedEpoch) {
                participant.setLockedAmount(participant.getLockedAmount().add(pending));
                participant.setPendingAmount(BigInteger.ZERO);
                promoted = promoted.add(pending);
                promotedParticipants++;
            }
        }

        state.setTotalPending(state.getTotalPending().subtract(promoted));
        state.setTotalLocked(state.getTotalLocked().add(promoted));
        state.advanceEpochCursor(observedEpoch);

        return new EpochTransition(previous, observedEpoch, promoted, promotedParticipants);
    }

    /**
     * Outcome of one {@link #process} call.
     */
    @Value
    public static class EpochTransition {
        long previousEpoch;
        long epoch;
        BigInteger promotedAmount;
        int promotedParticipants;

        static EpochTransition unchanged(long epoch) {
            return new EpochTransition(epoch, epoch, BigInteger.ZERO, 0);
        }

        public boolean isAdvanced() {
            return epoch > previousEpoch;
        }
    }
}
