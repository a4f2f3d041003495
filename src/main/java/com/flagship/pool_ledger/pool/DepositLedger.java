package com.flagship.pool_ledger.pool;

import java.math.BigInteger;
import java.util.List;

/**
 * Pending and locked balances plus the roster of active participants.
 *
 * The roster is an indexable sequence with each participant's slot stored on the
 * participant, so enrolment appends and retirement swaps the last entry into the freed
 * slot. Both are O(1).
 */
public class DepositLedger {

    /**
     * Adds {@code amount} to the depositor's pending batch.
     *
     * An existing pending batch is merged, keeping the later of its lock epoch and
     * {@code currentEpoch + 1}, so a participant never holds more than one batch.
     *
     * @return the lock epoch of the merged batch
     */
    public long deposit(PoolState state, Address depositor, BigInteger amount, long currentEpoch) {
        requirePositive(amount);

        Participant participant = state.participantFor(depositor);
        long lockEpoch = currentEpoch + 1;
        if (participant.getPendingAmount().signum() > 0) {
            lockEpoch = Math.max(lockEpoch, participant.getLockEpoch());
        }

        participant.setPendingAmount(participant.getPendingAmount().add(amount));
        participant.setLockEpoch(lockEpoch);
        state.setTotalPending(state.getTotalPending().add(amount));
        enroll(state, participant);

        return lockEpoch;
    }

    void enroll(PoolState state, Participant participant) {
        if (participant.isActive()) {
            return;
        }
        List<Address> roster = state.mutableRoster();
        participant.setRosterIndex(roster.size());
        participant.setActive(true);
        roster.add(participant.getIdentity());
    }

    /**
     * Removes a participant from the roster once it has neither pending nor locked stake.
     */
    void retireIfEmpty(PoolState state, Participant participant) {
        if (!participant.isActive() || participant.hasStake()) {
            return;
        }
        List<Address> roster = state.mutableRoster();
        int slot = participant.getRosterIndex();
        int last = roster.size() - 1;
        if (slot != last) {
            Address moved = roster.get(last);
            roster.set(slot, moved);
            state.getParticipants().get(moved).setRosterIndex(slot);
        }
        roster.remove(last);
        participant.setActive(false);
        participant.setRosterIndex(-1);
        state.pruneIfDormant(participant);
    }

    static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new PoolException(PoolErrorCode.INVALID_AMOUNT, "Amount must be positive: " + amount);
        }
    }
}
