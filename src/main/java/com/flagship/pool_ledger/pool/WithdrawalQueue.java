package com.flagship.pool_ledger.pool;

import lombok.RequiredArgsConstructor;
import lombok.Value;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;

/**
 * Withdrawal requests that mature one epoch after they are made, plus the emergency exit.
 *
 * Stake leaves the reward-earning pool the moment a withdrawal is requested. Every
 * method debits the queue and the participant before the caller pays anything out.
 */
@RequiredArgsConstructor
public class WithdrawalQueue {

    private final DepositLedger depositLedger;

    /**
     * Moves {@code amount} of the owner's stake into the queue, drawing pending
     * (not yet earning) funds first and locked funds after.
     */
    public WithdrawalRequest request(PoolState state, Address owner, BigInteger amount, long currentEpoch) {
        DepositLedger.requirePositive(amount);

        Participant participant = state.findParticipant(owner).orElse(null);
        BigInteger pending = participant == null ? BigInteger.ZERO : participant.getPendingAmount();
        BigInteger locked = participant == null ? BigInteger.ZERO : participant.getLockedAmount();
        if (amount.compareTo(pending.add(locked)) > 0) {
            throw new PoolException(PoolErrorCode.INSUFFICIENT_BALANCE,
                String.format("Requested %s but only %s is withdrawable", amount, pending.add(locked)));
        }

        BigInteger fromPending = amount.min(pending);
        BigInteger fromLocked = amount.subtract(fromPending);

        participant.setPendingAmount(pending.subtract(fromPending));
        participant.setLockedAmount(locked.subtract(fromLocked));
        state.setTotalPending(state.getTotalPending().subtract(fromPending));
        state.setTotalLocked(state.getTotalLocked().subtract(fromLocked));

        long availableEpoch = currentEpoch + 1;
        state.mutableWithdrawalsOf(owner).add(new PendingWithdrawal(owner, amount, availableEpoch));
        state.setTotalQueuedWithdrawal(state.getTotalQueuedWithdrawal().add(amount));

        depositLedger.retireIfEmpty(state, participant);

        return new WithdrawalRequest(fromPending, fromLocked, availableEpoch);
    }

    /**
     * Removes every matured record of the owner and returns their sum.
     *
     * @throws PoolException {@link PoolErrorCode#NOTHING_TO_RELEASE} if the owner has no
     *         queued withdrawal, {@link PoolErrorCode#WITHDRAWAL_NOT_MATURE} if none has matured
     */
    public Release release(PoolState state, Address owner, long currentEpoch) {
        List<PendingWithdrawal> records = state.getWithdrawals().get(owner);
        if (records == null || records.isEmpty()) {
            throw new PoolException(PoolErrorCode.NOTHING_TO_RELEASE, "No queued withdrawal for " + owner);
        }

        List<PendingWithdrawal> queue = state.mutableWithdrawalsOf(owner);
        BigInteger released = BigInteger.ZERO;
        int count = 0;
        long earliestPending = Long.MAX_VALUE;
        for (Iterator<PendingWithdrawal> it = queue.iterator(); it.hasNext(); ) {
            PendingWithdrawal record = it.next();
            if (record.isMatureAt(currentEpoch)) {
                released = released.add(record.getAmount());
                count++;
                it.remove();
            } else {
                earliestPending = Math.min(earliestPending, record.getAvailableEpoch());
            }
        }

        if (count == 0) {
            throw new PoolException(PoolErrorCode.WITHDRAWAL_NOT_MATURE,
                String.format("No withdrawal is releasable at epoch %d; earliest is epoch %d",
                    currentEpoch, earliestPending));
        }
        if (queue.isEmpty()) {
            state.dropWithdrawals(owner);
        }
        state.setTotalQueuedWithdrawal(state.getTotalQueuedWithdrawal().subtract(released));

        return new Release(released, count);
    }

    /**
     * Zeroes pending stake, locked stake, queued withdrawals and unclaimed reward of the
     * owner at once. Ignores epochs and the pause gate.
     *
     * @throws PoolException {@link PoolErrorCode#NOTHING_TO_WITHDRAW} if all four are zero
     */
    public EmergencySweep sweep(PoolState state, Address owner) {
        Participant participant = state.findParticipant(owner).orElse(null);
        BigInteger pending = participant == null ? BigInteger.ZERO : participant.getPendingAmount();
        BigInteger locked = participant == null ? BigInteger.ZERO : participant.getLockedAmount();
        BigInteger reward = participant == null ? BigInteger.ZERO : participant.getUnclaimedReward();
        BigInteger queued = state.queuedWithdrawalOf(owner);

        EmergencySweep sweep = new EmergencySweep(pending, locked, queued, reward);
        if (sweep.getTotal().signum() == 0) {
            throw new PoolException(PoolErrorCode.NOTHING_TO_WITHDRAW, "Nothing held for " + owner);
        }

        state.dropWithdrawals(owner);
        state.setTotalQueuedWithdrawal(state.getTotalQueuedWithdrawal().subtract(queued));

        if (participant != null) {
            participant.setPendingAmount(BigInteger.ZERO);
            participant.setLockedAmount(BigInteger.ZERO);
            participant.setUnclaimedReward(BigInteger.ZERO);
            state.setTotalPending(state.getTotalPending().subtract(pending));
            state.setTotalLocked(state.getTotalLocked().subtract(locked));
            state.setTotalUnclaimedReward(state.getTotalUnclaimedReward().subtract(reward));
            depositLedger.retireIfEmpty(state, participant);
            state.pruneIfDormant(participant);
        }

        return sweep;
    }

    @Value
    public static class WithdrawalRequest {
        BigInteger fromPending;
        BigInteger fromLocked;
        long availableEpoch;
    }

    @Value
    public static class Release {
        BigInteger amount;
        int records;
    }

    @Value
    public static class EmergencySweep {
        BigInteger pending;
        BigInteger locked;
        BigInteger queued;
        BigInteger unclaimedReward;

        public BigInteger getTotal() {
            return pending.add(locked).add(queued).add(unclaimedReward);
        }
    }
}
