package com.flagship.pool_ledger.pool;

import lombok.Getter;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All mutable pool state, threaded explicitly through every component operation.
 *
 * Invariants:
 * <ul>
 *   <li>{@code totalLocked == Σ lockedAmount}, {@code totalPending == Σ pendingAmount}</li>
 *   <li>{@code totalUnclaimedReward == Σ unclaimedReward}</li>
 *   <li>{@code totalQueuedWithdrawal == Σ amount} over all pending withdrawals</li>
 *   <li>the roster holds exactly the active participants, each at its recorded index</li>
 *   <li>{@code lastProcessedEpoch} never decreases</li>
 * </ul>
 */
@Getter
public class PoolState {

    private final Map<Address, Participant> participants;
    private final List<Address> roster;
    private final Map<Address, List<PendingWithdrawal>> withdrawals;
    private BigInteger totalLocked = BigInteger.ZERO;
    private BigInteger totalPending = BigInteger.ZERO;
    private BigInteger totalUnclaimedReward = BigInteger.ZERO;
    private BigInteger totalQueuedWithdrawal = BigInteger.ZERO;
    private long lastProcessedEpoch;
    private OperatorState operatorState;
    private boolean paused;

    public PoolState(OperatorState operatorState, long initialEpoch) {
        this.participants = new LinkedHashMap<>();
        this.roster = new ArrayList<>();
        this.withdrawals = new HashMap<>();
        this.operatorState = operatorState;
        this.lastProcessedEpoch = initialEpoch;
    }

    private PoolState(PoolState source) {
        this.participants = new LinkedHashMap<>();
        source.participants.forEach((identity, participant) -> participants.put(identity, participant.copy()));
        this.roster = new ArrayList<>(source.roster);
        this.withdrawals = new HashMap<>();
        source.withdrawals.forEach((owner, records) -> withdrawals.put(owner, new ArrayList<>(records)));
        this.totalLocked = source.totalLocked;
        this.totalPending = source.totalPending;
        this.totalUnclaimedReward = source.totalUnclaimedReward;
        this.totalQueuedWithdrawal = source.totalQueuedWithdrawal;
        this.lastProcessedEpoch = source.lastProcessedEpoch;
        this.operatorState = source.operatorState;
        this.paused = source.paused;
    }

    /**
     * Rebuilds the state from stored participants and withdrawal queues. Totals are
     * recomputed and the roster is rebuilt from each active participant's index.
     *
     * @throws IllegalStateException if the stored roster indexes are not a contiguous 0..n-1
     */
    public static PoolState restore(OperatorState operatorState,
                                    long lastProcessedEpoch,
                                    boolean paused,
                                    Collection<Participant> participants,
                                    Map<Address, List<PendingWithdrawal>> withdrawals) {
        PoolState state = new PoolState(operatorState, lastProcessedEpoch);
        state.paused = paused;

        List<Participant> ordered = new ArrayList<>(participants);
        ordered.sort(Comparator.comparing((Participant p) -> !p.isActive())
            .thenComparingInt(Participant::getRosterIndex));
        for (Participant participant : ordered) {
            Participant restored = participant.copy();
            state.participants.put(restored.getIdentity(), restored);
            if (restored.isActive()) {
                if (restored.getRosterIndex() != state.roster.size()) {
                    throw new IllegalStateException(String.format(
                        "Stored roster is not contiguous: %s has index %d, expected %d",
                        restored.getIdentity(), restored.getRosterIndex(), state.roster.size()));
                }
                state.roster.add(restored.getIdentity());
            }
            state.totalPending = state.totalPending.add(restored.getPendingAmount());
            state.totalLocked = state.totalLocked.add(restored.getLockedAmount());
            state.totalUnclaimedReward = state.totalUnclaimedReward.add(restored.getUnclaimedReward());
        }

        withdrawals.forEach((owner, records) -> {
            if (!records.isEmpty()) {
                state.withdrawals.put(owner, new ArrayList<>(records));
                for (PendingWithdrawal record : records) {
                    state.totalQueuedWithdrawal = state.totalQueuedWithdrawal.add(record.getAmount());
                }
            }
        });
        return state;
    }

    /**
     * Deep copy used as the rollback point of an operation.
     */
    public PoolState copy() {
        return new PoolState(this);
    }

    public List<Address> getRoster() {
        return Collections.unmodifiableList(roster);
    }

    List<Address> mutableRoster() {
        return roster;
    }

    public Map<Address, Participant> getParticipants() {
        return Collections.unmodifiableMap(participants);
    }

    public Map<Address, List<PendingWithdrawal>> getWithdrawals() {
        return Collections.unmodifiableMap(withdrawals);
    }

    public Optional<Participant> findParticipant(Address identity) {
        return Optional.ofNullable(participants.get(identity));
    }

    Participant participantFor(Address identity) {
        return participants.computeIfAbsent(identity, Participant::new);
    }

    /**
     * Forgets a participant that holds nothing: no stake and no unclaimed reward.
     */
    void pruneIfDormant(Participant participant) {
        if (!participant.isActive() && participant.getUnclaimedReward().signum() == 0) {
            participants.remove(participant.getIdentity());
        }
    }

    public List<PendingWithdrawal> withdrawalsOf(Address owner) {
        return Collections.unmodifiableList(withdrawals.getOrDefault(owner, List.of()));
    }

    List<PendingWithdrawal> mutableWithdrawalsOf(Address owner) {
        return withdrawals.computeIfAbsent(owner, key -> new ArrayList<>());
    }

    void dropWithdrawals(Address owner) {
        withdrawals.remove(owner);
    }

    public BigInteger queuedWithdrawalOf(Address owner) {
        return withdrawals.getOrDefault(owner, List.of()).stream()
            .map(PendingWithdrawal::getAmount)
            .reduce(BigInteger.ZERO, BigInteger::add);
    }

    /**
     * Everything the pool owes its depositors.
     */
    public BigInteger totalLiabilities() {
        return totalLocked.add(totalPending).add(totalQueuedWithdrawal).add(totalUnclaimedReward);
    }

    void setTotalLocked(BigInteger totalLocked) {
        this.totalLocked = totalLocked;
    }

    void setTotalPending(BigInteger totalPending) {
        this.totalPending = totalPending;
    }

    void setTotalUnclaimedReward(BigInteger totalUnclaimedReward) {
        this.totalUnclaimedReward = totalUnclaimedReward;
    }

    void setTotalQueuedWithdrawal(BigInteger totalQueuedWithdrawal) {
        this.totalQueuedWithdrawal = totalQueuedWithdrawal;
    }

    void advanceEpochCursor(long epoch) {
        if (epoch < lastProcessedEpoch) {
            throw new IllegalStateException(
                String.format("Epoch cursor cannot move backwards: %d -> %d", lastProcessedEpoch, epoch));
        }
        this.lastProcessedEpoch = epoch;
    }

    void setOperatorState(OperatorState operatorState) {
        this.operatorState = operatorState;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }
}
