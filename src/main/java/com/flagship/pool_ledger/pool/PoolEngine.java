package com.flagship.pool_ledger.pool;

import com.flagship.pool_ledger.external.AssetTransfer;
import com.flagship.pool_ledger.external.EpochOracle;
import com.flagship.pool_ledger.external.WorkSettlementChannel;
import com.flagship.pool_ledger.pool.event.DepositedEvent;
import com.flagship.pool_ledger.pool.event.EmergencyWithdrawnEvent;
import com.flagship.pool_ledger.pool.event.EpochProcessedEvent;
import com.flagship.pool_ledger.pool.event.FeeUpdatedEvent;
import com.flagship.pool_ledger.pool.event.OperatorChangedEvent;
import com.flagship.pool_ledger.pool.event.OperatorProposedEvent;
import com.flagship.pool_ledger.pool.event.PauseChangedEvent;
import com.flagship.pool_ledger.pool.event.PoolEvent;
import com.flagship.pool_ledger.pool.event.PoolEventSink;
import com.flagship.pool_ledger.pool.event.RewardsClaimedEvent;
import com.flagship.pool_ledger.pool.event.UserRewardsClaimedEvent;
import com.flagship.pool_ledger.pool.event.WithdrawalCompletedEvent;
import com.flagship.pool_ledger.pool.event.WithdrawalRequestedEvent;
import com.flagship.pool_ledger.pool.event.WorkSubmittedEvent;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * The epoch-synchronized accounting engine.
 *
 * Execution model:
 * - One operation at a time. Callers are serialized on this instance's monitor.
 * - Every mutating operation is an atomic unit: the state is copied first and restored
 *   if anything fails, including a collaborator call or the event sink.
 * - Internal ledgers are settled before any outbound transfer or forwarded call. A
 *   collaborator that calls back into a mutating operation while one is in flight is
 *   rejected with {@link PoolErrorCode#REENTRANT_CALL}.
 * - Deposits, withdrawal requests and completions, and reward claims first process the
 *   epoch reported by the oracle. The emergency exit never reads the oracle.
 * - The changes of each operation are committed to the {@link PoolStateStore} with its
 *   events; the engine starts from the stored state when there is one.
 */
@Slf4j
public class PoolEngine {

    private final Address poolAddress;
    private final AssetTransfer assetTransfer;
    private final WorkSettlementChannel settlementChannel;
    private final EpochOracle epochOracle;
    private final List<BigInteger> tierThresholds;
    private final PoolEventSink eventSink;
    private final PoolStateStore stateStore;

    private final EpochProcessor epochProcessor = new EpochProcessor();
    private final DepositLedger depositLedger = new DepositLedger();
    private final WithdrawalQueue withdrawalQueue = new WithdrawalQueue(depositLedger);
    private final RewardDistributor rewardDistributor = new RewardDistributor();
    private final AccessControl accessControl = new AccessControl();

    private PoolState state;
    private boolean inFlight;

    @Builder
    public PoolEngine(Address poolAddress,
                      Address operator,
                      int feeBps,
                      long initialEpoch,
                      AssetTransfer assetTransfer,
                      WorkSettlementChannel settlementChannel,
                      EpochOracle epochOracle,
                      List<BigInteger> tierThresholds,
                      PoolEventSink eventSink,
                      PoolStateStore stateStore) {
        this.poolAddress = Objects.requireNonNull(poolAddress, "poolAddress");
        this.assetTransfer = Objects.requireNonNull(assetTransfer, "assetTransfer");
        this.settlementChannel = Objects.requireNonNull(settlementChannel, "settlementChannel");
        this.epochOracle = Objects.requireNonNull(epochOracle, "epochOracle");
        this.tierThresholds = tierThresholds == null ? List.of() : List.copyOf(tierThresholds);
        this.eventSink = eventSink == null ? PoolEventSink.NONE : eventSink;
        this.stateStore = stateStore == null ? PoolStateStore.NONE : stateStore;
        this.state = this.stateStore.load()
            .map(stored -> {
                log.info("Restored pool state: lastProcessedEpoch={}, participants={}, operator={}",
                    stored.getLastProcessedEpoch(), stored.getParticipants().size(),
                    stored.getOperatorState().getOperator());
                return stored;
            })
            .orElseGet(() -> new PoolState(OperatorState.initial(operator, feeBps), initialEpoch));
    }

    // ==================== Epoch ====================

    /**
     * Processes the oracle's current epoch. Safe to call by anyone, any number of times.
     *
     * @return the epoch processing transition; {@code isAdvanced()} is false for redundant calls
     */
    public synchronized EpochProcessor.EpochTransition processEpoch(Address caller) {
        return atomically(events -> {
            long observed = readOracle();
            EpochProcessor.EpochTransition transition = epochProcessor.process(state, observed);
            recordTransition(caller, transition, events);
            return transition;
        });
    }

    // ==================== Deposits & withdrawals ====================

    public synchronized DepositedEvent deposit(Address caller, BigInteger amount) {
        return atomically(events -> {
            DepositLedger.requirePositive(amount);
            accessControl.requireNotPaused(state);
            long epoch = synchronizeEpoch(caller, events);

            long lockEpoch = depositLedger.deposit(state, caller, amount, epoch);
            pullIn(caller, amount);

            DepositedEvent event = DepositedEvent.of(caller, amount, lockEpoch);
            events.add(event);
            return event;
        });
    }

    public synchronized WithdrawalRequestedEvent requestWithdrawal(Address caller, BigInteger amount) {
        return atomically(events -> {
            DepositLedger.requirePositive(amount);
            long epoch = synchronizeEpoch(caller, events);

            WithdrawalQueue.WithdrawalRequest request = withdrawalQueue.request(state, caller, amount, epoch);

            WithdrawalRequestedEvent event = WithdrawalRequestedEvent.of(caller,
                request.getFromPending(), request.getFromLocked(), request.getAvailableEpoch());
            events.add(event);
            return event;
        });
    }

    public synchronized WithdrawalCompletedEvent completeWithdrawal(Address caller) {
        return atomically(events -> {
            long epoch = synchronizeEpoch(caller, events);

            WithdrawalQueue.Release release = withdrawalQueue.release(state, caller, epoch);
            payOut(caller, release.getAmount());

            WithdrawalCompletedEvent event =
                WithdrawalCompletedEvent.of(caller, release.getAmount(), release.getRecords(), epoch);
            events.add(event);
            return event;
        });
    }

    /**
     * Sweeps everything the caller holds in one payout. Not subject to the pause gate and
     * never reads the epoch oracle.
     */
    public synchronized EmergencyWithdrawnEvent emergencyWithdraw(Address caller) {
        return atomically(events -> {
            WithdrawalQueue.EmergencySweep sweep = withdrawalQueue.sweep(state, caller);
            payOut(caller, sweep.getTotal());

            EmergencyWithdrawnEvent event = EmergencyWithdrawnEvent.of(caller, sweep.getPending(),
                sweep.getLocked(), sweep.getQueued(), sweep.getUnclaimedReward());
            events.add(event);
            return event;
        });
    }

    // ==================== Rewards ====================

    /**
     * Settles the given epochs with the work-settlement channel and distributes what
     * arrived. Callable by anyone.
     *
     * The reward is measured as the pool balance after the forwarded claim minus the
     * balance before it. That difference is attributable to the claim only because no
     * other operation can run in between.
     */
    public synchronized RewardsClaimedEvent claimRewards(Address caller, List<Long> epochIds) {
        List<Long> epochs = epochIds == null ? List.of() : List.copyOf(epochIds);
        return atomically(events -> {
            synchronizeEpoch(caller, events);

            BigInteger before = poolBalance();
            forwardClaim(epochs);
            BigInteger after = poolBalance();

            BigInteger totalReward = after.subtract(before);
            if (totalReward.signum() < 0) {
                throw new PoolException(PoolErrorCode.CLAIM_FAILED,
                    "Pool balance decreased across claim: " + before + " -> " + after);
            }

            RewardDistributor.Allocation allocation = rewardDistributor.allocate(state, totalReward);
            if (allocation.getOperatorFee().signum() > 0) {
                payOut(state.getOperatorState().getOperator(), allocation.getOperatorFee());
            }

            RewardsClaimedEvent event = RewardsClaimedEvent.of(caller, epochs, allocation.getTotalReward(),
                allocation.getOperatorFee(), allocation.getDistributed(), allocation.getUndistributed(),
                allocation.getRecipients());
            events.add(event);
            return event;
        });
    }

    public synchronized UserRewardsClaimedEvent claimUserRewards(Address caller) {
        return atomically(events -> {
            BigInteger reward = rewardDistributor.takeUnclaimed(state, caller);
            payOut(caller, reward);

            UserRewardsClaimedEvent event = UserRewardsClaimedEvent.of(caller, reward);
            events.add(event);
            return event;
        });
    }

    // ==================== Operator ====================

    public synchronized WorkSubmittedEvent submitWork(Address caller, byte[] payload) {
        byte[] body = payload == null ? new byte[0] : payload.clone();
        return atomically(events -> {
            accessControl.requireOperator(state, caller);
            accessControl.requireNotPaused(state);

            boolean accepted;
            try {
                accepted = settlementChannel.submit(body);
            } catch (PoolException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PoolException(PoolErrorCode.SUBMIT_FAILED, "Work submission failed: " + e.getMessage(), e);
            }
            if (!accepted) {
                throw new PoolException(PoolErrorCode.SUBMIT_FAILED, "Work submission rejected");
            }

            WorkSubmittedEvent event = WorkSubmittedEvent.of(caller, body.length);
            events.add(event);
            return event;
        });
    }

    public synchronized FeeUpdatedEvent setFee(Address caller, int feeBps) {
        return atomically(events -> {
            int previous = accessControl.setFee(state, caller, feeBps);
            FeeUpdatedEvent event = FeeUpdatedEvent.of(caller, previous, feeBps);
            events.add(event);
            return event;
        });
    }

    public synchronized OperatorProposedEvent proposeOperator(Address caller, Address candidate) {
        return atomically(events -> {
            accessControl.proposeOperator(state, caller, candidate);
            OperatorProposedEvent event =
                OperatorProposedEvent.of(caller, state.getOperatorState().getPendingOperator());
            events.add(event);
            return event;
        });
    }

    public synchronized OperatorChangedEvent acceptOperator(Address caller) {
        return atomically(events -> {
            Address previous = accessControl.acceptOperator(state, caller);
            OperatorChangedEvent event = OperatorChangedEvent.of(previous, caller);
            events.add(event);
            return event;
        });
    }

    public synchronized PauseChangedEvent setPaused(Address caller, boolean paused) {
        return atomically(events -> {
            accessControl.setPaused(state, caller, paused);
            PauseChangedEvent event = PauseChangedEvent.of(caller, paused);
            events.add(event);
            return event;
        });
    }

    // ==================== Queries ====================

    public synchronized Address currentOperator() {
        return state.getOperatorState().getOperator();
    }

    public synchronized OperatorState operatorState() {
        return state.getOperatorState();
    }

    public synchronized boolean isPaused() {
        return state.isPaused();
    }

    public synchronized long lastProcessedEpoch() {
        return state.getLastProcessedEpoch();
    }

    public synchronized int depositorCount() {
        return state.getRoster().size();
    }

    /**
     * Number of tier thresholds the pool's asset balance meets or exceeds.
     */
    public synchronized int tier() {
        return tierFor(poolBalance());
    }

    public synchronized ParticipantSnapshot participant(Address identity) {
        return ParticipantSnapshot.of(state, identity);
    }

    public synchronized List<PendingWithdrawal> pendingWithdrawals(Address owner) {
        return List.copyOf(state.withdrawalsOf(owner));
    }

    public synchronized PoolSnapshot pool() {
        BigInteger balance = poolBalance();
        OperatorState operatorState = state.getOperatorState();
        return PoolSnapshot.builder()
            .totalLocked(state.getTotalLocked())
            .totalPending(state.getTotalPending())
            .totalQueuedWithdrawal(state.getTotalQueuedWithdrawal())
            .totalUnclaimedReward(state.getTotalUnclaimedReward())
            .depositorCount(state.getRoster().size())
            .tier(tierFor(balance))
            .currentEpoch(currentEpochOrLastProcessed())
            .lastProcessedEpoch(state.getLastProcessedEpoch())
            .feeBps(operatorState.getFeeBps())
            .operator(operatorState.getOperator())
            .pendingOperator(operatorState.getPendingOperator())
            .paused(state.isPaused())
            .poolBalance(balance)
            .surplus(balance.subtract(state.totalLiabilities()))
            .build();
    }

    /**
     * Read-only copy of the full state, for invariant checks and diagnostics.
     */
    public synchronized PoolState stateCopy() {
        return state.copy();
    }

    // ==================== Internals ====================

    private <T> T atomically(Function<List<PoolEvent>, T> operation) {
        if (inFlight) {
            throw new PoolException(PoolErrorCode.REENTRANT_CALL, "Pool operation already in progress");
        }
        inFlight = true;
        PoolState rollbackPoint = state.copy();
        List<PoolEvent> events = new ArrayList<>();
        try {
            T result = operation.apply(events);
            List<PoolEvent> committed = List.copyOf(events);
            commit(rollbackPoint, committed);
            eventSink.accept(committed);
            return result;
        } catch (RuntimeException e) {
            state = rollbackPoint;
            log.debug("Pool operation rolled back: {}", e.getMessage());
            throw e;
        } finally {
            inFlight = false;
        }
    }

    /**
     * Writes the operation's changes and events to the store. Transfers already made by the
     * operation are not undone when this fails.
     */
    private void commit(PoolState before, List<PoolEvent> events) {
        try {
            stateStore.commit(PoolStateDelta.between(before, state), events);
        } catch (RuntimeException e) {
            log.error("Pool state commit failed, discarding {} events: {}", events.size(), e.getMessage());
            throw e;
        }
    }

    private long synchronizeEpoch(Address caller, List<PoolEvent> events) {
        EpochProcessor.EpochTransition transition = epochProcessor.process(state, readOracle());
        recordTransition(caller, transition, events);
        return state.getLastProcessedEpoch();
    }

    private void recordTransition(Address caller, EpochProcessor.EpochTransition transition,
                                  List<PoolEvent> events) {
        if (transition.isAdvanced()) {
            events.add(EpochProcessedEvent.of(caller, transition.getPreviousEpoch(), transition.getEpoch(),
                transition.getPromotedAmount(), transition.getPromotedParticipants()));
        }
    }

    /**
     * The oracle's epoch for read-only views. Falls back to the last processed epoch while
     * the oracle cannot be read.
     */
    private long currentEpochOrLastProcessed() {
        long lastProcessed = state.getLastProcessedEpoch();
        try {
            return Math.max(readOracle(), lastProcessed);
        } catch (PoolException e) {
            log.warn("Reporting last processed epoch {}: {}", lastProcessed, e.getMessage());
            return lastProcessed;
        }
    }

    private long readOracle() {
        try {
            return epochOracle.currentEpoch();
        } catch (RuntimeException e) {
            throw new PoolException(PoolErrorCode.EPOCH_UNAVAILABLE, "Epoch oracle unavailable: " + e.getMessage(), e);
        }
    }

    private BigInteger poolBalance() {
        BigInteger balance;
        try {
            balance = assetTransfer.balanceOf(poolAddress);
        } catch (RuntimeException e) {
            throw new PoolException(PoolErrorCode.TRANSFER_FAILED, "Pool balance unavailable: " + e.getMessage(), e);
        }
        if (balance == null) {
            throw new PoolException(PoolErrorCode.TRANSFER_FAILED, "Pool balance unavailable");
        }
        return balance;
    }

    private int tierFor(BigInteger balance) {
        int tier = 0;
        for (BigInteger threshold : tierThresholds) {
            if (balance.compareTo(threshold) >= 0) {
                tier++;
            }
        }
        return tier;
    }

    private void forwardClaim(List<Long> epochs) {
        boolean claimed;
        try {
            claimed = settlementChannel.claim(epochs);
        } catch (PoolException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PoolException(PoolErrorCode.CLAIM_FAILED, "Settlement claim failed: " + e.getMessage(), e);
        }
        if (!claimed) {
            throw new PoolException(PoolErrorCode.CLAIM_FAILED, "Settlement claim rejected for epochs " + epochs);
        }
    }

    private void pullIn(Address from, BigInteger amount) {
        boolean moved;
        try {
            moved = assetTransfer.transferIn(from, amount);
        } catch (PoolException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PoolException(PoolErrorCode.TRANSFER_FAILED, "Transfer in failed: " + e.getMessage(), e);
        }
        if (!moved) {
            throw new PoolException(PoolErrorCode.TRANSFER_FAILED,
                String.format("Transfer of %s from %s was refused", amount, from));
        }
    }

    private void payOut(Address to, BigInteger amount) {
        boolean moved;
        try {
            moved = assetTransfer.transferOut(to, amount);
        } catch (PoolException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PoolException(PoolErrorCode.TRANSFER_FAILED, "Transfer out failed: " + e.getMessage(), e);
        }
        if (!moved) {
            throw new PoolException(PoolErrorCode.TRANSFER_FAILED,
                String.format("Transfer of %s to %s was refused", amount, to));
        }
    }
}
