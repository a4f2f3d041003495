package com.flagship.pool_ledger.pool;

import com.flagship.pool_ledger.external.AssetTransfer;
import com.flagship.pool_ledger.external.InMemoryAssetLedger;
import com.flagship.pool_ledger.external.InMemorySettlementChannel;
import com.flagship.pool_ledger.external.ObservedEpochOracle;
import com.flagship.pool_ledger.external.WorkSettlementChannel;
import com.flagship.pool_ledger.pool.event.DepositedEvent;
import com.flagship.pool_ledger.pool.event.EmergencyWithdrawnEvent;
import com.flagship.pool_ledger.pool.event.EpochProcessedEvent;
import com.flagship.pool_ledger.pool.event.PoolEvent;
import com.flagship.pool_ledger.pool.event.RewardsClaimedEvent;
import com.flagship.pool_ledger.pool.event.WithdrawalRequestedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Engine tests: epoch-gated staking, withdrawals, reward distribution and atomicity.
 *
 * These tests verify:
 * - Deposits lock one epoch after they are made
 * - Withdrawals release one epoch after they are requested
 * - Rewards are measured by balance delta and split by locked stake
 * - Every failed operation leaves state, balances and events untouched
 * - Committed changes rebuild the same state after a restart
 */
class PoolEngineTest {

    private static final Address POOL = Address.of("0x00000000000000000000000000000000000000a1");
    private static final Address OPERATOR = Address.of("0x00000000000000000000000000000000000000b2");
    private static final Address ALICE = Address.of("0x00000000000000000000000000000000000000c3");
    private static final Address BOB = Address.of("0x00000000000000000000000000000000000000d4");
    private static final Address CAROL = Address.of("0x00000000000000000000000000000000000000e5");

    private InMemoryAssetLedger assets;
    private InMemorySettlementChannel channel;
    private ObservedEpochOracle oracle;
    private List<PoolEvent> published;
    private PoolEngine engine;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        assets = new InMemoryAssetLedger(POOL);
        channel = new InMemorySettlementChannel(assets, POOL);
        oracle = new ObservedEpochOracle(5);
        published = new ArrayList<>();
        engine = newEngine(assets, 500);

        assets.mint(ALICE, units(10_000));
        assets.mint(BOB, units(10_000));
        assets.mint(CAROL, units(10_000));
    }

    private PoolEngine newEngine(AssetTransfer assetTransfer, int feeBps) {
        return PoolEngine.builder()
            .poolAddress(POOL)
            .operator(OPERATOR)
            .feeBps(feeBps)
            .initialEpoch(5)
            .assetTransfer(assetTransfer)
            .settlementChannel(channel)
            .epochOracle(oracle)
            .tierThresholds(List.of(units(100), units(1_000), units(10_000)))
            .eventSink(published::addAll)
            .build();
    }

    private static BigInteger units(long value) {
        return BigInteger.valueOf(value);
    }

    private void assertInvariants() {
        PoolState state = engine.stateCopy();
        BigInteger locked = BigInteger.ZERO;
        BigInteger pending = BigInteger.ZERO;
        BigInteger rewards = BigInteger.ZERO;
        for (Participant participant : state.getParticipants().values()) {
            locked = locked.add(participant.getLockedAmount());
            pending = pending.add(participant.getPendingAmount());
            rewards = rewards.add(participant.getUnclaimedReward());
            assertEquals(participant.hasStake(), participant.isActive(),
                "active flag must match stake for " + participant.getIdentity());
            if (participant.isActive()) {
                assertEquals(participant.getIdentity(), state.getRoster().get(participant.getRosterIndex()));
            }
        }
        BigInteger queued = BigInteger.ZERO;
        for (List<PendingWithdrawal> records : state.getWithdrawals().values()) {
            for (PendingWithdrawal record : records) {
                queued = queued.add(record.getAmount());
            }
        }
        assertEquals(locked, state.getTotalLocked());
        assertEquals(pending, state.getTotalPending());
        assertEquals(rewards, state.getTotalUnclaimedReward());
        assertEquals(queued, state.getTotalQueuedWithdrawal());
        assertEquals(state.getParticipants().values().stream().filter(Participant::isActive).count(),
            state.getRoster().size());
        assertTrue(assets.balanceOf(POOL).compareTo(state.totalLiabilities()) >= 0,
            "pool must hold at least what it owes");
    }

    @Test
    @DisplayName("Deposit at epoch 5 stays pending until epoch 6 and then locks")
    void testDeposit_LocksAtNextEpoch() {
        printTestHeader("Deposit Locks At Next Epoch");
        printInput("Epoch", 5);
        printInput("Amount", 100);

        DepositedEvent deposited = engine.deposit(ALICE, units(100));
        printOutput("Lock epoch", deposited.getLockEpoch());
        assertEquals(6, deposited.getLockEpoch());

        engine.processEpoch(BOB);
        ParticipantSnapshot atFive = engine.participant(ALICE);
        assertEquals(units(100), atFive.getPendingAmount());
        assertEquals(BigInteger.ZERO, atFive.getLockedAmount());

        oracle.observe(6);
        EpochProcessor.EpochTransition transition = engine.processEpoch(BOB);
        printOutput("Promoted", transition.getPromotedAmount());

        ParticipantSnapshot atSix = engine.participant(ALICE);
        assertEquals(BigInteger.ZERO, atSix.getPendingAmount());
        assertEquals(units(100), atSix.getLockedAmount());
        assertEquals(units(100), engine.stateCopy().getTotalLocked());
        assertEquals(units(100), transition.getPromotedAmount());
        assertEquals(1, transition.getPromotedParticipants());
        assertInvariants();
        printSuccess("Pending stake locked exactly at its lock epoch");
    }

    @Test
    @DisplayName("Second deposit merges into the pending batch keeping the later lock epoch")
    void testDeposit_MergesPendingBatch() {
        printTestHeader("Deposit Merges Pending Batch");

        engine.deposit(ALICE, units(40));
        DepositedEvent second = engine.deposit(ALICE, units(60));

        assertEquals(6, second.getLockEpoch());
        assertEquals(units(100), engine.participant(ALICE).getPendingAmount());
        assertEquals(1, engine.depositorCount());
        assertEquals(units(100), assets.balanceOf(POOL));
        assertEquals(units(9_900), assets.balanceOf(ALICE));
        assertInvariants();
        printSuccess("Deposits merged into a single pending batch");
    }

    @Test
    @DisplayName("Deposit of zero is rejected before anything changes")
    void testDeposit_ZeroAmountRejected() {
        printTestHeader("Zero Deposit Rejected");

        PoolException e = assertThrows(PoolException.class, () -> engine.deposit(ALICE, BigInteger.ZERO));
        printOutput("Code", e.getCode());

        assertEquals(PoolErrorCode.INVALID_AMOUNT, e.getCode());
        assertEquals(PoolErrorCode.Category.VALIDATION, e.getCategory());
        assertEquals(0, engine.depositorCount());
        assertTrue(published.isEmpty());
        printSuccess("Zero amount rejected with a validation error");
    }

    @Test
    @DisplayName("Deposit the depositor cannot fund rolls back completely")
    void testDeposit_FailedTransferRollsBack() {
        printTestHeader("Failed Deposit Transfer Rolls Back");
        oracle.observe(7);

        PoolException e = assertThrows(PoolException.class, () -> engine.deposit(ALICE, units(20_000)));
        printOutput("Code", e.getCode());

        assertEquals(PoolErrorCode.TRANSFER_FAILED, e.getCode());
        assertEquals(0, engine.depositorCount());
        assertEquals(5, engine.lastProcessedEpoch(), "epoch processing is part of the rolled back unit");
        assertEquals(BigInteger.ZERO, engine.stateCopy().getTotalPending());
        assertTrue(engine.stateCopy().getParticipants().isEmpty());
        assertTrue(published.isEmpty());
        printSuccess("No trace of the failed deposit remains");
    }

    @Test
    @DisplayName("Deposits are refused while paused")
    void testDeposit_PausedRejected() {
        printTestHeader("Deposit While Paused");
        engine.setPaused(OPERATOR, true);

        PoolException e = assertThrows(PoolException.class, () -> engine.deposit(ALICE, units(10)));

        assertEquals(PoolErrorCode.PAUSED, e.getCode());
        assertEquals(BigInteger.ZERO, assets.balanceOf(POOL));
        printSuccess("Pause gate blocks deposits");
    }

    @Test
    @DisplayName("Deposit then immediate withdrawal draws from pending and releases at the next epoch")
    void testRoundTrip_DepositThenWithdraw() {
        printTestHeader("Deposit/Withdraw Round Trip");

        engine.deposit(ALICE, units(250));
        WithdrawalRequestedEvent requested = engine.requestWithdrawal(ALICE, units(250));
        printOutput("From pending", requested.getFromPending());
        printOutput("From locked", requested.getFromLocked());
        printOutput("Available epoch", requested.getAvailableEpoch());

        PoolState state = engine.stateCopy();
        assertEquals(units(250), requested.getFromPending());
        assertEquals(BigInteger.ZERO, requested.getFromLocked());
        assertEquals(BigInteger.ZERO, state.getTotalPending());
        assertEquals(BigInteger.ZERO, state.getTotalLocked());
        assertEquals(units(250), state.getTotalQueuedWithdrawal());
        assertEquals(6, requested.getAvailableEpoch());
        assertEquals(0, engine.depositorCount());

        PoolException early = assertThrows(PoolException.class, () -> engine.completeWithdrawal(ALICE));
        assertEquals(PoolErrorCode.WITHDRAWAL_NOT_MATURE, early.getCode());

        oracle.observe(6);
        BigInteger released = engine.completeWithdrawal(ALICE).getAmount();

        assertEquals(units(250), released);
        assertEquals(units(10_000), assets.balanceOf(ALICE));
        assertEquals(BigInteger.ZERO, engine.stateCopy().getTotalQueuedWithdrawal());
        assertInvariants();
        printSuccess("Funds released exactly one epoch after the request");
    }

    @Test
    @DisplayName("Withdrawal beyond pending draws the rest from locked stake")
    void testRequestWithdrawal_DrawsPendingThenLocked() {
        printTestHeader("Withdrawal Spans Pending And Locked");

        engine.deposit(ALICE, units(100));
        oracle.observe(6);
        engine.deposit(ALICE, units(30));

        WithdrawalRequestedEvent requested = engine.requestWithdrawal(ALICE, units(50));

        assertEquals(units(30), requested.getFromPending());
        assertEquals(units(20), requested.getFromLocked());
        ParticipantSnapshot alice = engine.participant(ALICE);
        assertEquals(units(80), alice.getLockedAmount());
        assertEquals(BigInteger.ZERO, alice.getPendingAmount());
        assertEquals(units(50), alice.getQueuedWithdrawal());
        assertTrue(alice.isActive());
        assertInvariants();
        printSuccess("Pending drawn first, locked second");
    }

    @Test
    @DisplayName("Withdrawal above the stake is rejected")
    void testRequestWithdrawal_InsufficientBalance() {
        printTestHeader("Withdrawal Above Stake");
        engine.deposit(ALICE, units(10));

        PoolException e = assertThrows(PoolException.class, () -> engine.requestWithdrawal(ALICE, units(11)));

        assertEquals(PoolErrorCode.INSUFFICIENT_BALANCE, e.getCode());
        assertEquals(units(10), engine.participant(ALICE).getPendingAmount());
        printSuccess("Over-withdrawal rejected");
    }

    @Test
    @DisplayName("Completing with nothing queued is distinct from completing too early")
    void testCompleteWithdrawal_NothingQueued() {
        printTestHeader("Complete Without Queue");

        PoolException e = assertThrows(PoolException.class, () -> engine.completeWithdrawal(ALICE));

        assertEquals(PoolErrorCode.NOTHING_TO_RELEASE, e.getCode());
        printSuccess("Empty queue reported as NOTHING_TO_RELEASE");
    }

    @Test
    @DisplayName("Processing the same epoch twice is the same as processing it once")
    void testProcessEpoch_Idempotent() {
        printTestHeader("Epoch Processing Idempotence");
        engine.deposit(ALICE, units(100));
        engine.deposit(BOB, units(50));
        oracle.observe(6);

        EpochProcessor.EpochTransition first = engine.processEpoch(CAROL);
        PoolState once = engine.stateCopy();
        EpochProcessor.EpochTransition second = engine.processEpoch(CAROL);
        PoolState twice = engine.stateCopy();

        assertTrue(first.isAdvanced());
        assertFalse(second.isAdvanced());
        assertEquals(once.getTotalLocked(), twice.getTotalLocked());
        assertEquals(once.getTotalPending(), twice.getTotalPending());
        assertEquals(once.getLastProcessedEpoch(), twice.getLastProcessedEpoch());
        assertEquals(once.getRoster(), twice.getRoster());
        long epochEvents = published.stream().filter(e -> e instanceof EpochProcessedEvent).count();
        assertEquals(1, epochEvents);
        printSuccess("Second call changed nothing and published nothing");
    }

    @Test
    @DisplayName("Claim with 500 bps fee pays 50 to the operator and splits 950 by locked stake")
    void testClaimRewards_FeeAndProRataSplit() {
        printTestHeader("Reward Claim With Fee");
        engine.deposit(ALICE, units(300));
        engine.deposit(BOB, units(100));
        oracle.observe(6);
        channel.creditEpoch(6, units(1_000));

        RewardsClaimedEvent claimed = engine.claimRewards(CAROL, List.of(6L));
        printOutput("Total reward", claimed.getTotalReward());
        printOutput("Operator fee", claimed.getOperatorFee());
        printOutput("Distributed", claimed.getDistributed());

        assertEquals(units(1_000), claimed.getTotalReward());
        assertEquals(units(50), claimed.getOperatorFee());
        assertEquals(units(50), assets.balanceOf(OPERATOR));
        assertEquals(units(712), engine.participant(ALICE).getUnclaimedReward());
        assertEquals(units(237), engine.participant(BOB).getUnclaimedReward());
        assertEquals(units(949), claimed.getDistributed());
        assertEquals(units(1), claimed.getUndistributed());
        assertEquals(2, claimed.getRecipients());
        assertEquals(units(1), engine.pool().getSurplus());
        assertInvariants();
        printSuccess("Fee paid, depositor share split pro rata with floor rounding");
    }

    @Test
    @DisplayName("Fee-free distribution to 2:1 stakes credits rewards in ratio 2:1")
    void testClaimRewards_TwoToOneFairness() {
        printTestHeader("Distribution Fairness");
        engine = newEngine(assets, 0);
        engine.deposit(ALICE, units(200));
        engine.deposit(BOB, units(100));
        oracle.observe(6);
        channel.creditEpoch(6, units(1_001));

        engine.claimRewards(CAROL, List.of(6L));

        BigInteger alice = engine.participant(ALICE).getUnclaimedReward();
        BigInteger bob = engine.participant(BOB).getUnclaimedReward();
        printOutput("Alice", alice);
        printOutput("Bob", bob);

        BigInteger difference = alice.subtract(bob.multiply(BigInteger.TWO)).abs();
        assertTrue(difference.compareTo(BigInteger.TWO) <= 0, "ratio must hold within floor rounding");
        assertEquals(units(667), alice);
        assertEquals(units(333), bob);
        printSuccess("Rewards follow the 2:1 stake ratio");
    }

    @Test
    @DisplayName("Pending stake earns nothing from a claim")
    void testClaimRewards_PendingStakeExcluded() {
        printTestHeader("Pending Stake Excluded From Rewards");
        engine.deposit(ALICE, units(100));
        oracle.observe(6);
        engine.deposit(BOB, units(100));
        channel.creditEpoch(6, units(1_000));

        engine.claimRewards(CAROL, List.of(6L));

        assertEquals(units(950), engine.participant(ALICE).getUnclaimedReward());
        assertEquals(BigInteger.ZERO, engine.participant(BOB).getUnclaimedReward());
        printSuccess("Only locked stake shares the reward");
    }

    @Test
    @DisplayName("Claim with nothing locked leaves the depositor share in custody")
    void testClaimRewards_NothingLocked() {
        printTestHeader("Claim With Nothing Locked");
        channel.creditEpoch(5, units(200));

        RewardsClaimedEvent claimed = engine.claimRewards(CAROL, List.of(5L));

        assertEquals(units(10), claimed.getOperatorFee());
        assertEquals(BigInteger.ZERO, claimed.getDistributed());
        assertEquals(units(190), claimed.getUndistributed());
        assertEquals(units(190), engine.pool().getSurplus());
        printSuccess("Undistributed reward stays with the pool");
    }

    @Test
    @DisplayName("Rejected settlement claim rolls back epoch processing and publishes nothing")
    void testClaimRewards_RejectedClaimRollsBack() {
        printTestHeader("Rejected Claim Rolls Back");
        engine = PoolEngine.builder()
            .poolAddress(POOL)
            .operator(OPERATOR)
            .feeBps(500)
            .initialEpoch(5)
            .assetTransfer(assets)
            .settlementChannel(new WorkSettlementChannel() {
                @Override
                public boolean submit(byte[] payload) {
                    return true;
                }

                @Override
                public boolean claim(List<Long> epochIds) {
                    return false;
                }
            })
            .epochOracle(oracle)
            .eventSink(published::addAll)
            .build();
        engine.deposit(ALICE, units(100));
        published.clear();
        oracle.observe(6);

        PoolException e = assertThrows(PoolException.class, () -> engine.claimRewards(CAROL, List.of(6L)));

        assertEquals(PoolErrorCode.CLAIM_FAILED, e.getCode());
        assertEquals(5, engine.lastProcessedEpoch());
        assertEquals(units(100), engine.participant(ALICE).getPendingAmount());
        assertTrue(published.isEmpty());
        printSuccess("Failed claim left no trace");
    }

    @Test
    @DisplayName("Emergency withdrawal while paused pays everything in one transfer")
    void testEmergencyWithdraw_WhilePaused() {
        printTestHeader("Emergency Withdrawal While Paused");
        engine.deposit(ALICE, units(100));
        oracle.observe(6);
        channel.creditEpoch(6, units(1_000));
        engine.claimRewards(CAROL, List.of(6L));
        engine.requestWithdrawal(ALICE, units(40));
        engine.deposit(ALICE, units(25));
        engine.setPaused(OPERATOR, true);

        EmergencyWithdrawnEvent swept = engine.emergencyWithdraw(ALICE);
        printOutput("Pending", swept.getPending());
        printOutput("Locked", swept.getLocked());
        printOutput("Queued", swept.getQueued());
        printOutput("Rewards", swept.getUnclaimedReward());
        printOutput("Total", swept.getTotal());

        assertEquals(units(25), swept.getPending());
        assertEquals(units(60), swept.getLocked());
        assertEquals(units(40), swept.getQueued());
        assertEquals(units(950), swept.getUnclaimedReward());
        assertEquals(units(1_075), swept.getTotal());
        assertEquals(units(10_000 - 125 + 1_075), assets.balanceOf(ALICE));

        ParticipantSnapshot alice = engine.participant(ALICE);
        assertEquals(BigInteger.ZERO, alice.getPendingAmount());
        assertEquals(BigInteger.ZERO, alice.getLockedAmount());
        assertEquals(BigInteger.ZERO, alice.getQueuedWithdrawal());
        assertEquals(BigInteger.ZERO, alice.getUnclaimedReward());
        assertFalse(alice.isActive());
        assertInvariants();
        printSuccess("All four balances paid out and zeroed");
    }

    @Test
    @DisplayName("Emergency withdrawal with nothing held is rejected")
    void testEmergencyWithdraw_NothingHeld() {
        printTestHeader("Emergency Withdrawal With Nothing Held");

        PoolException e = assertThrows(PoolException.class, () -> engine.emergencyWithdraw(ALICE));

        assertEquals(PoolErrorCode.NOTHING_TO_WITHDRAW, e.getCode());
        printSuccess("Nothing to sweep");
    }

    @Test
    @DisplayName("Emergency withdrawal works while the epoch oracle is down")
    void testEmergencyWithdraw_IgnoresOracle() {
        printTestHeader("Emergency Withdrawal Without Oracle");
        AtomicBoolean oracleDown = new AtomicBoolean(false);
        engine = PoolEngine.builder()
            .poolAddress(POOL)
            .operator(OPERATOR)
            .feeBps(500)
            .initialEpoch(5)
            .assetTransfer(assets)
            .settlementChannel(channel)
            .epochOracle(() -> {
                if (oracleDown.get()) {
                    throw new IllegalStateException("oracle offline");
                }
                return oracle.currentEpoch();
            })
            .build();
        engine.deposit(ALICE, units(100));
        oracleDown.set(true);

        PoolException unavailable = assertThrows(PoolException.class, () -> engine.deposit(BOB, units(1)));
        printOutput("Deposit while oracle down", unavailable.getCode());
        assertEquals(PoolErrorCode.EPOCH_UNAVAILABLE, unavailable.getCode());

        assertEquals(units(100), engine.emergencyWithdraw(ALICE).getTotal());
        assertEquals(units(10_000), assets.balanceOf(ALICE));
        printSuccess("Emergency exit does not depend on the oracle");
    }

    @Test
    @DisplayName("User reward payout transfers and zeroes the unclaimed reward")
    void testClaimUserRewards() {
        printTestHeader("User Reward Payout");
        engine.deposit(ALICE, units(100));
        oracle.observe(6);
        channel.creditEpoch(6, units(100));
        engine.claimRewards(CAROL, List.of(6L));

        BigInteger paid = engine.claimUserRewards(ALICE).getAmount();

        assertEquals(units(95), paid);
        assertEquals(BigInteger.ZERO, engine.participant(ALICE).getUnclaimedReward());
        assertEquals(units(9_995), assets.balanceOf(ALICE));
        PoolException e = assertThrows(PoolException.class, () -> engine.claimUserRewards(ALICE));
        assertEquals(PoolErrorCode.NO_REWARDS, e.getCode());
        assertInvariants();
        printSuccess("Reward paid once");
    }

    @Test
    @DisplayName("Collaborator re-entering the engine mid-operation is rejected")
    void testReentrantCallRejected() {
        printTestHeader("Reentrancy Guard");
        List<PoolException> nested = new ArrayList<>();
        PoolEngine[] holder = new PoolEngine[1];
        AssetTransfer hostile = new AssetTransfer() {
            @Override
            public boolean transferIn(Address from, BigInteger amount) {
                return assets.transferIn(from, amount);
            }

            @Override
            public boolean transferOut(Address to, BigInteger amount) {
                try {
                    holder[0].completeWithdrawal(to);
                } catch (PoolException e) {
                    nested.add(e);
                }
                return assets.transferOut(to, amount);
            }

            @Override
            public BigInteger balanceOf(Address account) {
                return assets.balanceOf(account);
            }
        };
        holder[0] = newEngine(hostile, 500);
        holder[0].deposit(ALICE, units(100));
        holder[0].requestWithdrawal(ALICE, units(100));
        oracle.observe(6);

        BigInteger released = holder[0].completeWithdrawal(ALICE).getAmount();

        assertEquals(units(100), released);
        assertEquals(1, nested.size());
        assertEquals(PoolErrorCode.REENTRANT_CALL, nested.get(0).getCode());
        assertEquals(units(10_000), assets.balanceOf(ALICE));
        printSuccess("Nested call refused, outer call paid once");
    }

    @Test
    @DisplayName("Tier counts the thresholds met by the pool balance")
    void testTier() {
        printTestHeader("Tier Levels");
        assertEquals(0, engine.tier());

        engine.deposit(ALICE, units(100));
        assertEquals(1, engine.tier());

        engine.deposit(BOB, units(9_900));
        printOutput("Tier", engine.tier());
        assertEquals(3, engine.tier());
        printSuccess("Tier follows pool balance");
    }

    @Test
    @DisplayName("Events are published once per successful operation, in order")
    void testEventsPublished() {
        printTestHeader("Event Publication");
        engine.deposit(ALICE, units(100));
        oracle.observe(6);
        engine.deposit(BOB, units(100));

        List<String> types = published.stream().map(PoolEvent::getEventType).toList();
        printOutput("Event types", types);

        assertEquals(List.of("Deposited", "EpochProcessed", "Deposited"), types);
        assertEquals(ALICE, published.get(0).getSubject());
        assertEquals(BOB, published.get(2).getSubject());
        printSuccess("Events delivered in operation order");
    }

    @Test
    @DisplayName("Event sink failure rolls the operation back")
    void testEventSinkFailureRollsBack() {
        printTestHeader("Sink Failure Rolls Back");
        engine = PoolEngine.builder()
            .poolAddress(POOL)
            .operator(OPERATOR)
            .feeBps(500)
            .initialEpoch(5)
            .assetTransfer(assets)
            .settlementChannel(channel)
            .epochOracle(oracle)
            .eventSink(events -> {
                throw new IllegalStateException("outbox unavailable");
            })
            .build();

        assertThrows(IllegalStateException.class, () -> engine.setFee(OPERATOR, 1_000));

        assertEquals(500, engine.operatorState().getFeeBps());
        printSuccess("State restored after sink failure");
    }

    @Test
    @DisplayName("Operator work submissions are forwarded; others are rejected")
    void testSubmitWork() {
        printTestHeader("Work Submission");
        byte[] payload = {0x01, 0x02, 0x03};

        assertEquals(3, engine.submitWork(OPERATOR, payload).getPayloadSize());
        assertEquals(1, channel.getSubmissions().size());

        PoolException notOperator = assertThrows(PoolException.class, () -> engine.submitWork(ALICE, payload));
        assertEquals(PoolErrorCode.NOT_OPERATOR, notOperator.getCode());

        engine.setPaused(OPERATOR, true);
        PoolException paused = assertThrows(PoolException.class, () -> engine.submitWork(OPERATOR, payload));
        assertEquals(PoolErrorCode.PAUSED, paused.getCode());
        assertEquals(1, channel.getSubmissions().size());
        printSuccess("Only the operator reaches the settlement channel");
    }

    @Test
    @DisplayName("Refused work submission fails without events")
    void testSubmitWork_Refused() {
        WorkSettlementChannel refusing = new WorkSettlementChannel() {
            @Override
            public boolean submit(byte[] payload) {
                return false;
            }

            @Override
            public boolean claim(List<Long> epochIds) {
                return true;
            }
        };
        PoolEngine refusingEngine = PoolEngine.builder()
            .poolAddress(POOL)
            .operator(OPERATOR)
            .feeBps(500)
            .initialEpoch(5)
            .assetTransfer(assets)
            .settlementChannel(refusing)
            .epochOracle(oracle)
            .tierThresholds(List.of(units(100), units(1_000), units(10_000)))
            .eventSink(published::addAll)
            .build();

        PoolException e = assertThrows(PoolException.class,
            () -> refusingEngine.submitWork(OPERATOR, new byte[] {0x7f}));

        assertEquals(PoolErrorCode.SUBMIT_FAILED, e.getCode());
        assertTrue(published.isEmpty());
    }

    @Test
    @DisplayName("Claim of an epoch that was never credited distributes nothing and pays no fee")
    void testClaimRewards_UncreditedEpoch() {
        printTestHeader("Claim Of Uncredited Epoch");
        engine.deposit(ALICE, units(300));
        oracle.observe(6);
        engine.processEpoch(CAROL);
        BigInteger unclaimedBefore = engine.pool().getTotalUnclaimedReward();
        BigInteger poolBefore = assets.balanceOf(POOL);
        published.clear();
        printInput("Epochs", List.of(9L));

        RewardsClaimedEvent claimed = engine.claimRewards(CAROL, List.of(9L));
        printOutput("Total reward", claimed.getTotalReward());

        assertEquals(BigInteger.ZERO, claimed.getTotalReward());
        assertEquals(BigInteger.ZERO, claimed.getOperatorFee());
        assertEquals(BigInteger.ZERO, claimed.getDistributed());
        assertEquals(BigInteger.ZERO, assets.balanceOf(OPERATOR));
        assertEquals(poolBefore, assets.balanceOf(POOL));
        assertEquals(unclaimedBefore, engine.pool().getTotalUnclaimedReward());
        assertEquals(BigInteger.ZERO, engine.participant(ALICE).getUnclaimedReward());
        assertEquals(1, published.size());
        RewardsClaimedEvent publishedClaim = assertInstanceOf(RewardsClaimedEvent.class, published.get(0));
        assertEquals(BigInteger.ZERO, publishedClaim.getTotalReward());
        assertInvariants();
        printSuccess("Zero-reward claim recorded without transfers");
    }

    @Test
    @DisplayName("Pool view falls back to the last processed epoch while the oracle is down")
    void testPool_OracleUnavailable() {
        printTestHeader("Pool View Without Oracle");
        AtomicBoolean oracleDown = new AtomicBoolean(false);
        engine = PoolEngine.builder()
            .poolAddress(POOL)
            .operator(OPERATOR)
            .feeBps(500)
            .initialEpoch(5)
            .assetTransfer(assets)
            .settlementChannel(channel)
            .epochOracle(() -> {
                if (oracleDown.get()) {
                    throw new IllegalStateException("oracle offline");
                }
                return oracle.currentEpoch();
            })
            .build();
        engine.deposit(ALICE, units(100));
        oracle.observe(7);
        engine.processEpoch(BOB);
        oracleDown.set(true);

        PoolSnapshot snapshot = engine.pool();
        printOutput("Current epoch", snapshot.getCurrentEpoch());

        assertEquals(7, snapshot.getCurrentEpoch());
        assertEquals(7, snapshot.getLastProcessedEpoch());
        assertEquals(units(100), snapshot.getTotalLocked());
        PoolException e = assertThrows(PoolException.class, () -> engine.processEpoch(BOB));
        assertEquals(PoolErrorCode.EPOCH_UNAVAILABLE, e.getCode());
        printSuccess("Read-only view served from the last processed epoch");
    }

    @Test
    @DisplayName("Each operation commits its changes and events to the state store")
    void testStateStore_CommitsDelta() {
        printTestHeader("State Store Commit");
        RecordingStore store = new RecordingStore();
        engine = newEngine(assets, 500, store);

        engine.deposit(ALICE, units(100));

        assertEquals(1, store.deltas.size());
        PoolStateDelta delta = store.deltas.get(0);
        printOutput("Upserted", delta.getUpsertedParticipants().size());
        assertEquals(1, delta.getUpsertedParticipants().size());
        Participant alice = delta.getUpsertedParticipants().get(0);
        assertEquals(ALICE, alice.getIdentity());
        assertEquals(units(100), alice.getPendingAmount());
        assertTrue(alice.isActive());
        assertTrue(delta.getRemovedParticipants().isEmpty());
        assertTrue(delta.getChangedWithdrawals().isEmpty());
        assertEquals(5, delta.getLastProcessedEpoch());
        assertEquals(published, store.events.get(0));

        engine.setFee(OPERATOR, 700);
        PoolStateDelta feeOnly = store.deltas.get(1);
        assertTrue(feeOnly.getUpsertedParticipants().isEmpty());
        assertEquals(700, feeOnly.getOperatorState().getFeeBps());
        printSuccess("Only what changed is committed, with its events");
    }

    @Test
    @DisplayName("State store failure rolls the operation back and publishes nothing")
    void testStateStore_FailureRollsBack() {
        printTestHeader("State Store Failure");
        RecordingStore store = new RecordingStore();
        engine = newEngine(assets, 500, store);
        engine.deposit(ALICE, units(100));
        published.clear();
        store.failure = new IllegalStateException("database unavailable");

        assertThrows(IllegalStateException.class, () -> engine.setFee(OPERATOR, 1_000));
        assertThrows(IllegalStateException.class, () -> engine.requestWithdrawal(ALICE, units(40)));

        assertEquals(500, engine.operatorState().getFeeBps());
        assertEquals(units(100), engine.participant(ALICE).getPendingAmount());
        assertTrue(engine.pendingWithdrawals(ALICE).isEmpty());
        assertTrue(published.isEmpty());
        assertInvariants();
        printSuccess("Nothing changed in memory or downstream");
    }

    @Test
    @DisplayName("Engine restarted from committed changes resumes the same state")
    void testStateStore_RestoresAfterRestart() {
        printTestHeader("Restart From Store");
        DeltaApplyingStore store = new DeltaApplyingStore();
        engine = newEngine(assets, 500, store);
        engine.deposit(ALICE, units(300));
        engine.deposit(BOB, units(100));
        engine.deposit(CAROL, units(50));
        oracle.observe(6);
        channel.creditEpoch(6, units(1_000));
        engine.claimRewards(CAROL, List.of(6L));
        engine.requestWithdrawal(ALICE, units(120));
        engine.requestWithdrawal(ALICE, units(30));
        engine.emergencyWithdraw(CAROL);
        engine.setFee(OPERATOR, 800);
        engine.proposeOperator(OPERATOR, BOB);
        PoolState before = engine.stateCopy();

        PoolEngine restarted = newEngine(assets, 100, store);
        PoolState after = restarted.stateCopy();
        printOutput("Restored participants", after.getParticipants().keySet());

        assertEquals(before.getRoster(), after.getRoster());
        assertEquals(before.getParticipants().keySet(), after.getParticipants().keySet());
        before.getParticipants().forEach((identity, participant) ->
            assertTrue(participant.sameBalancesAs(after.getParticipants().get(identity)), identity.toString()));
        assertEquals(before.withdrawalsOf(ALICE), after.withdrawalsOf(ALICE));
        assertEquals(before.getTotalLocked(), after.getTotalLocked());
        assertEquals(before.getTotalPending(), after.getTotalPending());
        assertEquals(before.getTotalQueuedWithdrawal(), after.getTotalQueuedWithdrawal());
        assertEquals(before.getTotalUnclaimedReward(), after.getTotalUnclaimedReward());
        assertEquals(6, restarted.lastProcessedEpoch());
        assertEquals(800, restarted.operatorState().getFeeBps());
        assertEquals(BOB, restarted.operatorState().getPendingOperator());
        assertFalse(after.getParticipants().containsKey(CAROL));

        engine = restarted;
        assertInvariants();
        printSuccess("Stored state wins over the configured seed");
    }

    private PoolEngine newEngine(AssetTransfer assetTransfer, int feeBps, PoolStateStore store) {
        return PoolEngine.builder()
            .poolAddress(POOL)
            .operator(OPERATOR)
            .feeBps(feeBps)
            .initialEpoch(5)
            .assetTransfer(assetTransfer)
            .settlementChannel(channel)
            .epochOracle(oracle)
            .tierThresholds(List.of(units(100), units(1_000), units(10_000)))
            .eventSink(published::addAll)
            .stateStore(store)
            .build();
    }

    private static class RecordingStore implements PoolStateStore {
        private final List<PoolStateDelta> deltas = new ArrayList<>();
        private final List<List<PoolEvent>> events = new ArrayList<>();
        private RuntimeException failure;

        @Override
        public Optional<PoolState> load() {
            return Optional.empty();
        }

        @Override
        public void commit(PoolStateDelta delta, List<PoolEvent> committed) {
            if (failure != null) {
                throw failure;
            }
            deltas.add(delta);
            events.add(committed);
        }
    }

    /**
     * Keeps rows the way the database store does: participants by identity, whole
     * withdrawal queues per owner, and the pool-wide fields.
     */
    private static class DeltaApplyingStore implements PoolStateStore {
        private final Map<Address, Participant> participants = new LinkedHashMap<>();
        private final Map<Address, List<PendingWithdrawal>> withdrawals = new LinkedHashMap<>();
        private PoolStateDelta last;

        @Override
        public Optional<PoolState> load() {
            if (last == null) {
                return Optional.empty();
            }
            return Optional.of(PoolState.restore(last.getOperatorState(), last.getLastProcessedEpoch(),
                last.isPaused(), participants.values(), withdrawals));
        }

        @Override
        public void commit(PoolStateDelta delta, List<PoolEvent> committed) {
            delta.getUpsertedParticipants().forEach(p -> participants.put(p.getIdentity(), p.copy()));
            delta.getRemovedParticipants().forEach(participants::remove);
            delta.getChangedWithdrawals().forEach((owner, queue) -> {
                if (queue.isEmpty()) {
                    withdrawals.remove(owner);
                } else {
                    withdrawals.put(owner, new ArrayList<>(queue));
                }
            });
            last = delta;
        }
    }
}
