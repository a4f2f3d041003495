package com.flagship.pool_ledger.observability;

import com.flagship.pool_ledger.pool.PoolErrorCode;
import com.flagship.pool_ledger.pool.PoolSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Centralized metrics for pool operations.
 *
 * Metrics exposed:
 * - pool.operations: Counter of operations by name and outcome
 * - pool.operations.latency: Timer per operation
 * - pool.deposits.amount / pool.withdrawals.amount / pool.rewards.amount: asset flow summaries
 * - pool.epochs.processed: Counter of epoch advances
 * - idempotency.cache: hits and misses on receipt lookups
 * - pool.totals, pool.depositors, pool.tier, pool.epoch.last_processed: gauges refreshed
 *   from the latest pool snapshot
 */
@Component
public class PoolMetrics {

    private final MeterRegistry registry;

    private final Counter epochsProcessed;

    // Cached values updated periodically
    private final AtomicReference<BigInteger> totalLocked = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> totalPending = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> totalQueued = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicReference<BigInteger> totalUnclaimed = new AtomicReference<>(BigInteger.ZERO);
    private final AtomicLong depositorCount = new AtomicLong(0);
    private final AtomicLong tier = new AtomicLong(0);
    private final AtomicLong lastProcessedEpoch = new AtomicLong(0);

    public PoolMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.epochsProcessed = Counter.builder("pool.epochs.processed")
                .description("Explicit epoch processing calls that advanced the cursor")
                .register(registry);

        registerTotal("locked", totalLocked);
        registerTotal("pending", totalPending);
        registerTotal("queued_withdrawal", totalQueued);
        registerTotal("unclaimed_reward", totalUnclaimed);

        Gauge.builder("pool.depositors", depositorCount, AtomicLong::get)
                .description("Participants currently holding stake")
                .register(registry);
        Gauge.builder("pool.tier", tier, AtomicLong::get)
                .description("Tier thresholds met by the pool balance")
                .register(registry);
        Gauge.builder("pool.epoch.last_processed", lastProcessedEpoch, AtomicLong::get)
                .description("Epoch cursor of the pool")
                .register(registry);
    }

    private void registerTotal(String bucket, AtomicReference<BigInteger> value) {
        Gauge.builder("pool.totals", value, ref -> ref.get().doubleValue())
                .description("Pool-wide liabilities in asset base units")
                .tag("bucket", bucket)
                .register(registry);
    }

    /**
     * Refreshes the cached gauge values. Called periodically by the scheduler.
     */
    public void refreshPoolMetrics(PoolSnapshot snapshot) {
        totalLocked.set(snapshot.getTotalLocked());
        totalPending.set(snapshot.getTotalPending());
        totalQueued.set(snapshot.getTotalQueuedWithdrawal());
        totalUnclaimed.set(snapshot.getTotalUnclaimedReward());
        depositorCount.set(snapshot.getDepositorCount());
        tier.set(snapshot.getTier());
        lastProcessedEpoch.set(snapshot.getLastProcessedEpoch());
    }

    // ==================== Operation Outcomes ====================

    public void recordSuccess(String operation) {
        registry.counter("pool.operations",
                "operation", operation,
                "outcome", "success"
        ).increment();
    }

    /**
     * Failures are tagged with the error code, a bounded set.
     */
    public void recordFailure(String operation, PoolErrorCode code) {
        registry.counter("pool.operations",
                "operation", operation,
                "outcome", "failure",
                "code", code.name()
        ).increment();
    }

    public void recordUnexpectedFailure(String operation) {
        registry.counter("pool.operations",
                "operation", operation,
                "outcome", "error"
        ).increment();
    }

    public void recordLatency(String operation, Duration duration) {
        registry.timer("pool.operations.latency",
                "operation", operation
        ).record(duration);
    }

    // ==================== Asset Flows ====================

    public void recordDeposit(BigInteger amount) {
        registry.summary("pool.deposits.amount").record(amount.doubleValue());
    }

    public void recordWithdrawal(String kind, BigInteger amount) {
        registry.summary("pool.withdrawals.amount", "kind", kind).record(amount.doubleValue());
    }

    public void recordRewards(BigInteger total, BigInteger operatorFee) {
        registry.summary("pool.rewards.amount", "share", "total").record(total.doubleValue());
        registry.summary("pool.rewards.amount", "share", "operator_fee").record(operatorFee.doubleValue());
    }

    public void incrementEpochsProcessed() {
        epochsProcessed.increment();
    }

    // ==================== Idempotency ====================

    /**
     * Records an idempotency cache hit (duplicate request).
     */
    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    /**
     * Records an idempotency cache miss (new request).
     */
    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }
}
