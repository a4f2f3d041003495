package com.flagship.pool_ledger.pool;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Pool-wide view.
 *
 * {@code surplus} is the asset balance beyond everything owed to depositors: rounding
 * dust and rewards that had no locked holder to go to. It is carried forward, never swept.
 */
@Value
@Builder
public class PoolSnapshot {
    BigInteger totalLocked;
    BigInteger totalPending;
    BigInteger totalQueuedWithdrawal;
    BigInteger totalUnclaimedReward;
    int depositorCount;
    int tier;
    long currentEpoch;
    long lastProcessedEpoch;
    int feeBps;
    Address operator;
    Address pendingOperator;
    boolean paused;
    BigInteger poolBalance;
    BigInteger surplus;
}
