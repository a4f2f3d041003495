package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pool_ledger.pool.PoolSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Response DTO for the pool-wide view.
 */
@Value
@Builder
public class PoolResponse {

    @JsonProperty("total_locked")
    BigInteger totalLocked;

    @JsonProperty("total_pending")
    BigInteger totalPending;

    @JsonProperty("total_queued_withdrawal")
    BigInteger totalQueuedWithdrawal;

    @JsonProperty("total_unclaimed_reward")
    BigInteger totalUnclaimedReward;

    @JsonProperty("depositor_count")
    int depositorCount;

    @JsonProperty("tier")
    int tier;

    @JsonProperty("current_epoch")
    long currentEpoch;

    @JsonProperty("last_processed_epoch")
    long lastProcessedEpoch;

    @JsonProperty("fee_bps")
    int feeBps;

    @JsonProperty("operator")
    String operator;

    @JsonProperty("pending_operator")
    String pendingOperator;

    @JsonProperty("paused")
    boolean paused;

    @JsonProperty("pool_balance")
    BigInteger poolBalance;

    @JsonProperty("surplus")
    BigInteger surplus;

    public static PoolResponse from(PoolSnapshot snapshot) {
        return PoolResponse.builder()
            .totalLocked(snapshot.getTotalLocked())
            .totalPending(snapshot.getTotalPending())
            .totalQueuedWithdrawal(snapshot.getTotalQueuedWithdrawal())
            .totalUnclaimedReward(snapshot.getTotalUnclaimedReward())
            .depositorCount(snapshot.getDepositorCount())
            .tier(snapshot.getTier())
            .currentEpoch(snapshot.getCurrentEpoch())
            .lastProcessedEpoch(snapshot.getLastProcessedEpoch())
            .feeBps(snapshot.getFeeBps())
            .operator(snapshot.getOperator().toString())
            .pendingOperator(snapshot.getPendingOperator().toString())
            .paused(snapshot.isPaused())
            .poolBalance(snapshot.getPoolBalance())
            .surplus(snapshot.getSurplus())
            .build();
    }
}
