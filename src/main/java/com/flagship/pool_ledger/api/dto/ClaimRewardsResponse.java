package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pool_ledger.pool.event.RewardsClaimedEvent;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ClaimRewardsResponse {

    @JsonProperty("receipt_id")
    UUID receiptId;

    @JsonProperty("epoch_ids")
    List<Long> epochIds;

    @JsonProperty("total_reward")
    BigInteger totalReward;

    @JsonProperty("operator_fee")
    BigInteger operatorFee;

    @JsonProperty("distributed")
    BigInteger distributed;

    @JsonProperty("undistributed")
    BigInteger undistributed;

    @JsonProperty("recipients")
    int recipients;

    public static ClaimRewardsResponse from(RewardsClaimedEvent event) {
        return ClaimRewardsResponse.builder()
            .receiptId(event.getEventId())
            .epochIds(event.getEpochIds())
            .totalReward(event.getTotalReward())
            .operatorFee(event.getOperatorFee())
            .distributed(event.getDistributed())
            .undistributed(event.getUndistributed())
            .recipients(event.getRecipients())
            .build();
    }
}
