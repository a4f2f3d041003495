package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pool_ledger.pool.ParticipantSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class ParticipantResponse {

    @JsonProperty("address")
    String address;

    @JsonProperty("locked_amount")
    BigInteger lockedAmount;

    @JsonProperty("pending_amount")
    BigInteger pendingAmount;

    @JsonProperty("lock_epoch")
    long lockEpoch;

    @JsonProperty("unclaimed_reward")
    BigInteger unclaimedReward;

    @JsonProperty("queued_withdrawal")
    BigInteger queuedWithdrawal;

    @JsonProperty("active")
    boolean active;

    public static ParticipantResponse from(ParticipantSnapshot snapshot) {
        return ParticipantResponse.builder()
            .address(snapshot.getIdentity().toString())
            .lockedAmount(snapshot.getLockedAmount())
            .pendingAmount(snapshot.getPendingAmount())
            .lockEpoch(snapshot.getLockEpoch())
            .unclaimedReward(snapshot.getUnclaimedReward())
            .queuedWithdrawal(snapshot.getQueuedWithdrawal())
            .active(snapshot.isActive())
            .build();
    }
}
