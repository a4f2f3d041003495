package com.flagship.pool_ledger.pool;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

@Value
@Builder
public class ParticipantSnapshot {
    Address identity;
    BigInteger lockedAmount;
    BigInteger pendingAmount;
    long lockEpoch;
    BigInteger unclaimedReward;
    BigInteger queuedWithdrawal;
    boolean active;

    static ParticipantSnapshot of(PoolState state, Address identity) {
        Participant participant = state.findParticipant(identity).orElse(null);
        if (participant == null) {
            return ParticipantSnapshot.builder()
                .identity(identity)
                .lockedAmount(BigInteger.ZERO)
                .pendingAmount(BigInteger.ZERO)
                .unclaimedReward(BigInteger.ZERO)
                .queuedWithdrawal(state.queuedWithdrawalOf(identity))
                .build();
        }
        return ParticipantSnapshot.builder()
            .identity(identity)
            .lockedAmount(participant.getLockedAmount())
            .pendingAmount(participant.getPendingAmount())
            .lockEpoch(participant.getLockEpoch())
            .unclaimedReward(participant.getUnclaimedReward())
            .queuedWithdrawal(state.queuedWithdrawalOf(identity))
            .active(participant.isActive())
            .build();
    }
}
