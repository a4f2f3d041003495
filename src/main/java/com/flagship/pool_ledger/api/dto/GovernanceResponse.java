package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pool_ledger.pool.OperatorState;
import lombok.Builder;
import lombok.Value;

/**
 * Operator, fee and pause settings after an administrative change.
 */
@Value
@Builder
public class GovernanceResponse {

    @JsonProperty("operator")
    String operator;

    @JsonProperty("pending_operator")
    String pendingOperator;

    @JsonProperty("fee_bps")
    int feeBps;

    @JsonProperty("paused")
    boolean paused;

    public static GovernanceResponse from(OperatorState operatorState, boolean paused) {
        return GovernanceResponse.builder()
            .operator(operatorState.getOperator().toString())
            .pendingOperator(operatorState.getPendingOperator().toString())
            .feeBps(operatorState.getFeeBps())
            .paused(paused)
            .build();
    }
}
