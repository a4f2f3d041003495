package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Proposes the next operator. The zero address withdraws an outstanding proposal.
 */
@Value
public class OperatorProposalRequest {

    @NotNull(message = "Candidate is required")
    @JsonProperty("candidate")
    String candidate;
}
