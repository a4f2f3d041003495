package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class FeeUpdateRequest {

    @NotNull(message = "Fee is required")
    @JsonProperty("fee_bps")
    Integer feeBps;
}
