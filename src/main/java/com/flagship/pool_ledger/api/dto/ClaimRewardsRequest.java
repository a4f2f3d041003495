package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class ClaimRewardsRequest {

    @NotNull(message = "Epoch ids are required")
    @JsonProperty("epoch_ids")
    List<@NotNull Long> epochIds;
}
