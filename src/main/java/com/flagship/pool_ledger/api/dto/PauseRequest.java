package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class PauseRequest {

    @NotNull(message = "Paused flag is required")
    @JsonProperty("paused")
    Boolean paused;
}
