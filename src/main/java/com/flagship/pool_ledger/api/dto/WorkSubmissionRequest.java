package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

/**
 * Opaque work payload forwarded to the settlement channel, hex encoded.
 */
@Value
public class WorkSubmissionRequest {

    @NotNull(message = "Payload is required")
    @Pattern(regexp = "^(0x)?([0-9a-fA-F]{2})*$", message = "Payload must be hex encoded")
    @JsonProperty("payload")
    String payload;
}
