package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class SignatureVerificationResponse {

    @JsonProperty("magic_value")
    String magicValue;
}
