package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

/**
 * A 32-byte message hash and a 65-byte r||s||v signature, both hex encoded.
 */
@Value
public class SignatureVerificationRequest {

    @NotNull(message = "Hash is required")
    @Pattern(regexp = "^(0x)?([0-9a-fA-F]{2})*$", message = "Hash must be hex encoded")
    @JsonProperty("hash")
    String hash;

    @NotNull(message = "Signature is required")
    @Pattern(regexp = "^(0x)?([0-9a-fA-F]{2})*$", message = "Signature must be hex encoded")
    @JsonProperty("signature")
    String signature;
}
