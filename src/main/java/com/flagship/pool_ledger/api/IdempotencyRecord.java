package com.flagship.pool_ledger.api;

import com.flagship.pool_ledger.api.dto.ReceiptResponse;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * What an idempotency key was first used for, and the receipt it produced.
 * {@code fingerprint} identifies the request body so a key reused for a different request
 * can be told apart from a retry.
 */
@Value
@Builder
@Jacksonized
public class IdempotencyRecord {
    String fingerprint;
    ReceiptResponse receipt;
}
