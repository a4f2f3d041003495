package com.flagship.pool_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for operations that move a participant's funds.
 *
 * {@code receipt_id} is the id of the event the operation produced, so a receipt can be
 * matched with what consumers of the events topic see. Fields that do not apply to the
 * operation are omitted.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReceiptResponse {

    @JsonProperty("receipt_id")
    UUID receiptId;

    @JsonProperty("operation")
    String operation;

    @JsonProperty("caller")
    String caller;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("lock_epoch")
    Long lockEpoch;

    @JsonProperty("from_pending")
    BigInteger fromPending;

    @JsonProperty("from_locked")
    BigInteger fromLocked;

    @JsonProperty("available_epoch")
    Long availableEpoch;

    @JsonProperty("released_records")
    Integer releasedRecords;

    @JsonProperty("payload_size")
    Integer payloadSize;

    @JsonProperty("occurred_at")
    Instant occurredAt;
}
