package com.flagship.pool_ledger.pool;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Typed rejection reasons. Every rejection leaves the pool unchanged.
 */
@Getter
@RequiredArgsConstructor
public enum PoolErrorCode {
    INVALID_AMOUNT(Category.VALIDATION),
    FEE_TOO_HIGH(Category.VALIDATION),
    INVALID_SIGNATURE_LENGTH(Category.VALIDATION),
    INVALID_ADDRESS(Category.VALIDATION),

    NOT_OPERATOR(Category.AUTHORIZATION),
    NOT_PENDING_OPERATOR(Category.AUTHORIZATION),

    INSUFFICIENT_BALANCE(Category.INSUFFICIENT_BALANCE),
    NO_REWARDS(Category.INSUFFICIENT_BALANCE),
    NOTHING_TO_WITHDRAW(Category.INSUFFICIENT_BALANCE),

    PAUSED(Category.STATE),
    NOTHING_TO_RELEASE(Category.STATE),
    WITHDRAWAL_NOT_MATURE(Category.STATE),
    REENTRANT_CALL(Category.STATE),

    TRANSFER_FAILED(Category.EXTERNAL),
    CLAIM_FAILED(Category.EXTERNAL),
    SUBMIT_FAILED(Category.EXTERNAL),
    EPOCH_UNAVAILABLE(Category.EXTERNAL);

    private final Category category;

    public enum Category {
        /** Malformed input; retry with corrected input. */
        VALIDATION,
        /** Caller lacks the required role. */
        AUTHORIZATION,
        /** Caller's balance does not cover the request. */
        INSUFFICIENT_BALANCE,
        /** Operation not allowed in the current pool or queue state. */
        STATE,
        /** A collaborator (asset transfer, settlement channel, epoch oracle) failed. */
        EXTERNAL
    }
}
