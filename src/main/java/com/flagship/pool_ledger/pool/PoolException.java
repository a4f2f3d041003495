package com.flagship.pool_ledger.pool;

import lombok.Getter;

/**
 * Synchronous, typed rejection of a pool operation.
 */
@Getter
public class PoolException extends RuntimeException {

    private final PoolErrorCode code;

    public PoolException(PoolErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public PoolException(PoolErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public PoolErrorCode.Category getCategory() {
        return code.getCategory();
    }
}
