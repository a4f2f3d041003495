package com.flagship.pool_ledger.pool;

import lombok.Value;

import java.math.BigInteger;

/**
 * A queued withdrawal. Releasable once the epoch reaches {@code availableEpoch}.
 */
@Value
public class PendingWithdrawal {
    Address owner;
    BigInteger amount;
    long availableEpoch;

    public boolean isMatureAt(long epoch) {
        return availableEpoch <= epoch;
    }
}
