package com.flagship.pool_ledger.external;

/**
 * Authoritative, externally advanced epoch counter.
 * Values are expected to be monotonically non-decreasing.
 */
@FunctionalInterface
public interface EpochOracle {

    long currentEpoch();
}
