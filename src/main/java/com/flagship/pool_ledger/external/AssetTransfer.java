package com.flagship.pool_ledger.external;

import com.flagship.pool_ledger.pool.Address;

import java.math.BigInteger;

/**
 * The fungible asset the pool custodies.
 *
 * Transfers are all-or-nothing: either exactly {@code amount} moves and {@code true} is
 * returned, or nothing moves. Implementations may signal failure by returning
 * {@code false} or by throwing.
 */
public interface AssetTransfer {

    /**
     * Pulls {@code amount} from {@code from} into the pool.
     */
    boolean transferIn(Address from, BigInteger amount);

    /**
     * Pays {@code amount} out of the pool to {@code to}.
     */
    boolean transferOut(Address to, BigInteger amount);

    BigInteger balanceOf(Address account);
}
