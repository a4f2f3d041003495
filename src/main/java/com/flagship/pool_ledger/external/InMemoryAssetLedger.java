package com.flagship.pool_ledger.external;

import com.flagship.pool_ledger.pool.Address;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Balance book of the custodied asset, kept in process.
 *
 * Used when the service runs standalone and in tests. Transfers are atomic per call: a
 * transfer the sender cannot cover moves nothing and returns {@code false}.
 */
@Slf4j
public class InMemoryAssetLedger implements AssetTransfer {

    private final Address poolAddress;
    private final Map<Address, BigInteger> balances = new ConcurrentHashMap<>();

    public InMemoryAssetLedger(Address poolAddress) {
        this.poolAddress = poolAddress;
    }

    @Override
    public synchronized boolean transferIn(Address from, BigInteger amount) {
        return move(from, poolAddress, amount);
    }

    @Override
    public synchronized boolean transferOut(Address to, BigInteger amount) {
        return move(poolAddress, to, amount);
    }

    @Override
    public BigInteger balanceOf(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    /**
     * Creates {@code amount} new units in {@code account}. Funding hook for wallets and
     * for settlement payouts.
     */
    public synchronized void mint(Address account, BigInteger amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Mint amount must be positive");
        }
        balances.merge(account, amount, BigInteger::add);
        log.debug("Minted {} to {}", amount, account);
    }

    private boolean move(Address from, Address to, BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            return false;
        }
        BigInteger available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            log.debug("Transfer refused: {} holds {}, needs {}", from, available, amount);
            return false;
        }
        balances.put(from, available.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        return true;
    }
}
