package com.flagship.pool_ledger.external;

import com.flagship.pool_ledger.pool.Address;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Work-settlement channel simulated in process.
 *
 * Rewards are registered per epoch with {@link #creditEpoch(long, BigInteger)}; a claim pays
 * every registered, not yet claimed epoch among those requested into the pool's balance.
 * Unknown or already claimed epochs contribute nothing, mirroring a remote channel whose
 * payout depends on the work actually done.
 */
@Slf4j
public class InMemorySettlementChannel implements WorkSettlementChannel {

    private final InMemoryAssetLedger assetLedger;
    private final Address poolAddress;
    private final Map<Long, BigInteger> unclaimedByEpoch = new HashMap<>();
    private final List<byte[]> submissions = new ArrayList<>();

    public InMemorySettlementChannel(InMemoryAssetLedger assetLedger, Address poolAddress) {
        this.assetLedger = assetLedger;
        this.poolAddress = poolAddress;
    }

    public synchronized void creditEpoch(long epoch, BigInteger reward) {
        unclaimedByEpoch.merge(epoch, reward, BigInteger::add);
    }

    @Override
    public synchronized boolean submit(byte[] payload) {
        submissions.add(payload.clone());
        log.debug("Accepted work submission #{} ({} bytes)", submissions.size(), payload.length);
        return true;
    }

    @Override
    public synchronized boolean claim(List<Long> epochIds) {
        BigInteger payout = BigInteger.ZERO;
        for (Long epoch : epochIds) {
            BigInteger reward = unclaimedByEpoch.remove(epoch);
            if (reward != null) {
                payout = payout.add(reward);
            }
        }
        if (payout.signum() > 0) {
            assetLedger.mint(poolAddress, payout);
        }
        log.debug("Settled epochs {} for {}", epochIds, payout);
        return true;
    }

    public synchronized List<byte[]> getSubmissions() {
        return Collections.unmodifiableList(new ArrayList<>(submissions));
    }
}
