package com.flagship.pool_ledger.external;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Epoch oracle fed by announcements from the external coordinator.
 *
 * Announcements may arrive late, twice or out of order; the reported epoch is the highest
 * one observed, so the value never decreases.
 */
@Slf4j
public class ObservedEpochOracle implements EpochOracle {

    private final AtomicLong epoch;

    public ObservedEpochOracle(long initialEpoch) {
        this.epoch = new AtomicLong(initialEpoch);
    }

    @Override
    public long currentEpoch() {
        return epoch.get();
    }

    /**
     * Records an announced epoch.
     *
     * @return {@code true} if the announcement moved the epoch forward
     */
    public boolean observe(long announced) {
        long previous = epoch.getAndAccumulate(announced, Math::max);
        if (announced > previous) {
            log.info("Epoch advanced: {} -> {}", previous, announced);
            return true;
        }
        log.debug("Ignoring stale epoch announcement {} (current {})", announced, previous);
        return false;
    }
}
