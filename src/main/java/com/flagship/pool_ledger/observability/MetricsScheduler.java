package com.flagship.pool_ledger.observability;

import com.flagship.pool_ledger.pool.PoolEngine;
import com.flagship.pool_ledger.pool.PoolException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauge values that are cheaper to cache than to compute per scrape.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final PoolMetrics poolMetrics;
    private final PoolEngine poolEngine;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    /**
     * Keeps the previous gauge values when the epoch oracle cannot be read.
     */
    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshPoolMetrics() {
        try {
            poolMetrics.refreshPoolMetrics(poolEngine.pool());
        } catch (PoolException e) {
            log.warn("Skipping pool metrics refresh: code={}, reason={}", e.getCode(), e.getMessage());
        }
    }
}
