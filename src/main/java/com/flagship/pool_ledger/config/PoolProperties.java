package com.flagship.pool_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Pool deployment parameters.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "pool")
public class PoolProperties {

    /**
     * The pool's own identity in the asset ledger.
     */
    private String address;

    /**
     * Initial operator. Later changes go through the two-step handoff.
     */
    private String operator;

    /**
     * Initial operator fee in basis points, at most 2000.
     */
    private int feeBps = 500;

    /**
     * Epoch cursor at startup.
     */
    private long initialEpoch = 0;

    /**
     * Ascending pool balances (asset base units) unlocking tiers 1, 2 and 3.
     */
    private List<BigInteger> tierThresholds = new ArrayList<>();

    private Idempotency idempotency = new Idempotency();

    @Getter
    @Setter
    public static class Idempotency {
        private boolean redisEnabled = true;
        private Duration ttl = Duration.ofDays(7);
    }
}
