package com.flagship.pool_ledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pool_ledger.consumer.EpochTickConsumer;
import com.flagship.pool_ledger.external.AssetTransfer;
import com.flagship.pool_ledger.external.EpochOracle;
import com.flagship.pool_ledger.external.InMemoryAssetLedger;
import com.flagship.pool_ledger.external.InMemorySettlementChannel;
import com.flagship.pool_ledger.external.ObservedEpochOracle;
import com.flagship.pool_ledger.external.WorkSettlementChannel;
import com.flagship.pool_ledger.pool.Address;
import com.flagship.pool_ledger.pool.PoolEngine;
import com.flagship.pool_ledger.pool.PoolStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the accounting engine to its collaborators.
 *
 * The in-process asset ledger and settlement channel are defaults for running standalone;
 * a deployment connects real ones by declaring its own {@link AssetTransfer} and
 * {@link WorkSettlementChannel} beans. The in-process channel settles into the in-process
 * ledger, so it is only created alongside it.
 *
 * Pool state lives in the {@link PoolStateStore}; the configured operator, fee and initial
 * epoch only seed an empty store.
 */
@Configuration
@Slf4j
public class PoolConfiguration {

    @Bean
    public Address poolAddress(PoolProperties properties) {
        return Address.of(properties.getAddress());
    }

    @Bean
    @ConditionalOnMissingBean(AssetTransfer.class)
    public InMemoryAssetLedger inMemoryAssetLedger(Address poolAddress) {
        log.info("Using in-process asset ledger for pool {}", poolAddress);
        return new InMemoryAssetLedger(poolAddress);
    }

    @Bean
    @ConditionalOnBean(InMemoryAssetLedger.class)
    @ConditionalOnMissingBean(WorkSettlementChannel.class)
    public InMemorySettlementChannel inMemorySettlementChannel(InMemoryAssetLedger assetLedger, Address poolAddress) {
        log.info("Using in-process work settlement channel");
        return new InMemorySettlementChannel(assetLedger, poolAddress);
    }

    @Bean
    @ConditionalOnMissingBean(EpochOracle.class)
    public ObservedEpochOracle observedEpochOracle(PoolProperties properties) {
        return new ObservedEpochOracle(properties.getInitialEpoch());
    }

    @Bean
    @ConditionalOnBean(ObservedEpochOracle.class)
    @ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
    public EpochTickConsumer epochTickConsumer(ObservedEpochOracle epochOracle, ObjectMapper objectMapper) {
        log.info("Consuming epoch announcements into the observed epoch oracle");
        return new EpochTickConsumer(epochOracle, objectMapper);
    }

    @Bean
    public PoolEngine poolEngine(PoolProperties properties,
                                 Address poolAddress,
                                 AssetTransfer assetTransfer,
                                 WorkSettlementChannel settlementChannel,
                                 EpochOracle epochOracle,
                                 PoolStateStore poolStateStore) {
        PoolEngine engine = PoolEngine.builder()
            .poolAddress(poolAddress)
            .operator(Address.of(properties.getOperator()))
            .feeBps(properties.getFeeBps())
            .initialEpoch(properties.getInitialEpoch())
            .assetTransfer(assetTransfer)
            .settlementChannel(settlementChannel)
            .epochOracle(epochOracle)
            .tierThresholds(properties.getTierThresholds())
            .stateStore(poolStateStore)
            .build();

        log.info("Pool engine ready: pool={}, operator={}, feeBps={}, lastProcessedEpoch={}, tiers={}",
            poolAddress, engine.currentOperator(), engine.operatorState().getFeeBps(), engine.lastProcessedEpoch(),
            properties.getTierThresholds());
        return engine;
    }
}
