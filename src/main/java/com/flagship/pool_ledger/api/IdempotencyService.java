package com.flagship.pool_ledger.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pool_ledger.config.PoolProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Service for idempotency key management.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to database (slower, but always available and survives restarts)
 * 3. Store in both for future lookups
 *
 * Keys expire after {@code pool.idempotency.ttl} in both stores.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "pool:idempotency:";

    private final IdempotencyRecordRepository repository;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public IdempotencyService(IdempotencyRecordRepository repository,
                              Optional<StringRedisTemplate> redisTemplate,
                              ObjectMapper objectMapper,
                              PoolProperties properties) {
        this.repository = repository;
        this.redisTemplate = properties.getIdempotency().isRedisEnabled() ? redisTemplate : Optional.empty();
        this.objectMapper = objectMapper;
        this.ttl = properties.getIdempotency().getTtl();
    }

    /**
     * Looks up a previously recorded request.
     *
     * @param scopedKey Idempotency key qualified by operation and caller
     * @return the stored record, or empty if the key is unused or expired
     */
    public Optional<IdempotencyRecord> find(String scopedKey) {
        requireKey(scopedKey);

        if (redisTemplate.isPresent()) {
            try {
                String json = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + scopedKey);
                if (json != null) {
                    log.debug("Idempotency key found in Redis: {}", scopedKey);
                    return Optional.of(objectMapper.readValue(json, IdempotencyRecord.class));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        scopedKey, e.getMessage());
            }
        }

        Optional<IdempotencyRecordEntity> stored = repository.findById(scopedKey)
            .filter(entity -> !entity.isExpired(Instant.now()));
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        log.debug("Idempotency key found in database: {}", scopedKey);
        return Optional.of(deserialize(stored.get().getRecord()));
    }

    /**
     * Records the outcome of a request. The database is written first and is authoritative;
     * Redis is best effort.
     */
    public void store(String scopedKey, IdempotencyRecord record) {
        requireKey(scopedKey);
        if (record == null) {
            throw new IllegalArgumentException("Idempotency record cannot be null");
        }

        String json = serialize(record);
        Instant now = Instant.now();
        repository.save(IdempotencyRecordEntity.of(scopedKey, json, now, now.plus(ttl)));

        if (redisTemplate.isPresent()) {
            try {
                redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + scopedKey, json, ttl);
                log.debug("Stored idempotency key in Redis: {}", scopedKey);
            } catch (Exception e) {
                log.warn("Failed to store idempotency key in Redis: {}. Error: {}", scopedKey, e.getMessage());
            }
        }
    }

    /**
     * Deletes expired rows. Redis expires its copies on its own.
     */
    @Scheduled(fixedRateString = "${pool.idempotency.eviction-interval-ms:60000}")
    @Transactional
    public void evictExpired() {
        int evicted = repository.deleteExpired(Instant.now());
        if (evicted > 0) {
            log.debug("Evicted {} expired idempotency keys", evicted);
        }
    }

    private String serialize(IdempotencyRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize idempotency record", e);
        }
    }

    private IdempotencyRecord deserialize(String json) {
        try {
            return objectMapper.readValue(json, IdempotencyRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored idempotency record is unreadable", e);
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
