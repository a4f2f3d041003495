package com.flagship.pool_ledger.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pool_ledger.external.ObservedEpochOracle;
import com.flagship.pool_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.MDC;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;

import java.util.OptionalLong;

/**
 * Kafka consumer for epoch announcements from the external coordinator.
 *
 * Each record carries {@code {"epoch": n}}. Announcements feed the {@link ObservedEpochOracle},
 * which keeps the highest epoch seen, so redelivered and out-of-order records are harmless.
 * The pool itself catches up lazily: the next deposit, withdrawal or claim processes the
 * announced epoch.
 *
 * Manual acknowledgment: offsets are committed only after the announcement is recorded.
 * Malformed records are acknowledged and skipped, since redelivery cannot fix them.
 *
 * Declared by {@code PoolConfiguration} only when the in-process {@link ObservedEpochOracle}
 * is in use; disable with consumer.enabled=false.
 */
@RequiredArgsConstructor
@Slf4j
public class EpochTickConsumer {

    private final ObservedEpochOracle epochOracle;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.epoch-ticks:pool.epoch-ticks}",
        groupId = "${spring.kafka.consumer.group-id:pool-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.generateCorrelationId());
        try {
            log.debug("Received epoch tick: topic={}, partition={}, offset={}",
                    record.topic(), record.partition(), record.offset());

            OptionalLong epoch = parseEpoch(record.value());
            if (epoch.isEmpty()) {
                log.warn("Could not parse epoch tick, acknowledging to skip: {}", record.value());
                ack.acknowledge();
                return;
            }

            epochOracle.observe(epoch.getAsLong());
            ack.acknowledge();

        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
        }
    }

    /**
     * Extracts a non-negative integral epoch, or empty if the payload has none.
     */
    OptionalLong parseEpoch(String json) {
        if (json == null || json.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            JsonNode epoch = objectMapper.readTree(json).get("epoch");
            if (epoch == null || !epoch.canConvertToLong() || !epoch.isIntegralNumber() || epoch.asLong() < 0) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(epoch.asLong());
        } catch (Exception e) {
            log.error("Failed to parse epoch tick: {}", e.getMessage());
            return OptionalLong.empty();
        }
    }
}
