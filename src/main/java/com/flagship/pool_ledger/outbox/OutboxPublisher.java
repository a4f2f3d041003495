package com.flagship.pool_ledger.outbox;

import com.flagship.pool_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Background publisher that drains the outbox to Kafka.
 *
 * This component:
 * 1. Polls the outbox for unpublished events, oldest first
 * 2. Publishes each event to the pool events topic
 * 3. Marks events as published on success
 * 4. Handles failures with retry logic
 *
 * Participant address is the Kafka key, so one participant's events stay ordered
 * within a partition.
 *
 * Failure handling:
 * - Failed publishes increment retry count
 * - Events reaching max retries become "dead letter" events, kept for inspection but no
 *   longer attempted
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.events:pool.events}")
    private String eventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize, maxRetries);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    /**
     * Publishes a single event and waits for the broker acknowledgment.
     */
    void publishEvent(OutboxEvent event) {
        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(eventsTopic, event.getSubject(), event.getPayload());

            SendResult<String, String> result = future.get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        outboxService.markFailed(event.getId(), error)
                .filter(failed -> failed.isDeadLettered(maxRetries))
                .ifPresent(failed -> {
                    log.warn("Event {} has exceeded max retries ({}), moving to dead letter. eventType={}, subject={}",
                            failed.getId(), maxRetries, failed.getEventType(), failed.getSubject());
                    outboxMetrics.recordEventDeadLettered(failed.getEventType());
                });
    }

    /**
     * Manually triggers publishing (useful for testing).
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
