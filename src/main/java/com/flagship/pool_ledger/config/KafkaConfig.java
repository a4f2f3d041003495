package com.flagship.pool_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topics:
 * - pool events published from the outbox
 * - epoch ticks announced by the external coordinator
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.events:pool.events}")
    private String eventsTopic;

    @Value("${kafka.topic.epoch-ticks:pool.epoch-ticks}")
    private String epochTicksTopic;

    /**
     * Partitioned by participant address, 3 partitions for parallel consumers.
     */
    @Bean
    public NewTopic poolEventsTopic() {
        return TopicBuilder.name(eventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    /**
     * Single partition: ticks are only meaningful in order.
     */
    @Bean
    public NewTopic epochTicksTopic() {
        return TopicBuilder.name(epochTicksTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }
}
