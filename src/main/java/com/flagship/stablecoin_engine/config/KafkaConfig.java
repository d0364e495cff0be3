package com.flagship.stablecoin_engine.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Declares the engine events topic when Kafka forwarding is enabled.
 */
@Configuration
@ConditionalOnProperty(name = "engine.events.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    /**
     * 3 partitions; events are keyed by account so per-account order holds.
     */
    @Bean
    public NewTopic engineEventsTopic(EngineProperties properties) {
        return TopicBuilder.name(properties.getEvents().getKafka().getTopic())
                .partitions(3)
                .replicas(1)
                .build();
    }
}
