package com.flagship.stablecoin_engine.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.stablecoin_engine.observability.CorrelationContext;
import com.flagship.stablecoin_engine.observability.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards committed engine events to Kafka for downstream consumers
 * (dashboards, liquidation bots).
 *
 * Uses the account as the message key so all events of one account land on
 * the same partition in order. The request's correlation id, when there is
 * one, travels as the {@code X-Correlation-ID} record header. Delivery is
 * asynchronous; failures are logged and counted, never retried here.
 */
@Component
@ConditionalOnProperty(name = "engine.events.kafka.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class KafkaEngineEventForwarder {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final EngineMetrics metrics;

    @Value("${engine.events.kafka.topic:stablecoin-engine-events}")
    private String topic;

    @EventListener
    public void forward(EngineEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: eventId={}, eventType={}", event.getEventId(), event.getEventType(), e);
            metrics.recordEventPublishFailure(event.getEventType(), "kafka");
            return;
        }

        ProducerRecord<String, String> producerRecord = new ProducerRecord<>(topic, event.getAccount(), payload);
        CorrelationContext.current().ifPresent(correlationId -> producerRecord.headers()
            .add(CorrelationContext.CORRELATION_ID_HEADER, correlationId.getBytes(StandardCharsets.UTF_8)));

        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(producerRecord);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getEventId(), event.getEventType(), ex.getMessage());
                metrics.recordEventPublishFailure(event.getEventType(), "kafka");
            } else if (result != null) {
                log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getEventId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());
            }
        });
    }
}
