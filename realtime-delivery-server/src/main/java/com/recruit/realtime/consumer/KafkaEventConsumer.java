package com.recruit.realtime.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recruit.realtime.domain.BusEvent;
import com.recruit.realtime.exception.UnknownEventTypeException;
import com.recruit.realtime.service.EventRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * Feeds events published to Kafka into the local router. Same JSON shape as
 * the Redis channel.
 *
 * Enable with: KAFKA_ENABLED=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class KafkaEventConsumer {

    private final ObjectMapper objectMapper;
    private final EventRouter eventRouter;

    public KafkaEventConsumer(ObjectMapper objectMapper, EventRouter eventRouter) {
        this.objectMapper = objectMapper;
        this.eventRouter = eventRouter;
        log.info("KafkaEventConsumer initialized");
    }

    @KafkaListener(
        topics = "${delivery.bus.kafka-topic:delivery-events}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(String eventJson, Acknowledgment acknowledgment) {
        BusEvent event;
        try {
            event = objectMapper.readValue(eventJson, BusEvent.class);
        } catch (JsonProcessingException e) {
            // poison message, retrying cannot help
            log.warn("Skipping malformed Kafka event: {}", e.getMessage());
            acknowledgment.acknowledge();
            return;
        }

        try {
            eventRouter.publish(event);
            log.debug("Kafka event accepted: type={}, userId={}", event.getEventType(), event.getUserId());
        } catch (UnknownEventTypeException e) {
            log.warn("Skipping Kafka event: {}", e.getMessage());
        }
        acknowledgment.acknowledge();
    }
}
