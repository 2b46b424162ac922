package com.recruit.realtime.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recruit.realtime.config.DeliveryProperties;
import com.recruit.realtime.domain.BusEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes events to the Redis channel every delivery node subscribes to.
 */
@Component
@Slf4j
public class RedisEventPublisher {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channel;

    public RedisEventPublisher(StringRedisTemplate redisTemplate,
                               ObjectMapper objectMapper,
                               DeliveryProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.channel = properties.getBus().getChannel();
    }

    /**
     * @return false if the event could not be handed to Redis
     */
    public boolean publish(BusEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            Long subscribers = redisTemplate.convertAndSend(channel, payload);

            if (subscribers == null || subscribers == 0) {
                log.debug("No active subscribers on channel: {}", channel);
            }
            log.debug("Published bus event: type={}, subscribers={}", event.getEventType(), subscribers);
            return true;

        } catch (Exception e) {
            log.error("Failed to publish bus event: type={}, channel={}", event.getEventType(), channel, e);
            return false;
        }
    }
}
