package com.recruit.realtime.infrastructure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.recruit.realtime.domain.BusEvent;
import com.recruit.realtime.exception.UnknownEventTypeException;
import com.recruit.realtime.service.EventRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Feeds events from the Redis channel into the local router.
 * Malformed messages and unknown types are logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RedisEventSubscriber implements MessageListener {

    private final EventRouter eventRouter;
    private final ObjectMapper objectMapper;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String payload = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            BusEvent event = objectMapper.readValue(payload, BusEvent.class);
            eventRouter.publish(event);
            log.debug("Bus event accepted: type={}, userId={}, role={}",
                    event.getEventType(), event.getUserId(), event.getTargetRole());

        } catch (IOException e) {
            log.warn("Discarding malformed bus message: {}", e.getMessage());
        } catch (UnknownEventTypeException e) {
            log.warn("Discarding bus event: {}", e.getMessage());
        }
    }
}
