package com.recruit.realtime.controller;

import com.recruit.realtime.domain.BusEvent;
import com.recruit.realtime.domain.EventCategory;
import com.recruit.realtime.domain.EventType;
import com.recruit.realtime.domain.PublishRequest;
import com.recruit.realtime.exception.UnknownEventTypeException;
import com.recruit.realtime.infrastructure.RedisEventPublisher;
import com.recruit.realtime.service.EventRouter;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishing entry point for producers that do not talk to Redis directly.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class EventController {

    private final RedisEventPublisher eventPublisher;
    private final EventRouter eventRouter;

    public EventController(RedisEventPublisher eventPublisher, EventRouter eventRouter) {
        this.eventPublisher = eventPublisher;
        this.eventRouter = eventRouter;
    }

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> publish(@Valid @RequestBody PublishRequest request) {
        EventType type = EventType.fromWire(request.getEventType())
                .filter(candidate -> candidate.category() != EventCategory.CONNECTION)
                .orElseThrow(() -> new UnknownEventTypeException(request.getEventType()));

        PublishRequest.Target target = request.getTarget();
        BusEvent event = BusEvent.builder()
                .eventType(type.wireName())
                .jobId(request.getJobId())
                .userId(target != null ? target.getUserId() : null)
                .targetRole(target != null ? target.getRole() : null)
                .payload(request.getPayload() != null ? request.getPayload() : Map.of())
                .timestamp(Instant.now().toString())
                .build();

        String via = "bus";
        if (!eventPublisher.publish(event)) {
            log.warn("Bus unavailable, routing locally: type={}", type.wireName());
            eventRouter.publish(event);
            via = "local";
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "accepted");
        response.put("event_type", type.wireName());
        response.put("published_via", via);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}
