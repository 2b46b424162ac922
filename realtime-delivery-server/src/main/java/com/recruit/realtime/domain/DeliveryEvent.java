package com.recruit.realtime.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable state-change notification waiting to be routed.
 *
 * <p>The payload is copied on construction; values may be null.
 */
@Value
public class DeliveryEvent {

    EventType eventType;
    EventTarget target;
    String jobId;
    Map<String, Object> payload;
    Instant createdAt;

    @Builder(toBuilder = true)
    private DeliveryEvent(@NonNull EventType eventType,
                          EventTarget target,
                          String jobId,
                          Map<String, Object> payload,
                          Instant createdAt) {
        this.eventType = eventType;
        this.target = target != null ? target : EventTarget.broadcast();
        this.jobId = jobId;
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    public EventCategory category() {
        return eventType.category();
    }

    /**
     * Status carried by the payload, or the one implied by the event type.
     */
    public String status() {
        Object status = payload.get("status");
        return status != null ? status.toString() : eventType.impliedStatus();
    }
}
