package com.recruit.realtime.service;

import com.recruit.realtime.domain.DeliveryEvent;
import com.recruit.realtime.domain.DeliveryMessage;
import com.recruit.realtime.domain.EventType;
import org.springframework.stereotype.Component;

/**
 * Shapes routed events into outbound frames.
 */
@Component
public class DeliveryMessageFactory {

    /**
     * Frame for the event's own audience. The frame type is the category's
     * update type; the concrete type travels as {@code event_type}.
     *
     * @throws IllegalArgumentException for connection events, which are never routed
     */
    public DeliveryMessage toMessage(DeliveryEvent event) {
        EventType frameType = event.category().updateType()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Connection events are not deliverable: " + event.getEventType().wireName()));

        return DeliveryMessage.builder()
                .type(frameType)
                .eventType(event.getEventType())
                .jobId(event.getJobId())
                .status(event.status())
                .data(event.getPayload())
                .timestamp(event.getCreatedAt())
                .build()
                .withEnvelope();
    }

    /**
     * Copy of a user-targeted frame for staff, tagged with the candidate it concerns.
     */
    public DeliveryMessage forStaff(DeliveryMessage message, String candidateId) {
        return message.toBuilder()
                .messageId(null)
                .candidateId(candidateId)
                .build()
                .withEnvelope();
    }
}
