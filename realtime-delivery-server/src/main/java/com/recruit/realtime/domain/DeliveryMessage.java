package com.recruit.realtime.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Outbound server-to-client frame.
 *
 * <p>Every frame written to a client carries {@code message_id} and
 * {@code timestamp}; {@link #withEnvelope()} fills them in when absent.
 */
@Value
@Builder(toBuilder = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeliveryMessage {

    String messageId;
    EventType type;
    Instant timestamp;
    EventType eventType;
    String jobId;
    String status;
    String candidateId;
    String connectionId;
    String reconnectToken;
    Double pingTimestamp;
    String message;
    Map<String, Object> data;

    public DeliveryMessage withEnvelope() {
        if (messageId != null && timestamp != null) {
            return this;
        }
        return toBuilder()
                .messageId(messageId != null ? messageId : UUID.randomUUID().toString())
                .timestamp(timestamp != null ? timestamp : Instant.now())
                .build();
    }

    public static DeliveryMessage connectionEstablished(String connectionId, String reconnectToken) {
        return DeliveryMessage.builder()
                .type(EventType.CONNECTION_ESTABLISHED)
                .connectionId(connectionId)
                .reconnectToken(reconnectToken)
                .message("Connected to real-time updates")
                .build()
                .withEnvelope();
    }

    public static DeliveryMessage ping(double pingTimestamp) {
        return DeliveryMessage.builder()
                .type(EventType.PING)
                .pingTimestamp(pingTimestamp)
                .build()
                .withEnvelope();
    }

    public static DeliveryMessage pong() {
        return DeliveryMessage.builder()
                .type(EventType.PONG)
                .build()
                .withEnvelope();
    }
}
