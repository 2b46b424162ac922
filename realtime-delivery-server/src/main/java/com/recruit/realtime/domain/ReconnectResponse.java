package com.recruit.realtime.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReconnectResponse {

    public static final String READY = "ready_to_reconnect";

    private String status;
    private String userId;
    private String role;
    private DeliveryMessage lastMessage;
    private Instant disconnectedAt;

    public static ReconnectResponse ready(SessionState state, String requestedRole) {
        return ReconnectResponse.builder()
                .status(READY)
                .userId(state.getUserId())
                .role(requestedRole != null ? requestedRole : state.getRole())
                .lastMessage(state.getLastMessage())
                .disconnectedAt(state.getDisconnectedAt())
                .build();
    }
}
