package com.recruit.realtime.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConnectionStats {
    int totalConnections;
    int uniqueUsers;
    Map<String, Integer> userConnections;
    int healthyConnections;
    int pollingSessions;
    int queuedMessages;
}
