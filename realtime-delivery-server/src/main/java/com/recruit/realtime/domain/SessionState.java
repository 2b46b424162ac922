package com.recruit.realtime.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Snapshot taken when a connection is lost, used to answer resume queries.
 */
@Value
@Builder
public class SessionState {
    String userId;
    String role;
    DeliveryMessage lastMessage;
    Instant disconnectedAt;
}
