package com.recruit.realtime.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Audience of an event: one user, one role, or everybody.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventTarget {

    private static final EventTarget BROADCAST = new EventTarget(null, null);

    String userId;
    String role;

    public static EventTarget user(String userId) {
        return new EventTarget(userId, null);
    }

    public static EventTarget role(String role) {
        return new EventTarget(null, role);
    }

    public static EventTarget broadcast() {
        return BROADCAST;
    }

    /**
     * Normalises a raw target. A role wins over a user when both are present.
     */
    public static EventTarget of(String userId, String role) {
        if (role != null && !role.isBlank()) {
            return role(role);
        }
        if (userId != null && !userId.isBlank()) {
            return user(userId);
        }
        return BROADCAST;
    }

    public boolean isRole() {
        return role != null;
    }

    public boolean isUser() {
        return userId != null;
    }

    public boolean isBroadcast() {
        return userId == null && role == null;
    }
}
