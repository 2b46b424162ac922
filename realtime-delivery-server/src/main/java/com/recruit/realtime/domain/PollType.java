package com.recruit.realtime.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Event classes the fallback poller can re-derive from the system of record.
 */
public enum PollType {
    INTERVIEW,
    APPLICATION,
    JOB,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PollType fromWire(String value) {
        return Arrays.stream(values())
                .filter(type -> type.wireName().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown poll type: " + value));
    }
}
