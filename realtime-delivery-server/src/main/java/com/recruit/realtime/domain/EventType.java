package com.recruit.realtime.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of event types understood by the delivery server.
 * The wire name is the lower-case form used in JSON frames and on the bus.
 */
public enum EventType {

    // Connection
    CONNECTION_ESTABLISHED(EventCategory.CONNECTION),
    CONNECTION_ERROR(EventCategory.CONNECTION),
    RECONNECT_ATTEMPT(EventCategory.CONNECTION),
    PING(EventCategory.CONNECTION),
    PONG(EventCategory.CONNECTION),

    // Interview
    INTERVIEW_QUESTIONS_READY(EventCategory.INTERVIEW),
    INTERVIEW_STARTED(EventCategory.INTERVIEW),
    INTERVIEW_QUESTION_TIMER(EventCategory.INTERVIEW),
    INTERVIEW_RESPONSE_EVALUATED(EventCategory.INTERVIEW),
    INTERVIEW_COMPLETED(EventCategory.INTERVIEW),
    INTERVIEW_ERROR(EventCategory.INTERVIEW),
    INTERVIEW_UPDATE(EventCategory.INTERVIEW),

    // Application
    APPLICATION_SUBMITTED(EventCategory.APPLICATION),
    APPLICATION_STATUS_CHANGED(EventCategory.APPLICATION),
    APPLICATION_SCORED(EventCategory.APPLICATION),
    APPLICATION_FEEDBACK(EventCategory.APPLICATION),
    APPLICATION_UPDATE(EventCategory.APPLICATION),

    // Job
    JOB_POSTED(EventCategory.JOB),
    JOB_UPDATED(EventCategory.JOB),
    JOB_CLOSED(EventCategory.JOB),
    JOB_MATCHED(EventCategory.JOB),
    JOB_UPDATE(EventCategory.JOB),

    // Background processing, delivered as job updates
    RESUME_PROCESSING_STARTED(EventCategory.JOB),
    RESUME_PROCESSING_COMPLETED(EventCategory.JOB),
    VIDEO_PROCESSING_STARTED(EventCategory.JOB),
    VIDEO_PROCESSING_COMPLETED(EventCategory.JOB),

    // System
    SYSTEM_ANNOUNCEMENT(EventCategory.SYSTEM),
    SYSTEM_ERROR(EventCategory.SYSTEM),
    SYSTEM_MAINTENANCE(EventCategory.SYSTEM),
    SYSTEM_STATUS(EventCategory.SYSTEM);

    private static final Map<String, EventType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventType::wireName, Function.identity()));

    private final EventCategory category;

    EventType(EventCategory category) {
        this.category = category;
    }

    public EventCategory category() {
        return category;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Status implied by the type when the payload carries none,
     * e.g. {@code interview_questions_ready -> questions_ready}.
     */
    public String impliedStatus() {
        String prefix = category.name().toLowerCase() + "_";
        String wire = wireName();
        return wire.startsWith(prefix) ? wire.substring(prefix.length()) : wire;
    }

    public static Optional<EventType> fromWire(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName.trim().toLowerCase()));
    }

    @JsonCreator
    public static EventType fromJson(String wireName) {
        return fromWire(wireName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + wireName));
    }
}
