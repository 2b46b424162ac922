package com.recruit.realtime.domain;

import java.util.Optional;

/**
 * Coarse grouping of event types. Drives routing, the outbound frame type
 * and the fallback polling class.
 */
public enum EventCategory {
    CONNECTION,
    INTERVIEW,
    APPLICATION,
    JOB,
    SYSTEM;

    /**
     * Frame type used on the live path for events of this category.
     * Connection events are control frames and have none.
     */
    public Optional<EventType> updateType() {
        return switch (this) {
            case CONNECTION -> Optional.empty();
            case INTERVIEW -> Optional.of(EventType.INTERVIEW_UPDATE);
            case APPLICATION -> Optional.of(EventType.APPLICATION_UPDATE);
            case JOB -> Optional.of(EventType.JOB_UPDATE);
            case SYSTEM -> Optional.of(EventType.SYSTEM_ANNOUNCEMENT);
        };
    }

    public Optional<PollType> pollType() {
        return switch (this) {
            case CONNECTION -> Optional.empty();
            case INTERVIEW -> Optional.of(PollType.INTERVIEW);
            case APPLICATION -> Optional.of(PollType.APPLICATION);
            case JOB -> Optional.of(PollType.JOB);
            case SYSTEM -> Optional.of(PollType.SYSTEM);
        };
    }
}
