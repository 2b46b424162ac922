package com.recruit.realtime.service;

import com.recruit.realtime.domain.DeliveryEvent;
import com.recruit.realtime.domain.PollType;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * One active fallback polling loop for a (user, poll type) pair.
 */
@Getter
public class PollingSession {

    private final String sessionId;
    private final String userId;
    private final PollType pollType;
    private final Duration interval;
    private final Instant startedAt;
    private final Consumer<List<DeliveryEvent>> callback;

    private volatile Long watermark;
    private volatile Instant lastPollAt;
    private volatile ScheduledFuture<?> task;

    PollingSession(String sessionId,
                   String userId,
                   PollType pollType,
                   Duration interval,
                   Instant startedAt,
                   Long watermark,
                   Consumer<List<DeliveryEvent>> callback) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.pollType = pollType;
        this.interval = interval;
        this.startedAt = startedAt;
        this.watermark = watermark;
        this.callback = callback;
    }

    /**
     * Moves the watermark forward. Never moves it back.
     */
    synchronized boolean advanceWatermark(long recordId) {
        if (watermark == null || recordId > watermark) {
            watermark = recordId;
            return true;
        }
        return false;
    }

    void markPolled(Instant at) {
        this.lastPollAt = at;
    }

    void attach(ScheduledFuture<?> task) {
        this.task = task;
    }

    void cancel() {
        ScheduledFuture<?> current = task;
        if (current != null) {
            current.cancel(false);
        }
    }

    boolean isExpired(Instant now, Duration maxAge) {
        return Duration.between(startedAt, now).compareTo(maxAge) > 0;
    }
}
