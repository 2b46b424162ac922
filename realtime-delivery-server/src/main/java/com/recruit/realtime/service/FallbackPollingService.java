package com.recruit.realtime.service;

import com.recruit.realtime.config.DeliveryProperties;
import com.recruit.realtime.domain.DeliveryEvent;
import com.recruit.realtime.domain.PollType;
import com.recruit.realtime.domain.PollUpdate;
import com.recruit.realtime.infrastructure.WatermarkStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Periodic polling of the system of record for clients that lost their live
 * connection.
 *
 * Features:
 * - At most one session per (user, poll type); starting twice returns the existing id
 * - Per-type interval, fixed delay between ticks
 * - Monotonic watermark, persisted in Redis so a later session resumes from it
 * - Sessions expire after the configured maximum age
 */
@Service
@Slf4j
public class FallbackPollingService {

    private final ConcurrentHashMap<String, PollingSession> activePolls = new ConcurrentHashMap<>();
    private final PollingUpdateReader updateReader;
    private final WatermarkStore watermarkStore;
    private final MetricsService metricsService;
    private final DeliveryProperties.Polling config;
    private final Clock clock;
    private final ScheduledExecutorService pollExecutor;

    @Autowired
    public FallbackPollingService(PollingUpdateReader updateReader,
                                  WatermarkStore watermarkStore,
                                  MetricsService metricsService,
                                  DeliveryProperties properties,
                                  Clock clock) {
        this(updateReader, watermarkStore, metricsService, properties, clock,
                Executors.newScheduledThreadPool(properties.getPolling().getThreads(),
                        new CustomizableThreadFactory("fallback-poll-")));
    }

    FallbackPollingService(PollingUpdateReader updateReader,
                           WatermarkStore watermarkStore,
                           MetricsService metricsService,
                           DeliveryProperties properties,
                           Clock clock,
                           ScheduledExecutorService pollExecutor) {
        this.updateReader = updateReader;
        this.watermarkStore = watermarkStore;
        this.metricsService = metricsService;
        this.config = properties.getPolling();
        this.clock = clock;
        this.pollExecutor = pollExecutor;
    }

    /**
     * Starts polling for a user, or returns the id of the session already
     * polling that type for them.
     */
    public synchronized String startPolling(String userId,
                                            PollType pollType,
                                            Consumer<List<DeliveryEvent>> callback) {
        Optional<PollingSession> existing = findSession(userId, pollType);
        if (existing.isPresent()) {
            log.debug("Polling already active: sessionId={}", existing.get().getSessionId());
            return existing.get().getSessionId();
        }

        Instant now = clock.instant();
        String sessionId = "poll_" + userId + "_" + pollType.wireName() + "_" + now.toEpochMilli();
        Duration interval = config.intervalFor(pollType);
        PollingSession session = new PollingSession(sessionId, userId, pollType, interval, now,
                initialWatermark(userId, pollType), callback);

        activePolls.put(sessionId, session);
        ScheduledFuture<?> task = pollExecutor.scheduleWithFixedDelay(
                () -> pollOnce(sessionId), 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        session.attach(task);

        metricsService.recordPollingStarted(pollType);
        log.info("Fallback polling started: sessionId={}, userId={}, type={}, interval={}s",
                sessionId, userId, pollType.wireName(), interval.getSeconds());
        return sessionId;
    }

    /**
     * Stops a polling session. Unknown ids are ignored.
     */
    public boolean stopPolling(String sessionId) {
        PollingSession session = activePolls.remove(sessionId);
        if (session == null) {
            return false;
        }
        session.cancel();
        log.info("Fallback polling stopped: sessionId={}, userId={}", sessionId, session.getUserId());
        return true;
    }

    /**
     * Stops every session of a user, e.g. once they are live again.
     */
    public int stopAllForUser(String userId) {
        List<String> sessionIds = activePolls.values().stream()
                .filter(session -> session.getUserId().equals(userId))
                .map(PollingSession::getSessionId)
                .collect(Collectors.toList());
        int stopped = 0;
        for (String sessionId : sessionIds) {
            if (stopPolling(sessionId)) {
                stopped++;
            }
        }
        return stopped;
    }

    public Optional<PollingSession> getSession(String sessionId) {
        return Optional.ofNullable(activePolls.get(sessionId));
    }

    public Optional<PollingSession> findSession(String userId, PollType pollType) {
        return activePolls.values().stream()
                .filter(session -> session.getUserId().equals(userId) && session.getPollType() == pollType)
                .findFirst();
    }

    public boolean isPolling(String userId) {
        return activePolls.values().stream().anyMatch(session -> session.getUserId().equals(userId));
    }

    public int activeSessionCount() {
        return activePolls.size();
    }

    /**
     * One polling tick. Delivers records newer than the watermark, then moves
     * the watermark to the highest id delivered.
     */
    void pollOnce(String sessionId) {
        PollingSession session = activePolls.get(sessionId);
        if (session == null) {
            return;
        }

        Instant now = clock.instant();
        if (session.isExpired(now, config.getMaxSessionAge())) {
            log.info("Fallback polling session expired: sessionId={}", sessionId);
            stopPolling(sessionId);
            return;
        }

        try {
            Long watermark = session.getWatermark();
            List<PollUpdate> updates = updateReader.fetchUpdates(session.getUserId(), session.getPollType(), watermark);
            List<PollUpdate> fresh = new ArrayList<>();
            for (PollUpdate update : updates) {
                if (watermark == null || update.getRecordId() > watermark) {
                    fresh.add(update);
                }
            }

            if (!fresh.isEmpty()) {
                session.getCallback().accept(fresh.stream()
                        .map(PollUpdate::getEvent)
                        .collect(Collectors.toList()));

                long highest = fresh.stream().mapToLong(PollUpdate::getRecordId).max().getAsLong();
                if (session.advanceWatermark(highest)) {
                    watermarkStore.save(session.getUserId(), session.getPollType(), highest);
                }
                metricsService.recordPollingUpdates(session.getPollType(), fresh.size());
                log.debug("Polled updates delivered: sessionId={}, count={}, watermark={}",
                        sessionId, fresh.size(), highest);
            }
            session.markPolled(now);

        } catch (Exception e) {
            log.error("Polling tick failed: sessionId={}", sessionId, e);
            metricsService.recordError("POLLING_ERROR", "FallbackPollingService");
        }
    }

    private Long initialWatermark(String userId, PollType pollType) {
        Optional<Long> stored = watermarkStore.get(userId, pollType);
        if (stored.isPresent()) {
            return stored.get();
        }
        try {
            return updateReader.latestRecordId(userId, pollType).orElse(0L);
        } catch (Exception e) {
            log.warn("Could not determine starting watermark: userId={}, type={}, error={}",
                    userId, pollType.wireName(), e.getMessage());
            return null;
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down FallbackPollingService: activeSessions={}", activePolls.size());
        activePolls.values().forEach(PollingSession::cancel);
        activePolls.clear();
        pollExecutor.shutdown();
        try {
            if (!pollExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                pollExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            pollExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
