package com.recruit.realtime.service;

import com.recruit.realtime.domain.DeliveryStatus;
import com.recruit.realtime.domain.PollType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivery metrics on top of Micrometer.
 *
 * Counters:
 * - delivery.connections{outcome}
 * - delivery.messages{status}
 * - delivery.queue.enqueued / delivery.queue.replayed
 * - delivery.ratelimit.denied / delivery.ratelimit.evicted
 * - delivery.authentication{outcome}
 * - delivery.polling.started / delivery.polling.updates{type}
 * - delivery.errors{type,component}
 */
@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry registry;
    private final AtomicInteger activeConnections = new AtomicInteger();

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("delivery.connections.active", activeConnections);
    }

    public void incrementCounter(String name, Tags tags) {
        registry.counter(name, tags).increment();
    }

    public void incrementCounter(String name, String... tags) {
        registry.counter(name, tags).increment();
    }

    // ===== Connections =====

    public void recordConnection(String userId, boolean success) {
        incrementCounter("delivery.connections", "outcome", success ? "accepted" : "rejected");
        if (success) {
            activeConnections.incrementAndGet();
        }
        log.debug("Connection recorded: userId={}, success={}", userId, success);
    }

    public void recordDisconnection(String userId) {
        incrementCounter("delivery.disconnections");
        activeConnections.updateAndGet(current -> Math.max(0, current - 1));
        log.debug("Disconnection recorded: userId={}", userId);
    }

    public void recordMessageReceived(String messageType) {
        incrementCounter("delivery.messages.received", "type", messageType);
    }

    // ===== Delivery =====

    public void recordDelivery(DeliveryStatus status) {
        incrementCounter("delivery.messages", "status", status.name().toLowerCase());
    }

    public void recordQueued(String userId) {
        incrementCounter("delivery.queue.enqueued");
        log.debug("Message queued for offline user: userId={}", userId);
    }

    public void recordReplayed(String userId, int count) {
        registry.counter("delivery.queue.replayed").increment(count);
        log.debug("Replayed queued messages: userId={}, count={}", userId, count);
    }

    public void recordRateLimitDenied(String connectionId) {
        incrementCounter("delivery.ratelimit.denied");
    }

    public void recordRateLimitEviction(String connectionId) {
        incrementCounter("delivery.ratelimit.evicted");
        log.warn("Connection evicted by rate limiter: connectionId={}", connectionId);
    }

    public void recordAuthenticationAttempt(boolean success) {
        incrementCounter("delivery.authentication", "outcome", success ? "accepted" : "rejected");
    }

    // ===== Polling =====

    public void recordPollingStarted(PollType type) {
        incrementCounter("delivery.polling.started", "type", type.wireName());
    }

    public void recordPollingUpdates(PollType type, int count) {
        registry.counter("delivery.polling.updates", "type", type.wireName()).increment(count);
    }

    // ===== Errors =====

    public void recordError(String errorType, String component) {
        incrementCounter("delivery.errors", "type", errorType, "component", component);
        log.debug("Error recorded: type={}, component={}", errorType, component);
    }

    /**
     * Current value of a counter, summed across tags. For status output and tests.
     */
    public double getCounterValue(String name) {
        return registry.find(name).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }
}
