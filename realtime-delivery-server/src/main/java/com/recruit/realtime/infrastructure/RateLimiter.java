package com.recruit.realtime.infrastructure;

import com.recruit.realtime.config.DeliveryProperties;
import com.recruit.realtime.domain.RateLimitState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket per connection.
 *
 * <p>Capacity is {@code max-messages-per-minute}; the bucket refills at
 * capacity/60 tokens per second, computed from elapsed time on each check.
 * The limiter only reports; evicting a connection is the caller's decision.
 */
@Component
@Slf4j
public class RateLimiter {

    private final ConcurrentHashMap<String, RateLimitState> buckets = new ConcurrentHashMap<>();
    private final double capacity;
    private final double refillPerSecond;
    private final Clock clock;

    public RateLimiter(DeliveryProperties properties, Clock clock) {
        this.capacity = properties.getRateLimit().getMaxMessagesPerMinute();
        this.refillPerSecond = capacity / 60.0;
        this.clock = clock;
    }

    /**
     * Take one token for the connection. A denial counts as a violation.
     */
    public boolean allow(String connectionId) {
        Instant now = clock.instant();
        RateLimitState state = buckets.computeIfAbsent(connectionId, id -> new RateLimitState(capacity, now));

        synchronized (state) {
            refill(state, now);
            if (state.getTokens() >= 1.0) {
                state.setTokens(state.getTokens() - 1.0);
                return true;
            }
            state.setViolationCount(state.getViolationCount() + 1);
            log.debug("Rate limit denied: connectionId={}, violations={}",
                    connectionId, state.getViolationCount());
            return false;
        }
    }

    public int violations(String connectionId) {
        RateLimitState state = buckets.get(connectionId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.getViolationCount();
        }
    }

    public double availableTokens(String connectionId) {
        RateLimitState state = buckets.get(connectionId);
        if (state == null) {
            return capacity;
        }
        synchronized (state) {
            refill(state, clock.instant());
            return state.getTokens();
        }
    }

    public void remove(String connectionId) {
        buckets.remove(connectionId);
    }

    public int trackedConnections() {
        return buckets.size();
    }

    private void refill(RateLimitState state, Instant now) {
        Duration elapsed = Duration.between(state.getLastRefillAt(), now);
        if (elapsed.isNegative() || elapsed.isZero()) {
            return;
        }
        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        state.setTokens(Math.min(capacity, state.getTokens() + seconds * refillPerSecond));
        state.setLastRefillAt(now);
    }
}
