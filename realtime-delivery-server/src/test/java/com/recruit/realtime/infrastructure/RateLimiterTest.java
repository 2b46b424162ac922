package com.recruit.realtime.infrastructure;

import com.recruit.realtime.config.DeliveryProperties;
import com.recruit.realtime.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        DeliveryProperties properties = new DeliveryProperties();
        properties.getRateLimit().setMaxMessagesPerMinute(120);
        rateLimiter = new RateLimiter(properties, clock);
    }

    @Test
    @DisplayName("A full bucket admits exactly capacity messages within a minute")
    void admitsCapacityThenDenies() {
        int allowed = 0;
        for (int i = 0; i < 150; i++) {
            if (rateLimiter.allow("ws_1")) {
                allowed++;
            }
        }

        assertThat(allowed).isEqualTo(120);
        assertThat(rateLimiter.violations("ws_1")).isEqualTo(30);
    }

    @Test
    @DisplayName("Tokens refill at capacity per minute, never above capacity")
    void refillsOverTime() {
        for (int i = 0; i < 120; i++) {
            rateLimiter.allow("ws_1");
        }
        assertThat(rateLimiter.allow("ws_1")).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(rateLimiter.availableTokens("ws_1")).isCloseTo(2.0, within(0.001));
        assertThat(rateLimiter.allow("ws_1")).isTrue();

        clock.advance(Duration.ofHours(1));
        assertThat(rateLimiter.availableTokens("ws_1")).isEqualTo(120.0);
    }

    @Test
    @DisplayName("Buckets are per connection")
    void bucketsAreIndependent() {
        for (int i = 0; i < 120; i++) {
            rateLimiter.allow("ws_1");
        }

        assertThat(rateLimiter.allow("ws_1")).isFalse();
        assertThat(rateLimiter.allow("ws_2")).isTrue();
        assertThat(rateLimiter.trackedConnections()).isEqualTo(2);
    }

    @Test
    void removeForgetsState() {
        rateLimiter.allow("ws_1");
        rateLimiter.remove("ws_1");

        assertThat(rateLimiter.trackedConnections()).isZero();
        assertThat(rateLimiter.violations("ws_1")).isZero();
        assertThat(rateLimiter.availableTokens("ws_1")).isEqualTo(120.0);
    }
}
