package com.recruit.realtime.domain;

import lombok.Data;

import java.time.Instant;

/**
 * Token bucket of one connection. Guarded by the rate limiter.
 */
@Data
public class RateLimitState {
    private double tokens;
    private Instant lastRefillAt;
    private int violationCount;

    public RateLimitState(double tokens, Instant lastRefillAt) {
        this.tokens = tokens;
        this.lastRefillAt = lastRefillAt;
    }
}
