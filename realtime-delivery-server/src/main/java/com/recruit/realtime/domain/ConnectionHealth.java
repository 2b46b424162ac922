package com.recruit.realtime.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Liveness record of one connection, mutated by the heartbeat and the pong handler.
 */
public class ConnectionHealth {

    public static final int LATENCY_WINDOW = 10;

    private final Instant connectedAt;
    private final Deque<Double> latenciesMs = new ArrayDeque<>(LATENCY_WINDOW);
    private Instant lastPingAt;
    private int pingCount;

    public ConnectionHealth(Instant connectedAt) {
        this.connectedAt = connectedAt;
    }

    public synchronized void recordPing(Instant at) {
        lastPingAt = at;
        pingCount++;
    }

    public synchronized void recordLatency(double latencyMs) {
        if (latenciesMs.size() == LATENCY_WINDOW) {
            latenciesMs.removeFirst();
        }
        latenciesMs.addLast(Math.round(latencyMs * 100.0) / 100.0);
    }

    public synchronized boolean isHealthy(Instant now, Duration window) {
        return lastPingAt != null && Duration.between(lastPingAt, now).compareTo(window) < 0;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public synchronized Instant getLastPingAt() {
        return lastPingAt;
    }

    public synchronized int getPingCount() {
        return pingCount;
    }

    public synchronized List<Double> getLatenciesMs() {
        return new ArrayList<>(latenciesMs);
    }
}
