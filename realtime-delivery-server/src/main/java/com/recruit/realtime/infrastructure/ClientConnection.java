package com.recruit.realtime.infrastructure;

import com.recruit.realtime.domain.ConnectionHealth;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * A live client connection as tracked by the {@link ConnectionManager}.
 */
@Getter
@Slf4j
public class ClientConnection {

    private final String connectionId;
    private final MessageTransport transport;
    private final String userId;
    private final String role;
    private final Instant establishedAt;
    private final ConnectionHealth health;

    private volatile ScheduledFuture<?> heartbeat;

    public ClientConnection(String connectionId,
                            MessageTransport transport,
                            String userId,
                            String role,
                            Instant establishedAt) {
        this.connectionId = connectionId;
        this.transport = transport;
        this.userId = userId;
        this.role = role;
        this.establishedAt = establishedAt;
        this.health = new ConnectionHealth(establishedAt);
    }

    void attachHeartbeat(ScheduledFuture<?> heartbeat) {
        this.heartbeat = heartbeat;
    }

    void cancelHeartbeat() {
        ScheduledFuture<?> task = heartbeat;
        if (task != null) {
            task.cancel(false);
        }
    }

    void closeQuietly(MessageTransport.CloseReason reason) {
        try {
            transport.close(reason);
        } catch (RuntimeException e) {
            log.debug("Close failed: connectionId={}, error={}", connectionId, e.getMessage());
        }
    }
}
