package com.recruit.realtime.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.recruit.realtime.config.DeliveryProperties;
import com.recruit.realtime.domain.ConnectionHealth;
import com.recruit.realtime.domain.ConnectionStats;
import com.recruit.realtime.domain.DeliveryEvent;
import com.recruit.realtime.domain.DeliveryMessage;
import com.recruit.realtime.domain.DeliveryStatus;
import com.recruit.realtime.domain.PollType;
import com.recruit.realtime.domain.SessionState;
import com.recruit.realtime.exception.InvalidReconnectTokenException;
import com.recruit.realtime.exception.SessionNotFoundException;
import com.recruit.realtime.service.DeliveryMessageFactory;
import com.recruit.realtime.service.FallbackPollingService;
import com.recruit.realtime.service.MetricsService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Registry of live client connections and the single write path to them.
 *
 * Features:
 * - Indexes by connection id, user and role
 * - Per-connection outbound rate limit, eviction after repeated violations
 * - Offline queue replay on connect, enqueue when a user has no live connection
 * - Fallback polling when a write fails
 * - Heartbeat ping per connection, latency from pong replies
 * - Reconnect tokens and session snapshots for resume
 *
 * <p>Operations that decide between "deliver live" and "enqueue" for a user
 * run under that user's lock, as do connect and disconnect, so a message is
 * never both queued and missed by a concurrent replay, and a connection
 * cannot vanish between a fan-out snapshot and its write.
 */
@Component
@Slf4j
public class ConnectionManager {

    private final ConcurrentHashMap<String, ClientConnection> activeConnections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> userConnections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> connectionRoles = new ConcurrentHashMap<>();
    private final Cache<String, Object> userLocks = Caffeine.newBuilder().weakValues().build();
    private final Cache<String, String> reconnectTokens;
    private final Cache<String, SessionState> sessionStates;

    private final RateLimiter rateLimiter;
    private final OfflineMessageQueue offlineQueue;
    private final FallbackPollingService pollingService;
    private final DeliveryMessageFactory messageFactory;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final DeliveryProperties.Connection config;
    private final int maxViolations;
    private final ScheduledExecutorService heartbeatExecutor;
    private final SecureRandom secureRandom = new SecureRandom();

    public ConnectionManager(RateLimiter rateLimiter,
                             OfflineMessageQueue offlineQueue,
                             FallbackPollingService pollingService,
                             DeliveryMessageFactory messageFactory,
                             MetricsService metricsService,
                             ObjectMapper objectMapper,
                             DeliveryProperties properties,
                             Clock clock) {
        this.rateLimiter = rateLimiter;
        this.offlineQueue = offlineQueue;
        this.pollingService = pollingService;
        this.messageFactory = messageFactory;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.config = properties.getConnection();
        this.maxViolations = properties.getRateLimit().getMaxViolations();

        Duration window = config.getReconnectWindow();
        this.reconnectTokens = Caffeine.newBuilder()
                .expireAfterWrite(window)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
        this.sessionStates = Caffeine.newBuilder()
                .expireAfterWrite(window)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();

        this.heartbeatExecutor = Executors.newScheduledThreadPool(
                config.getHeartbeatThreads(), new CustomizableThreadFactory("heartbeat-"));

        long sweepMillis = properties.getQueue().getSweepInterval().toMillis();
        heartbeatExecutor.scheduleAtFixedRate(this::sweepOfflineQueues, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);
    }

    // ===== Lifecycle =====

    /**
     * Registers a connection, replays anything queued for the user, starts its
     * heartbeat and sends the welcome frame.
     *
     * @return the new connection id
     */
    public String connect(MessageTransport transport, String userId, String role) {
        String connectionId = "ws_" + UUID.randomUUID().toString().replace("-", "");
        ClientConnection connection = new ClientConnection(connectionId, transport, userId, role, clock.instant());

        String token = null;
        if (userId == null) {
            register(connection);
        } else {
            token = withUserLock(userId, () -> {
                register(connection);
                String issued = issueReconnectToken(userId);
                int stopped = pollingService.stopAllForUser(userId);
                if (stopped > 0) {
                    log.info("Stopped fallback polling on reconnect: userId={}, sessions={}", userId, stopped);
                }
                replayQueued(connection);
                return issued;
            });
        }

        metricsService.recordConnection(userId, true);
        log.info("Connection established: connectionId={}, userId={}, role={}, total={}",
                connectionId, userId, role, activeConnections.size());

        if (isConnected(connectionId)) {
            write(connection, DeliveryMessage.connectionEstablished(connectionId, token), false);
        }
        return connectionId;
    }

    /**
     * Removes a connection from every index and stops its heartbeat.
     * Unknown ids are ignored.
     */
    public void disconnect(String connectionId, String userId) {
        ClientConnection registered = activeConnections.get(connectionId);
        String owner = userId != null ? userId : (registered != null ? registered.getUserId() : null);

        ClientConnection connection;
        if (owner == null) {
            connection = unregister(connectionId, null);
        } else {
            connection = withUserLock(owner, () -> unregister(connectionId, owner));
        }

        if (connection == null) {
            return;
        }
        connection.cancelHeartbeat();
        metricsService.recordDisconnection(owner);
        log.info("Connection closed: connectionId={}, userId={}, duration={}s, total={}",
                connectionId, owner,
                Duration.between(connection.getEstablishedAt(), clock.instant()).getSeconds(),
                activeConnections.size());
    }

    // ===== Delivery =====

    /**
     * Sends one frame to one connection, subject to the rate limit.
     */
    public DeliveryStatus send(String connectionId, DeliveryMessage message) {
        return send(connectionId, message, false);
    }

    /**
     * @param siblingsCovered the same frame is being written to every other
     *                        connection of the user, so a failed write only
     *                        needs queueing once none of them is left
     */
    private DeliveryStatus send(String connectionId, DeliveryMessage message, boolean siblingsCovered) {
        ClientConnection connection = activeConnections.get(connectionId);
        if (connection == null) {
            log.debug("Send to unknown connection: connectionId={}", connectionId);
            metricsService.recordDelivery(DeliveryStatus.DROPPED);
            return DeliveryStatus.DROPPED;
        }

        if (!rateLimiter.allow(connectionId)) {
            int violations = rateLimiter.violations(connectionId);
            metricsService.recordRateLimitDenied(connectionId);
            metricsService.recordDelivery(DeliveryStatus.DROPPED);
            log.warn("Rate limit exceeded: connectionId={}, userId={}, violations={}",
                    connectionId, connection.getUserId(), violations);
            if (violations >= maxViolations) {
                evict(connection);
            }
            return DeliveryStatus.DROPPED;
        }

        return write(connection, message, siblingsCovered);
    }

    /**
     * Delivers to every live connection of a user, or queues the message when
     * there is none.
     *
     * @return number of connections the message was written to
     */
    public int sendToUser(String userId, DeliveryMessage message) {
        DeliveryMessage framed = message.withEnvelope();
        return withUserLock(userId, () -> {
            List<String> connectionIds = snapshot(userConnections.get(userId));
            if (connectionIds.isEmpty()) {
                offlineQueue.enqueue(userId, framed);
                metricsService.recordQueued(userId);
                metricsService.recordDelivery(DeliveryStatus.QUEUED);
                return 0;
            }
            int delivered = 0;
            for (String connectionId : connectionIds) {
                if (send(connectionId, framed, true) == DeliveryStatus.DELIVERED) {
                    delivered++;
                }
            }
            return delivered;
        });
    }

    /**
     * Delivers to every live connection except the excluded ids.
     */
    public int broadcast(DeliveryMessage message, Set<String> excludeConnectionIds) {
        DeliveryMessage framed = message.withEnvelope();
        int delivered = 0;
        for (String connectionId : new ArrayList<>(activeConnections.keySet())) {
            if (excludeConnectionIds.contains(connectionId)) {
                continue;
            }
            if (send(connectionId, framed) == DeliveryStatus.DELIVERED) {
                delivered++;
            }
        }
        return delivered;
    }

    public int broadcastToRole(DeliveryMessage message, String role) {
        DeliveryMessage framed = message.withEnvelope();
        List<String> connectionIds = connectionRoles.entrySet().stream()
                .filter(entry -> entry.getValue().equals(role))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        int delivered = 0;
        for (String connectionId : connectionIds) {
            if (send(connectionId, framed) == DeliveryStatus.DELIVERED) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Entry point for fallback polling results.
     */
    public void deliverPolledEvents(String userId, List<DeliveryEvent> events) {
        for (DeliveryEvent event : events) {
            sendToUser(userId, messageFactory.toMessage(event));
        }
    }

    // ===== Heartbeat =====

    /**
     * Records round-trip latency from a pong echoing our ping timestamp
     * (epoch seconds).
     */
    public void handlePong(String connectionId, Double pingTimestamp) {
        ClientConnection connection = activeConnections.get(connectionId);
        if (connection == null || pingTimestamp == null) {
            return;
        }
        double latencyMs = clock.millis() - pingTimestamp * 1000.0;
        if (latencyMs < 0) {
            log.debug("Ignoring pong from the future: connectionId={}", connectionId);
            return;
        }
        connection.getHealth().recordLatency(latencyMs);
    }

    void heartbeat(String connectionId) {
        ClientConnection connection = activeConnections.get(connectionId);
        if (connection == null) {
            return;
        }
        Instant now = clock.instant();
        try {
            String payload = objectMapper.writeValueAsString(DeliveryMessage.ping(clock.millis() / 1000.0));
            connection.getTransport().sendText(payload);
            connection.getHealth().recordPing(now);
        } catch (IOException | RuntimeException e) {
            log.warn("Heartbeat failed, closing connection: connectionId={}, error={}", connectionId, e.getMessage());
            disconnect(connectionId, connection.getUserId());
            connection.closeQuietly(MessageTransport.CloseReason.GOING_AWAY);
        }
    }

    // ===== Resume =====

    /**
     * Validates a reconnect token and returns the snapshot taken when the
     * user's connection was lost.
     */
    public SessionState reconnect(String userId, String token) {
        verifyReconnectToken(userId, token);
        SessionState state = sessionStates.getIfPresent(userId);
        if (state == null) {
            throw new SessionNotFoundException(userId);
        }
        log.info("Reconnect accepted: userId={}, disconnectedAt={}", userId, state.getDisconnectedAt());
        return state;
    }

    /**
     * Checks a reconnect token in constant time.
     *
     * @throws InvalidReconnectTokenException when no token is live for the user or it does not match
     */
    public void verifyReconnectToken(String userId, String token) {
        String expected = reconnectTokens.getIfPresent(userId);
        if (expected == null || token == null
                || !MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), token.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Reconnect token rejected: userId={}", userId);
            throw new InvalidReconnectTokenException(userId);
        }
    }

    // ===== Queries =====

    public boolean isConnected(String connectionId) {
        return activeConnections.containsKey(connectionId);
    }

    public int getConnectionCount() {
        return activeConnections.size();
    }

    public int getUserConnectionCount(String userId) {
        Set<String> ids = userConnections.get(userId);
        return ids != null ? ids.size() : 0;
    }

    public Optional<ConnectionHealth> getHealth(String connectionId) {
        return Optional.ofNullable(activeConnections.get(connectionId)).map(ClientConnection::getHealth);
    }

    public Optional<String> getReconnectToken(String userId) {
        return Optional.ofNullable(reconnectTokens.getIfPresent(userId));
    }

    public Optional<SessionState> getSessionState(String userId) {
        return Optional.ofNullable(sessionStates.getIfPresent(userId));
    }

    public ConnectionStats stats() {
        Instant now = clock.instant();
        Map<String, Integer> perUser = new TreeMap<>();
        userConnections.forEach((userId, ids) -> perUser.put(userId, ids.size()));
        int healthy = (int) activeConnections.values().stream()
                .filter(connection -> connection.getHealth().isHealthy(now, config.getHealthyWindow()))
                .count();

        return ConnectionStats.builder()
                .totalConnections(activeConnections.size())
                .uniqueUsers(perUser.size())
                .userConnections(perUser)
                .healthyConnections(healthy)
                .pollingSessions(pollingService.activeSessionCount())
                .queuedMessages(offlineQueue.totalSize())
                .build();
    }

    // ===== Internals =====

    private void register(ClientConnection connection) {
        String connectionId = connection.getConnectionId();
        long intervalMillis = config.getHeartbeatInterval().toMillis();
        connection.attachHeartbeat(heartbeatExecutor.scheduleAtFixedRate(
                () -> heartbeat(connectionId), intervalMillis, intervalMillis, TimeUnit.MILLISECONDS));

        activeConnections.put(connectionId, connection);
        if (connection.getUserId() != null) {
            userConnections.compute(connection.getUserId(), (id, ids) -> {
                Set<String> target = ids != null ? ids : ConcurrentHashMap.newKeySet();
                target.add(connectionId);
                return target;
            });
        }
        if (connection.getRole() != null) {
            connectionRoles.put(connectionId, connection.getRole());
        }
    }

    private ClientConnection unregister(String connectionId, String owner) {
        ClientConnection connection = activeConnections.remove(connectionId);
        if (owner != null) {
            userConnections.computeIfPresent(owner, (id, ids) -> {
                ids.remove(connectionId);
                return ids.isEmpty() ? null : ids;
            });
        }
        connectionRoles.remove(connectionId);
        rateLimiter.remove(connectionId);
        return connection;
    }

    private String issueReconnectToken(String userId) {
        byte[] bytes = new byte[config.getReconnectTokenBytes()];
        secureRandom.nextBytes(bytes);
        String token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        reconnectTokens.put(userId, token);
        return token;
    }

    /**
     * Writes queued messages in order, bypassing the rate limit: a queue may
     * legitimately hold more than one bucket's worth.
     */
    private void replayQueued(ClientConnection connection) {
        String userId = connection.getUserId();
        List<DeliveryMessage> queued = offlineQueue.drainAndClear(userId);
        if (queued.isEmpty()) {
            return;
        }
        int replayed = 0;
        for (int i = 0; i < queued.size(); i++) {
            DeliveryStatus status = write(connection, queued.get(i), false);
            if (status != DeliveryStatus.DELIVERED) {
                // the failed message was re-queued by the fallback path
                for (DeliveryMessage rest : queued.subList(i + 1, queued.size())) {
                    offlineQueue.enqueue(userId, rest);
                }
                break;
            }
            replayed++;
        }
        metricsService.recordReplayed(userId, replayed);
        log.info("Replayed offline messages: userId={}, replayed={}, queued={}", userId, replayed, queued.size());
    }

    private DeliveryStatus write(ClientConnection connection, DeliveryMessage message, boolean siblingsCovered) {
        DeliveryMessage framed = message.withEnvelope();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(framed);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize message: connectionId={}, type={}",
                    connection.getConnectionId(), framed.getType(), e);
            metricsService.recordError("SERIALIZATION_ERROR", "ConnectionManager");
            metricsService.recordDelivery(DeliveryStatus.DROPPED);
            return DeliveryStatus.DROPPED;
        }

        try {
            connection.getTransport().sendText(payload);
            metricsService.recordDelivery(DeliveryStatus.DELIVERED);
            return DeliveryStatus.DELIVERED;
        } catch (IOException | RuntimeException e) {
            log.warn("Send failed: connectionId={}, userId={}, error={}",
                    connection.getConnectionId(), connection.getUserId(), e.getMessage());
            metricsService.recordError("TRANSPORT_ERROR", "ConnectionManager");
            DeliveryStatus status = disconnectWithFallback(connection, framed, siblingsCovered);
            metricsService.recordDelivery(status);
            return status;
        }
    }

    /**
     * Tears down a connection whose write failed. Snapshots the session,
     * starts polling for the message's category and queues the message. When
     * the frame is also going to the user's other connections it is queued
     * only if none of them is left. Control frames are never queued.
     */
    private DeliveryStatus disconnectWithFallback(ClientConnection connection, DeliveryMessage message,
                                                  boolean siblingsCovered) {
        String connectionId = connection.getConnectionId();
        String userId = connection.getUserId();
        if (userId == null) {
            disconnect(connectionId, null);
            connection.closeQuietly(MessageTransport.CloseReason.SERVER_ERROR);
            return DeliveryStatus.DROPPED;
        }

        return withUserLock(userId, () -> {
            sessionStates.put(userId, SessionState.builder()
                    .userId(userId)
                    .role(connection.getRole())
                    .lastMessage(message)
                    .disconnectedAt(clock.instant())
                    .build());

            Optional<PollType> pollType = message.getType() != null
                    ? message.getType().category().pollType()
                    : Optional.empty();
            pollType.ifPresent(type -> pollingService.startPolling(
                    userId, type, events -> deliverPolledEvents(userId, events)));

            disconnect(connectionId, userId);
            connection.closeQuietly(MessageTransport.CloseReason.SERVER_ERROR);

            if (pollType.isPresent() && (!siblingsCovered || getUserConnectionCount(userId) == 0)) {
                offlineQueue.enqueue(userId, message);
                metricsService.recordQueued(userId);
                return DeliveryStatus.QUEUED;
            }
            return DeliveryStatus.DROPPED;
        });
    }

    private void evict(ClientConnection connection) {
        metricsService.recordRateLimitEviction(connection.getConnectionId());
        disconnect(connection.getConnectionId(), connection.getUserId());
        connection.closeQuietly(MessageTransport.CloseReason.POLICY_VIOLATION);
    }

    private void sweepOfflineQueues() {
        try {
            offlineQueue.sweep();
        } catch (Exception e) {
            log.error("Offline queue sweep failed", e);
        }
    }

    private <T> T withUserLock(String userId, Supplier<T> action) {
        Object lock = userLocks.get(userId, id -> new Object());
        synchronized (lock) {
            return action.get();
        }
    }

    private static List<String> snapshot(Set<String> ids) {
        return ids != null ? new ArrayList<>(ids) : List.of();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ConnectionManager: activeConnections={}", activeConnections.size());
        for (ClientConnection connection : new ArrayList<>(activeConnections.values())) {
            disconnect(connection.getConnectionId(), connection.getUserId());
            connection.closeQuietly(MessageTransport.CloseReason.GOING_AWAY);
        }
        heartbeatExecutor.shutdown();
        try {
            if (!heartbeatExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
