package com.recruit.realtime.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recruit.realtime.config.DeliveryProperties;
import com.recruit.realtime.config.RedisConfig;
import com.recruit.realtime.domain.ConnectionStats;
import com.recruit.realtime.domain.DeliveryMessage;
import com.recruit.realtime.domain.DeliveryStatus;
import com.recruit.realtime.domain.EventType;
import com.recruit.realtime.domain.PollType;
import com.recruit.realtime.domain.SessionState;
import com.recruit.realtime.exception.InvalidReconnectTokenException;
import com.recruit.realtime.exception.SessionNotFoundException;
import com.recruit.realtime.service.DeliveryMessageFactory;
import com.recruit.realtime.service.FallbackPollingService;
import com.recruit.realtime.service.MetricsService;
import com.recruit.realtime.support.MutableClock;
import com.recruit.realtime.support.RecordingTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ConnectionManagerTest {

    @Mock
    private FallbackPollingService pollingService;

    private final ObjectMapper objectMapper = new RedisConfig().objectMapper();
    private MutableClock clock;
    private DeliveryProperties properties;
    private OfflineMessageQueue offlineQueue;
    private MetricsService metricsService;
    private ConnectionManager connectionManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        properties = new DeliveryProperties();
        properties.getRateLimit().setMaxMessagesPerMinute(3);
        properties.getRateLimit().setMaxViolations(3);
        offlineQueue = new OfflineMessageQueue(properties, clock);
        metricsService = new MetricsService(new SimpleMeterRegistry());
        connectionManager = new ConnectionManager(
                new RateLimiter(properties, clock),
                offlineQueue,
                pollingService,
                new DeliveryMessageFactory(),
                metricsService,
                objectMapper,
                properties,
                clock);
    }

    @AfterEach
    void tearDown() {
        connectionManager.shutdown();
    }

    @Nested
    @DisplayName("connect")
    class Connect {

        @Test
        @DisplayName("Sends a welcome frame carrying the connection id and a reconnect token")
        void sendsWelcome() throws Exception {
            RecordingTransport transport = new RecordingTransport("t1");

            String connectionId = connectionManager.connect(transport, "alice", "candidate");

            assertThat(connectionId).startsWith("ws_");
            JsonNode welcome = frame(transport, 0);
            assertThat(welcome.get("type").asText()).isEqualTo("connection_established");
            assertThat(welcome.get("connection_id").asText()).isEqualTo(connectionId);
            assertThat(welcome.get("reconnect_token").asText())
                    .isEqualTo(connectionManager.getReconnectToken("alice").orElseThrow());
            assertThat(welcome.get("message_id").asText()).isNotBlank();
            assertThat(welcome.has("timestamp")).isTrue();
            verify(pollingService).stopAllForUser("alice");
        }

        @Test
        @DisplayName("Anonymous connections get no reconnect token")
        void anonymousConnection() throws Exception {
            RecordingTransport transport = new RecordingTransport("t1");

            connectionManager.connect(transport, null, null);

            assertThat(frame(transport, 0).has("reconnect_token")).isFalse();
            assertThat(connectionManager.getConnectionCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Queued messages are replayed in order before the welcome frame")
        void replaysQueuedMessages() throws Exception {
            connectionManager.sendToUser("alice", update("first"));
            connectionManager.sendToUser("alice", update("second"));
            assertThat(offlineQueue.size("alice")).isEqualTo(2);

            RecordingTransport transport = new RecordingTransport("t1");
            connectionManager.connect(transport, "alice", null);

            assertThat(transport.sent()).hasSize(3);
            assertThat(frame(transport, 0).get("status").asText()).isEqualTo("first");
            assertThat(frame(transport, 1).get("status").asText()).isEqualTo("second");
            assertThat(frame(transport, 2).get("type").asText()).isEqualTo("connection_established");
            assertThat(offlineQueue.size("alice")).isZero();
        }

        @Test
        @DisplayName("Replay is not limited by the outbound rate limit")
        void replayBypassesRateLimit() {
            for (int i = 0; i < 10; i++) {
                connectionManager.sendToUser("alice", update("s" + i));
            }

            RecordingTransport transport = new RecordingTransport("t1");
            String connectionId = connectionManager.connect(transport, "alice", null);

            assertThat(transport.sent()).hasSize(11);
            assertThat(connectionManager.isConnected(connectionId)).isTrue();
        }
    }

    @Nested
    @DisplayName("sendToUser")
    class SendToUser {

        @Test
        @DisplayName("Delivers once to every live connection of the user")
        void deliversToEveryConnection() throws Exception {
            RecordingTransport phone = new RecordingTransport("phone");
            RecordingTransport laptop = new RecordingTransport("laptop");
            connectionManager.connect(phone, "alice", null);
            connectionManager.connect(laptop, "alice", null);

            int delivered = connectionManager.sendToUser("alice", update("shortlisted"));

            assertThat(delivered).isEqualTo(2);
            assertThat(phone.sent()).hasSize(2);
            assertThat(laptop.sent()).hasSize(2);
            assertThat(frame(phone, 1).get("message_id").asText())
                    .isEqualTo(frame(laptop, 1).get("message_id").asText());
            assertThat(offlineQueue.size("alice")).isZero();
        }

        @Test
        @DisplayName("Queues exactly once when the user has no live connection")
        void queuesWhenOffline() {
            int delivered = connectionManager.sendToUser("bob", update("rejected"));

            assertThat(delivered).isZero();
            assertThat(offlineQueue.size("bob")).isEqualTo(1);
            assertThat(metricsService.getCounterValue("delivery.queue.enqueued")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("send")
    class Send {

        @Test
        void unknownConnectionIsDropped() {
            assertThat(connectionManager.send("ws_missing", update("x"))).isEqualTo(DeliveryStatus.DROPPED);
        }

        @Test
        @DisplayName("Evicts a connection after repeated rate limit violations")
        void evictsAfterViolations() {
            RecordingTransport transport = new RecordingTransport("t1");
            String connectionId = connectionManager.connect(transport, "alice", null);

            for (int i = 0; i < 3; i++) {
                assertThat(connectionManager.send(connectionId, update("ok"))).isEqualTo(DeliveryStatus.DELIVERED);
            }
            assertThat(connectionManager.send(connectionId, update("x"))).isEqualTo(DeliveryStatus.DROPPED);
            assertThat(connectionManager.send(connectionId, update("x"))).isEqualTo(DeliveryStatus.DROPPED);
            assertThat(connectionManager.isConnected(connectionId)).isTrue();

            assertThat(connectionManager.send(connectionId, update("x"))).isEqualTo(DeliveryStatus.DROPPED);

            assertThat(connectionManager.isConnected(connectionId)).isFalse();
            assertThat(transport.closeReason()).isEqualTo(MessageTransport.CloseReason.POLICY_VIOLATION);
            assertThat(metricsService.getCounterValue("delivery.ratelimit.evicted")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("A failed write queues the message, snapshots the session and starts polling")
        void failedWriteFallsBack() {
            RecordingTransport transport = new RecordingTransport("t1");
            String connectionId = connectionManager.connect(transport, "alice", "candidate");
            transport.failWrites();

            DeliveryStatus status = connectionManager.send(connectionId, update("shortlisted"));

            assertThat(status).isEqualTo(DeliveryStatus.QUEUED);
            assertThat(connectionManager.isConnected(connectionId)).isFalse();
            assertThat(offlineQueue.size("alice")).isEqualTo(1);
            verify(pollingService).startPolling(eq("alice"), eq(PollType.APPLICATION), any());

            SessionState state = connectionManager.getSessionState("alice").orElseThrow();
            assertThat(state.getRole()).isEqualTo("candidate");
            assertThat(state.getLastMessage().getStatus()).isEqualTo("shortlisted");
            assertThat(state.getDisconnectedAt()).isEqualTo(clock.instant());
        }

        @Test
        @DisplayName("A failed direct write is queued even while another connection of the user is live")
        void failedDirectWriteWithSiblingIsQueued() {
            RecordingTransport broken = new RecordingTransport("broken");
            RecordingTransport healthy = new RecordingTransport("healthy");
            String brokenId = connectionManager.connect(broken, "alice", null);
            connectionManager.connect(healthy, "alice", null);
            broken.failWrites();

            assertThat(connectionManager.send(brokenId, update("x"))).isEqualTo(DeliveryStatus.QUEUED);
            assertThat(offlineQueue.size("alice")).isEqualTo(1);
            assertThat(healthy.sent()).hasSize(1);
            assertThat(connectionManager.getUserConnectionCount("alice")).isEqualTo(1);
        }

        @Test
        @DisplayName("A user fan-out does not queue a frame another connection of the user received")
        void failedUserFanOutWithSiblingIsNotQueued() {
            RecordingTransport broken = new RecordingTransport("broken");
            RecordingTransport healthy = new RecordingTransport("healthy");
            connectionManager.connect(broken, "alice", null);
            connectionManager.connect(healthy, "alice", null);
            broken.failWrites();

            int delivered = connectionManager.sendToUser("alice", update("x"));

            assertThat(delivered).isEqualTo(1);
            assertThat(healthy.sent()).hasSize(2);
            assertThat(offlineQueue.size("alice")).isZero();
        }

        @Test
        @DisplayName("A user fan-out queues the frame when every connection fails")
        void failedUserFanOutQueuesOnce() {
            RecordingTransport first = new RecordingTransport("a");
            RecordingTransport second = new RecordingTransport("b");
            connectionManager.connect(first, "alice", null);
            connectionManager.connect(second, "alice", null);
            first.failWrites();
            second.failWrites();

            assertThat(connectionManager.sendToUser("alice", update("x"))).isZero();
            assertThat(offlineQueue.size("alice")).isEqualTo(1);
            assertThat(connectionManager.getUserConnectionCount("alice")).isZero();
        }
    }

    @Nested
    @DisplayName("fan-out")
    class FanOut {

        @Test
        void broadcastToRoleReachesOnlyThatRole() {
            RecordingTransport recruiter = new RecordingTransport("r");
            RecordingTransport candidate = new RecordingTransport("c");
            connectionManager.connect(recruiter, "rita", "recruiter");
            connectionManager.connect(candidate, "carl", "candidate");

            int delivered = connectionManager.broadcastToRole(update("x"), "recruiter");

            assertThat(delivered).isEqualTo(1);
            assertThat(recruiter.sent()).hasSize(2);
            assertThat(candidate.sent()).hasSize(1);
        }

        @Test
        @DisplayName("A failed role write is queued for the user even when their other connection lacks the role")
        void failedRoleWriteIsQueued() {
            RecordingTransport staff = new RecordingTransport("staff");
            RecordingTransport phone = new RecordingTransport("phone");
            connectionManager.connect(staff, "rita", "recruiter");
            connectionManager.connect(phone, "rita", null);
            staff.failWrites();

            int delivered = connectionManager.broadcastToRole(update("x"), "recruiter");

            assertThat(delivered).isZero();
            assertThat(phone.sent()).hasSize(1);
            assertThat(offlineQueue.size("rita")).isEqualTo(1);
        }

        @Test
        @DisplayName("One failing connection does not stop a broadcast reaching the others")
        void broadcastIsolatesFailures() {
            RecordingTransport first = new RecordingTransport("a");
            RecordingTransport middle = new RecordingTransport("b");
            RecordingTransport last = new RecordingTransport("c");
            connectionManager.connect(first, "u1", null);
            String middleId = connectionManager.connect(middle, "u2", null);
            connectionManager.connect(last, "u3", null);
            middle.failWrites();
            int before = connectionManager.getConnectionCount();

            int delivered = connectionManager.broadcast(update("x"), Set.of());

            assertThat(delivered).isEqualTo(2);
            assertThat(first.sent()).hasSize(2);
            assertThat(last.sent()).hasSize(2);
            assertThat(connectionManager.isConnected(middleId)).isFalse();
            assertThat(middle.closeReason()).isEqualTo(MessageTransport.CloseReason.SERVER_ERROR);
            assertThat(connectionManager.getConnectionCount()).isEqualTo(before - 1);
        }

        @Test
        void broadcastSkipsExcludedConnections() {
            RecordingTransport first = new RecordingTransport("a");
            RecordingTransport second = new RecordingTransport("b");
            String firstId = connectionManager.connect(first, "u1", null);
            connectionManager.connect(second, null, null);

            int delivered = connectionManager.broadcast(update("x"), Set.of(firstId));

            assertThat(delivered).isEqualTo(1);
            assertThat(first.sent()).hasSize(1);
            assertThat(second.sent()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("heartbeat")
    class Heartbeat {

        @Test
        @DisplayName("Ping carries epoch seconds and marks the connection healthy")
        void pingMarksHealthy() throws Exception {
            RecordingTransport transport = new RecordingTransport("t1");
            String connectionId = connectionManager.connect(transport, "alice", null);

            connectionManager.heartbeat(connectionId);

            JsonNode ping = frame(transport, 1);
            assertThat(ping.get("type").asText()).isEqualTo("ping");
            assertThat(ping.get("ping_timestamp").asDouble()).isEqualTo(clock.millis() / 1000.0);
            assertThat(connectionManager.getHealth(connectionId).orElseThrow().getPingCount()).isEqualTo(1);
            assertThat(connectionManager.stats().getHealthyConnections()).isEqualTo(1);

            clock.advance(Duration.ofSeconds(61));
            assertThat(connectionManager.stats().getHealthyConnections()).isZero();
        }

        @Test
        void pongRecordsLatency() {
            String connectionId = connectionManager.connect(new RecordingTransport("t1"), "alice", null);

            connectionManager.handlePong(connectionId, (clock.millis() - 150) / 1000.0);

            assertThat(connectionManager.getHealth(connectionId).orElseThrow().getLatenciesMs())
                    .singleElement()
                    .satisfies(latency -> assertThat(latency).isCloseTo(150.0, within(0.01)));
        }

        @Test
        void failedPingClosesConnection() {
            RecordingTransport transport = new RecordingTransport("t1");
            String connectionId = connectionManager.connect(transport, "alice", null);
            transport.failWrites();

            connectionManager.heartbeat(connectionId);

            assertThat(connectionManager.isConnected(connectionId)).isFalse();
            assertThat(connectionManager.getUserConnectionCount("alice")).isZero();
        }
    }

    @Nested
    @DisplayName("reconnect")
    class Reconnect {

        @Test
        void acceptsIssuedToken() {
            RecordingTransport transport = new RecordingTransport("t1");
            String connectionId = connectionManager.connect(transport, "alice", "candidate");
            String token = connectionManager.getReconnectToken("alice").orElseThrow();
            transport.failWrites();
            connectionManager.send(connectionId, update("shortlisted"));

            SessionState state = connectionManager.reconnect("alice", token);

            assertThat(state.getUserId()).isEqualTo("alice");
            assertThat(state.getRole()).isEqualTo("candidate");
        }

        @Test
        void rejectsWrongToken() {
            connectionManager.connect(new RecordingTransport("t1"), "alice", null);

            assertThatThrownBy(() -> connectionManager.reconnect("alice", "not-the-token"))
                    .isInstanceOf(InvalidReconnectTokenException.class);
        }

        @Test
        @DisplayName("Token verification guards queue access without needing a lost session")
        void verifiesTokenWithoutSession() {
            connectionManager.connect(new RecordingTransport("t1"), "alice", null);
            String token = connectionManager.getReconnectToken("alice").orElseThrow();

            assertThatCode(() -> connectionManager.verifyReconnectToken("alice", token)).doesNotThrowAnyException();
            assertThatThrownBy(() -> connectionManager.verifyReconnectToken("alice", token + "x"))
                    .isInstanceOf(InvalidReconnectTokenException.class);
            assertThatThrownBy(() -> connectionManager.verifyReconnectToken("bob", token))
                    .isInstanceOf(InvalidReconnectTokenException.class);
        }

        @Test
        void rejectsUnknownUser() {
            assertThatThrownBy(() -> connectionManager.reconnect("nobody", "token"))
                    .isInstanceOf(InvalidReconnectTokenException.class);
        }

        @Test
        @DisplayName("A valid token without a lost session is reported as not found")
        void validTokenWithoutSession() {
            connectionManager.connect(new RecordingTransport("t1"), "alice", null);
            String token = connectionManager.getReconnectToken("alice").orElseThrow();

            assertThatThrownBy(() -> connectionManager.reconnect("alice", token))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        @Test
        @DisplayName("Tokens expire after the reconnect window")
        void tokenExpires() {
            connectionManager.connect(new RecordingTransport("t1"), "alice", null);
            String token = connectionManager.getReconnectToken("alice").orElseThrow();

            clock.advance(Duration.ofHours(25));

            assertThatThrownBy(() -> connectionManager.reconnect("alice", token))
                    .isInstanceOf(InvalidReconnectTokenException.class);
        }
    }

    @Test
    @DisplayName("Disconnect waits for an in-flight fan-out to the same user")
    void disconnectWaitsForUserFanOut() throws Exception {
        ExecutorService closer = Executors.newSingleThreadExecutor();
        AtomicReference<String> connectionId = new AtomicReference<>();
        AtomicReference<Future<?>> closing = new AtomicReference<>();
        AtomicBoolean connectedAfterCloseRequested = new AtomicBoolean();
        RecordingTransport transport = new RecordingTransport("t1") {
            @Override
            public void sendText(String payload) throws IOException {
                super.sendText(payload);
                if (payload.contains("\"status\":\"shortlisted\"")) {
                    closing.set(closer.submit(() -> connectionManager.disconnect(connectionId.get(), "alice")));
                    pause(100);
                    connectedAfterCloseRequested.set(connectionManager.isConnected(connectionId.get()));
                }
            }
        };
        try {
            connectionId.set(connectionManager.connect(transport, "alice", null));

            int delivered = connectionManager.sendToUser("alice", update("shortlisted"));
            closing.get().get(1, TimeUnit.SECONDS);

            assertThat(delivered).isEqualTo(1);
            assertThat(connectedAfterCloseRequested).isTrue();
            assertThat(connectionManager.isConnected(connectionId.get())).isFalse();
            assertThat(offlineQueue.size("alice")).isZero();
        } finally {
            closer.shutdownNow();
        }
    }

    @Test
    @DisplayName("Disconnect is idempotent and clears every index")
    void disconnectIsIdempotent() {
        String connectionId = connectionManager.connect(new RecordingTransport("t1"), "alice", "candidate");

        connectionManager.disconnect(connectionId, "alice");
        connectionManager.disconnect(connectionId, "alice");

        ConnectionStats stats = connectionManager.stats();
        assertThat(stats.getTotalConnections()).isZero();
        assertThat(stats.getUniqueUsers()).isZero();
        assertThat(connectionManager.broadcastToRole(update("x"), "candidate")).isZero();
        assertThat(metricsService.getActiveConnections()).isZero();
    }

    @Test
    void statsCountConnectionsPerUser() {
        connectionManager.connect(new RecordingTransport("a"), "alice", null);
        connectionManager.connect(new RecordingTransport("b"), "alice", null);
        connectionManager.connect(new RecordingTransport("c"), "bob", null);
        connectionManager.sendToUser("carol", update("x"));

        ConnectionStats stats = connectionManager.stats();

        assertThat(stats.getTotalConnections()).isEqualTo(3);
        assertThat(stats.getUniqueUsers()).isEqualTo(2);
        assertThat(stats.getUserConnections()).isEqualTo(Map.of("alice", 2, "bob", 1));
        assertThat(stats.getQueuedMessages()).isEqualTo(1);
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private JsonNode frame(RecordingTransport transport, int index) throws Exception {
        return objectMapper.readTree(transport.sent().get(index));
    }

    private static DeliveryMessage update(String status) {
        return DeliveryMessage.builder()
                .type(EventType.APPLICATION_UPDATE)
                .eventType(EventType.APPLICATION_STATUS_CHANGED)
                .status(status)
                .build();
    }
}
