package com.recruit.realtime.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.recruit.realtime.domain.DeliveryMessage;
import com.recruit.realtime.infrastructure.ConnectionManager;
import com.recruit.realtime.infrastructure.WebSocketTransport;
import com.recruit.realtime.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint for live updates.
 *
 * Inbound frames:
 * - {@code pong} with the echoed {@code ping_timestamp}
 * - {@code ping}, answered with a pong
 * - {@code user_message}, logged only
 *
 * Anything else, including malformed JSON, is ignored.
 */
@Slf4j
@Component
public class DeliveryWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_CONNECTION_ID = "connectionId";

    private final ConnectionManager connectionManager;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;

    public DeliveryWebSocketHandler(ConnectionManager connectionManager,
                                    ObjectMapper objectMapper,
                                    MetricsService metricsService) {
        this.connectionManager = connectionManager;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        String userId = (String) wsSession.getAttributes().get(ConnectHandshakeInterceptor.ATTR_USER_ID);
        String role = (String) wsSession.getAttributes().get(ConnectHandshakeInterceptor.ATTR_ROLE);

        try {
            String connectionId = connectionManager.connect(new WebSocketTransport(wsSession), userId, role);
            wsSession.getAttributes().put(ATTR_CONNECTION_ID, connectionId);
            log.debug("WebSocket bound: wsId={}, connectionId={}", wsSession.getId(), connectionId);

        } catch (Exception e) {
            log.error("Error establishing connection: wsId={}, userId={}", wsSession.getId(), userId, e);
            metricsService.recordConnection(userId, false);
            metricsService.recordError("CONNECTION_ERROR", "WebSocketHandler");
            wsSession.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        String connectionId = connectionId(wsSession);
        if (connectionId == null) {
            return;
        }

        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("Ignoring malformed frame: connectionId={}", connectionId);
            return;
        }

        String type = frame.path("type").asText("");
        metricsService.recordMessageReceived(type.isEmpty() ? "unknown" : type);

        switch (type) {
            case "pong":
                JsonNode timestamp = frame.get("ping_timestamp");
                connectionManager.handlePong(connectionId,
                        timestamp != null && timestamp.isNumber() ? timestamp.asDouble() : null);
                break;

            case "ping":
                connectionManager.send(connectionId, DeliveryMessage.pong());
                break;

            case "user_message":
                log.info("User message received: connectionId={}, userId={}",
                        connectionId, wsSession.getAttributes().get(ConnectHandshakeInterceptor.ATTR_USER_ID));
                break;

            default:
                log.debug("Ignoring frame: connectionId={}, type={}", connectionId, type);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        String connectionId = connectionId(wsSession);
        log.warn("Transport error: connectionId={}, error={}", connectionId, exception.getMessage());
        metricsService.recordError("TRANSPORT_ERROR", "WebSocketHandler");
        release(wsSession, connectionId);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        String connectionId = connectionId(wsSession);
        log.debug("WebSocket closed: connectionId={}, status={}", connectionId, status);
        release(wsSession, connectionId);
    }

    private void release(WebSocketSession wsSession, String connectionId) {
        if (connectionId != null) {
            connectionManager.disconnect(connectionId,
                    (String) wsSession.getAttributes().get(ConnectHandshakeInterceptor.ATTR_USER_ID));
        }
    }

    private static String connectionId(WebSocketSession wsSession) {
        return (String) wsSession.getAttributes().get(ATTR_CONNECTION_ID);
    }
}
