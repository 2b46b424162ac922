package com.recruit.realtime.infrastructure;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * Spring WebSocket session as a {@link MessageTransport}. Sends are serialised
 * by a {@link ConcurrentWebSocketSessionDecorator} so heartbeat and fan-out
 * threads can write to the same session.
 */
@Slf4j
public class WebSocketTransport implements MessageTransport {

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final WebSocketSession session;

    public WebSocketTransport(WebSocketSession session) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT);
    }

    @Override
    public String id() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void sendText(String payload) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + session.getId() + " is closed");
        }
        session.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close(CloseReason reason) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(toCloseStatus(reason));
        } catch (IOException e) {
            log.warn("Failed to close WebSocket session: wsId={}, reason={}", session.getId(), reason, e);
        }
    }

    private static CloseStatus toCloseStatus(CloseReason reason) {
        return switch (reason) {
            case NORMAL -> CloseStatus.NORMAL;
            case GOING_AWAY -> CloseStatus.GOING_AWAY;
            case POLICY_VIOLATION -> CloseStatus.POLICY_VIOLATION;
            case SERVER_ERROR -> CloseStatus.SERVER_ERROR;
        };
    }
}
