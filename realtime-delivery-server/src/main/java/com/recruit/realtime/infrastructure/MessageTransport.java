package com.recruit.realtime.infrastructure;

import java.io.IOException;

/**
 * Bidirectional client channel the connection manager writes frames to.
 */
public interface MessageTransport {

    String id();

    boolean isOpen();

    void sendText(String payload) throws IOException;

    void close(CloseReason reason);

    enum CloseReason {
        NORMAL,
        GOING_AWAY,
        POLICY_VIOLATION,
        SERVER_ERROR
    }
}
