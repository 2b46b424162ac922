package com.recruit.realtime.exception;

public class PollingSessionNotFoundException extends DeliveryException {

    public PollingSessionNotFoundException(String sessionId) {
        super(ErrorCode.POLLING_SESSION_NOT_FOUND, "Polling session not found: " + sessionId);
    }
}
