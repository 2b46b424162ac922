package com.recruit.realtime.exception;

public class InvalidReconnectTokenException extends DeliveryException {

    public InvalidReconnectTokenException(String userId) {
        super(ErrorCode.INVALID_RECONNECT_TOKEN, "Invalid reconnect token for user " + userId);
    }
}
