package com.recruit.realtime.exception;

public class SessionNotFoundException extends DeliveryException {

    public SessionNotFoundException(String userId) {
        super(ErrorCode.SESSION_NOT_FOUND, "No resumable session for user " + userId);
    }
}
