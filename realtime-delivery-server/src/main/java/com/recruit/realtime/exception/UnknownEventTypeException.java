package com.recruit.realtime.exception;

public class UnknownEventTypeException extends DeliveryException {

    public UnknownEventTypeException(String eventType) {
        super(ErrorCode.UNKNOWN_EVENT_TYPE, "Unknown or unpublishable event type: " + eventType);
    }
}
