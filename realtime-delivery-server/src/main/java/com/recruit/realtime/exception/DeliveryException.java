package com.recruit.realtime.exception;

import lombok.Getter;

/**
 * Base of the errors the delivery server surfaces to HTTP callers.
 */
@Getter
public abstract class DeliveryException extends RuntimeException {

    private final ErrorCode errorCode;

    protected DeliveryException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected DeliveryException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
