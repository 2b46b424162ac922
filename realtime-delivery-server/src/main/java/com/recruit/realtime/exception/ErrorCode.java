package com.recruit.realtime.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    UNKNOWN_EVENT_TYPE("UNKNOWN_EVENT_TYPE", 400),
    INVALID_RECONNECT_TOKEN("INVALID_RECONNECT_TOKEN", 401),
    SESSION_NOT_FOUND("SESSION_NOT_FOUND", 404),
    POLLING_SESSION_NOT_FOUND("POLLING_SESSION_NOT_FOUND", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
