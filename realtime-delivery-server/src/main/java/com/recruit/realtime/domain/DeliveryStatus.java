package com.recruit.realtime.domain;

/**
 * Outcome of a single send attempt.
 */
public enum DeliveryStatus {
    DELIVERED,
    QUEUED,
    DROPPED
}
