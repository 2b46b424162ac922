package com.recruit.realtime.domain;

import lombok.Value;

import java.time.Instant;

@Value
public class QueuedMessage {
    DeliveryMessage message;
    Instant enqueuedAt;
}
