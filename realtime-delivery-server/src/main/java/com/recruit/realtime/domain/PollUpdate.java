package com.recruit.realtime.domain;

import lombok.Value;

/**
 * A record from the system of record, already shaped as a live-path event.
 */
@Value
public class PollUpdate {
    long recordId;
    DeliveryEvent event;
}
