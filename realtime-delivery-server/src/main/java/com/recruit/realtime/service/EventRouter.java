package com.recruit.realtime.service;

import com.recruit.realtime.config.DeliveryProperties;
import com.recruit.realtime.domain.BusEvent;
import com.recruit.realtime.domain.DeliveryEvent;
import com.recruit.realtime.domain.DeliveryMessage;
import com.recruit.realtime.domain.EventCategory;
import com.recruit.realtime.domain.EventTarget;
import com.recruit.realtime.domain.EventType;
import com.recruit.realtime.exception.UnknownEventTypeException;
import com.recruit.realtime.infrastructure.ConnectionManager;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Routes events to their audience.
 *
 * <p>{@link #publish(DeliveryEvent)} only enqueues; a single dispatch thread
 * drains the bounded queue in order, so events are routed in publish order
 * and producers never block. When the queue is full the event is dropped
 * and logged.
 */
@Service
@Slf4j
public class EventRouter {

    private final ConnectionManager connectionManager;
    private final DeliveryMessageFactory messageFactory;
    private final MetricsService metricsService;
    private final String staffRole;
    private final ExecutorService dispatchExecutor;

    @Autowired
    public EventRouter(ConnectionManager connectionManager,
                       DeliveryMessageFactory messageFactory,
                       MetricsService metricsService,
                       DeliveryProperties properties) {
        this(connectionManager, messageFactory, metricsService, properties,
                new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                        new LinkedBlockingQueue<>(properties.getRouter().getQueueCapacity()),
                        new CustomizableThreadFactory("event-dispatch-")));
    }

    EventRouter(ConnectionManager connectionManager,
                DeliveryMessageFactory messageFactory,
                MetricsService metricsService,
                DeliveryProperties properties,
                ExecutorService dispatchExecutor) {
        this.connectionManager = connectionManager;
        this.messageFactory = messageFactory;
        this.metricsService = metricsService;
        this.staffRole = properties.getRouter().getStaffRole();
        this.dispatchExecutor = dispatchExecutor;
    }

    /**
     * Hands an event to the dispatch thread. Never blocks.
     */
    public void publish(DeliveryEvent event) {
        try {
            dispatchExecutor.execute(() -> dispatch(event));
        } catch (RejectedExecutionException e) {
            log.error("Dispatch queue full, dropping event: type={}, target={}",
                    event.getEventType().wireName(), event.getTarget());
            metricsService.recordError("DISPATCH_REJECTED", "EventRouter");
        }
    }

    /**
     * Builds and publishes an event from its wire form.
     *
     * @throws UnknownEventTypeException if the type is unknown or a connection control type
     */
    public DeliveryEvent publish(String eventType, EventTarget target, String jobId, Map<String, Object> payload) {
        DeliveryEvent event = DeliveryEvent.builder()
                .eventType(resolveType(eventType))
                .target(target != null ? target : EventTarget.broadcast())
                .jobId(jobId)
                .payload(payload != null ? payload : Map.of())
                .build();
        publish(event);
        return event;
    }

    /**
     * Publishes an event received from the cross-process bus.
     */
    public DeliveryEvent publish(BusEvent busEvent) {
        DeliveryEvent event = DeliveryEvent.builder()
                .eventType(resolveType(busEvent.getEventType()))
                .target(EventTarget.of(busEvent.getUserId(), busEvent.getTargetRole()))
                .jobId(busEvent.getJobId())
                .payload(busEvent.getPayload() != null ? busEvent.getPayload() : Map.of())
                .createdAt(parseTimestamp(busEvent.getTimestamp()))
                .build();
        publish(event);
        return event;
    }

    /**
     * Routes one event synchronously.
     *
     * @return number of connections the event was written to
     */
    public int dispatch(DeliveryEvent event) {
        try {
            return switch (event.category()) {
                case CONNECTION -> {
                    log.warn("Ignoring connection control event: type={}", event.getEventType().wireName());
                    yield 0;
                }
                case INTERVIEW, APPLICATION -> {
                    DeliveryMessage message = messageFactory.toMessage(event);
                    yield deliver(event.getTarget(), message) + mirrorToStaff(event, message);
                }
                case JOB, SYSTEM -> deliver(event.getTarget(), messageFactory.toMessage(event));
            };
        } catch (Exception e) {
            log.error("Failed to route event: type={}, target={}",
                    event.getEventType().wireName(), event.getTarget(), e);
            metricsService.recordError("ROUTING_ERROR", "EventRouter");
            return 0;
        }
    }

    private int deliver(EventTarget target, DeliveryMessage message) {
        if (target.isRole()) {
            return connectionManager.broadcastToRole(message, target.getRole());
        }
        if (target.isUser()) {
            return connectionManager.sendToUser(target.getUserId(), message);
        }
        return connectionManager.broadcast(message, Set.of());
    }

    private int mirrorToStaff(DeliveryEvent event, DeliveryMessage message) {
        EventTarget target = event.getTarget();
        if (!target.isUser() || staffRole == null || staffRole.isBlank()) {
            return 0;
        }
        return connectionManager.broadcastToRole(messageFactory.forStaff(message, target.getUserId()), staffRole);
    }

    private static EventType resolveType(String eventType) {
        EventType type = EventType.fromWire(eventType)
                .orElseThrow(() -> new UnknownEventTypeException(eventType));
        if (type.category() == EventCategory.CONNECTION) {
            throw new UnknownEventTypeException(eventType);
        }
        return type;
    }

    private static Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) {
            return Instant.now();
        }
        try {
            return Instant.parse(timestamp);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable bus timestamp, using now: {}", timestamp);
            return Instant.now();
        }
    }

    @PreDestroy
    public void shutdown() {
        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                dispatchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
