package com.recruit.realtime.infrastructure;

import com.recruit.realtime.config.DeliveryProperties;
import com.recruit.realtime.domain.DeliveryMessage;
import com.recruit.realtime.domain.QueuedMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Per-user FIFO of messages for users with no live connection.
 *
 * <p>A queue never holds more than {@code max-size} entries nor entries older
 * than {@code retention}; both are enforced on append and by {@link #sweep()}.
 * All mutation of a user's deque happens inside the map's per-key compute.
 */
@Component
@Slf4j
public class OfflineMessageQueue {

    private final ConcurrentHashMap<String, Deque<QueuedMessage>> queues = new ConcurrentHashMap<>();
    private final int maxSize;
    private final Duration retention;
    private final Clock clock;

    public OfflineMessageQueue(DeliveryProperties properties, Clock clock) {
        this.maxSize = properties.getQueue().getMaxSize();
        this.retention = properties.getQueue().getRetention();
        this.clock = clock;
    }

    public void enqueue(String userId, DeliveryMessage message) {
        Instant now = clock.instant();
        queues.compute(userId, (id, queue) -> {
            Deque<QueuedMessage> target = queue != null ? queue : new ArrayDeque<>();
            target.addLast(new QueuedMessage(message, now));
            trim(id, target, now);
            return target;
        });
    }

    /**
     * Atomically take every queued message of the user, oldest first.
     */
    public List<DeliveryMessage> drainAndClear(String userId) {
        Deque<QueuedMessage> queue = queues.remove(userId);
        if (queue == null) {
            return List.of();
        }
        Instant cutoff = clock.instant().minus(retention);
        return queue.stream()
                .filter(entry -> entry.getEnqueuedAt().isAfter(cutoff))
                .map(QueuedMessage::getMessage)
                .collect(Collectors.toList());
    }

    /**
     * Drop expired entries for every user and forget empty queues.
     */
    public void sweep() {
        Instant now = clock.instant();
        for (String userId : queues.keySet()) {
            queues.computeIfPresent(userId, (id, queue) -> {
                trim(id, queue, now);
                return queue.isEmpty() ? null : queue;
            });
        }
    }

    public int size(String userId) {
        AtomicInteger size = new AtomicInteger();
        queues.computeIfPresent(userId, (id, queue) -> {
            size.set(queue.size());
            return queue;
        });
        return size.get();
    }

    public int totalSize() {
        return queues.keySet().stream().mapToInt(this::size).sum();
    }

    private void trim(String userId, Deque<QueuedMessage> queue, Instant now) {
        Instant cutoff = now.minus(retention);
        while (!queue.isEmpty() && !queue.peekFirst().getEnqueuedAt().isAfter(cutoff)) {
            queue.removeFirst();
        }
        int dropped = 0;
        while (queue.size() > maxSize) {
            queue.removeFirst();
            dropped++;
        }
        if (dropped > 0) {
            log.warn("Offline queue full, dropped oldest messages: userId={}, dropped={}", userId, dropped);
        }
    }
}
