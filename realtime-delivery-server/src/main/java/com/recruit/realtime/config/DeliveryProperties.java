package com.recruit.realtime.config;

import com.recruit.realtime.domain.PollType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables of the delivery server, bound from {@code delivery.*}.
 */
@ConfigurationProperties(prefix = "delivery")
@Data
@Validated
public class DeliveryProperties {

    private final Connection connection = new Connection();
    private final RateLimit rateLimit = new RateLimit();
    private final Queue queue = new Queue();
    private final Polling polling = new Polling();
    private final Router router = new Router();
    private final Bus bus = new Bus();

    @Data
    public static class Connection {
        @NotNull
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        /** A connection pinged within this window counts as healthy. */
        @NotNull
        private Duration healthyWindow = Duration.ofSeconds(60);
        @NotNull
        private Duration reconnectWindow = Duration.ofHours(24);
        @Positive
        private int reconnectTokenBytes = 32;
        @Positive
        private int heartbeatThreads = 2;
    }

    @Data
    public static class RateLimit {
        @Positive
        private int maxMessagesPerMinute = 120;
        @Positive
        private int maxViolations = 3;
    }

    @Data
    public static class Queue {
        @Positive
        private int maxSize = 1000;
        @NotNull
        private Duration retention = Duration.ofHours(24);
        @NotNull
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Polling {
        private Map<PollType, Duration> intervals = defaultIntervals();
        @NotNull
        private Duration maxSessionAge = Duration.ofHours(24);
        @NotNull
        private Duration watermarkTtl = Duration.ofHours(24);
        @Positive
        private int threads = 4;

        public Duration intervalFor(PollType type) {
            return intervals.getOrDefault(type, defaultIntervals().get(type));
        }

        private static Map<PollType, Duration> defaultIntervals() {
            Map<PollType, Duration> defaults = new EnumMap<>(PollType.class);
            defaults.put(PollType.INTERVIEW, Duration.ofSeconds(5));
            defaults.put(PollType.APPLICATION, Duration.ofSeconds(30));
            defaults.put(PollType.JOB, Duration.ofSeconds(60));
            defaults.put(PollType.SYSTEM, Duration.ofSeconds(300));
            return defaults;
        }
    }

    @Data
    public static class Router {
        @Positive
        private int queueCapacity = 10_000;
        /** Role that also receives user-targeted interview and application updates. Blank disables. */
        private String staffRole = "recruiter";
    }

    @Data
    public static class Bus {
        private String channel = "events";
        private String kafkaTopic = "delivery-events";
    }
}
