package com.recruit.realtime.infrastructure;

import com.recruit.realtime.config.DeliveryProperties;
import com.recruit.realtime.domain.PollType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Last record id each user has been sent per poll type, kept in Redis so a new
 * polling session resumes where the previous one stopped.
 */
@Component
@Slf4j
public class WatermarkStore {

    private static final String KEY = "last_update_{userId}_{type}";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public WatermarkStore(StringRedisTemplate redisTemplate, DeliveryProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getPolling().getWatermarkTtl();
    }

    public Optional<Long> get(String userId, PollType type) {
        try {
            String value = redisTemplate.opsForValue().get(key(userId, type));
            return value != null ? Optional.of(Long.parseLong(value)) : Optional.empty();
        } catch (NumberFormatException e) {
            log.warn("Ignoring corrupt watermark: userId={}, type={}", userId, type);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Failed to read watermark: userId={}, type={}, error={}", userId, type, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(String userId, PollType type, long watermark) {
        try {
            redisTemplate.opsForValue().set(key(userId, type), Long.toString(watermark), ttl);
        } catch (Exception e) {
            log.warn("Failed to store watermark: userId={}, type={}, error={}", userId, type, e.getMessage());
        }
    }

    private static String key(String userId, PollType type) {
        return KEY.replace("{userId}", userId).replace("{type}", type.wireName());
    }
}
