package com.recruit.realtime.controller;

import com.recruit.realtime.infrastructure.ConnectionManager;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final StringRedisTemplate redisTemplate;
    private final ConnectionManager connectionManager;

    public HealthController(StringRedisTemplate redisTemplate, ConnectionManager connectionManager) {
        this.redisTemplate = redisTemplate;
        this.connectionManager = connectionManager;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");
        response.put("active_connections", connectionManager.getConnectionCount());

        try {
            redisTemplate.getConnectionFactory().getConnection().ping();
            response.put("redis", "connected");
        } catch (Exception e) {
            response.put("redis", "disconnected");
        }

        return response;
    }
}
