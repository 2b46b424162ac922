package com.recruit.realtime.controller;

import com.recruit.realtime.domain.ConnectionStats;
import com.recruit.realtime.domain.ReconnectRequest;
import com.recruit.realtime.domain.ReconnectResponse;
import com.recruit.realtime.domain.SessionState;
import com.recruit.realtime.infrastructure.ConnectionManager;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP side of the WebSocket endpoint: resume checks and connection stats.
 */
@RestController
@RequestMapping("/ws")
public class DeliveryController {

    private final ConnectionManager connectionManager;

    public DeliveryController(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @PostMapping("/reconnect")
    public ReconnectResponse reconnect(@Valid @RequestBody ReconnectRequest request) {
        SessionState state = connectionManager.reconnect(request.getUserId(), request.getReconnectToken());
        return ReconnectResponse.ready(state, request.getRole());
    }

    @GetMapping("/status")
    public ConnectionStats status() {
        return connectionManager.stats();
    }
}
