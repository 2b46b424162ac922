package com.recruit.realtime.controller;

import com.recruit.realtime.domain.DeliveryMessage;
import com.recruit.realtime.domain.PollingSessionRequest;
import com.recruit.realtime.exception.PollingSessionNotFoundException;
import com.recruit.realtime.infrastructure.ConnectionManager;
import com.recruit.realtime.infrastructure.OfflineMessageQueue;
import com.recruit.realtime.service.FallbackPollingService;
import com.recruit.realtime.service.PollingSession;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Polling transport for clients that cannot hold a WebSocket. Polled
 * records land in the user's offline queue and are drained by
 * {@code GET /api/polling/updates}, which requires the user's reconnect token.
 */
@RestController
@RequestMapping("/api/polling")
public class PollingController {

    private final FallbackPollingService pollingService;
    private final ConnectionManager connectionManager;
    private final OfflineMessageQueue offlineQueue;

    public PollingController(FallbackPollingService pollingService,
                             ConnectionManager connectionManager,
                             OfflineMessageQueue offlineQueue) {
        this.pollingService = pollingService;
        this.connectionManager = connectionManager;
        this.offlineQueue = offlineQueue;
    }

    @PostMapping("/sessions")
    public ResponseEntity<Map<String, Object>> start(@Valid @RequestBody PollingSessionRequest request) {
        String userId = request.getUserId();
        String sessionId = pollingService.startPolling(userId, request.getPollType(),
                events -> connectionManager.deliverPolledEvents(userId, events));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("session_id", sessionId);
        response.put("user_id", userId);
        response.put("poll_type", request.getPollType().wireName());
        pollingService.getSession(sessionId)
                .map(PollingSession::getInterval)
                .ifPresent(interval -> response.put("interval_seconds", interval.getSeconds()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> stop(@PathVariable String sessionId) {
        if (!pollingService.stopPolling(sessionId)) {
            throw new PollingSessionNotFoundException(sessionId);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Drains the user's queued messages. The caller proves ownership of the
     * queue with the reconnect token issued on its last connect.
     */
    @GetMapping("/updates")
    public Map<String, Object> updates(@RequestParam("user_id") String userId,
                                       @RequestParam("reconnect_token") String reconnectToken) {
        connectionManager.verifyReconnectToken(userId, reconnectToken);
        List<DeliveryMessage> messages = offlineQueue.drainAndClear(userId);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("user_id", userId);
        response.put("count", messages.size());
        response.put("messages", messages);
        return response;
    }
}
