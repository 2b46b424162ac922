package com.recruit.realtime.handler;

import com.recruit.realtime.service.SecurityValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Resolves who is connecting from {@code /ws/connect/{userId}?role=...} and,
 * when {@code security.jwt.enabled} is set, rejects handshakes without a
 * valid token for that user.
 */
@Component
@Slf4j
public class ConnectHandshakeInterceptor implements HandshakeInterceptor {

    static final String ATTR_USER_ID = "userId";
    static final String ATTR_ROLE = "role";

    private final SecurityValidator securityValidator;
    private final boolean jwtEnabled;

    public ConnectHandshakeInterceptor(SecurityValidator securityValidator,
                                       @Value("${security.jwt.enabled:false}") boolean jwtEnabled) {
        this.securityValidator = securityValidator;
        this.jwtEnabled = jwtEnabled;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {
        UriComponents uri = UriComponentsBuilder.fromUri(request.getURI()).build();
        MultiValueMap<String, String> query = uri.getQueryParams();

        String userId = userIdFromPath(uri.getPathSegments());
        if (userId == null) {
            userId = decode(query.getFirst("user_id"));
        }
        String role = decode(query.getFirst("role"));

        if (jwtEnabled) {
            String token = decode(query.getFirst("token"));
            if (token == null) {
                token = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
            }
            if (userId == null || !securityValidator.validateToken(token, userId)) {
                log.warn("Handshake rejected: userId={}, remote={}", userId, request.getRemoteAddress());
                response.setStatusCode(HttpStatus.UNAUTHORIZED);
                return false;
            }
        }

        if (userId != null) {
            attributes.put(ATTR_USER_ID, userId);
        }
        if (role != null) {
            attributes.put(ATTR_ROLE, role);
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        if (exception != null) {
            log.warn("Handshake failed: uri={}, error={}", request.getURI(), exception.getMessage());
        }
    }

    /**
     * {@code [ws, connect, alice] -> alice}; no third segment means anonymous.
     */
    static String userIdFromPath(List<String> segments) {
        if (segments.size() < 3) {
            return null;
        }
        return decode(segments.get(segments.size() - 1));
    }

    private static String decode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}
