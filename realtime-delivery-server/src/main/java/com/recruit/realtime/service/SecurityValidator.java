package com.recruit.realtime.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * JWT check for WebSocket handshakes. The token subject must be the user id
 * the client connects as.
 */
@Service
@Slf4j
public class SecurityValidator {

    private final SecretKey secretKey;
    private final long tokenExpirationMs;
    private final MetricsService metricsService;

    public SecurityValidator(
            @Value("${security.jwt.secret:default-secret-key-change-this-in-production-minimum-256-bits}") String secret,
            @Value("${security.jwt.expiration-ms:3600000}") long tokenExpirationMs,
            MetricsService metricsService) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.tokenExpirationMs = tokenExpirationMs;
        this.metricsService = metricsService;
    }

    public boolean validateToken(String token, String userId) {
        try {
            if (token == null || token.isEmpty()) {
                log.warn("Empty token provided for user: {}", userId);
                metricsService.recordAuthenticationAttempt(false);
                return false;
            }

            if (token.startsWith("Bearer ")) {
                token = token.substring(7);
            }

            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String tokenUserId = claims.getSubject();
            if (userId == null || !userId.equals(tokenUserId)) {
                log.warn("User ID mismatch: expected={}, token={}", userId, tokenUserId);
                metricsService.recordAuthenticationAttempt(false);
                return false;
            }

            metricsService.recordAuthenticationAttempt(true);
            return true;

        } catch (ExpiredJwtException e) {
            log.warn("Expired JWT token for user {}: {}", userId, e.getMessage());
            metricsService.recordAuthenticationAttempt(false);
            return false;
        } catch (SignatureException | MalformedJwtException | UnsupportedJwtException e) {
            log.warn("Invalid JWT token for user {}: {}", userId, e.getMessage());
            metricsService.recordAuthenticationAttempt(false);
            return false;
        } catch (IllegalArgumentException e) {
            log.warn("JWT claims string is empty: {}", e.getMessage());
            metricsService.recordAuthenticationAttempt(false);
            return false;
        }
    }

    /**
     * Signed token for a user, for local development and tests.
     */
    public String generateToken(String userId) {
        return Jwts.builder()
            .subject(userId)
            .issuedAt(new Date())
            .expiration(new Date(System.currentTimeMillis() + tokenExpirationMs))
            .signWith(secretKey)
            .compact();
    }
}
