package com.demo.messenger.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Session tokens carried in the {@value #COOKIE_NAME} cookie.
 *
 * Tokens are signed JWTs whose subject is the username. Logout revokes a token by
 * its id; a revocation is remembered for one token lifetime, after which the token
 * has expired on its own.
 */
@Service
@Slf4j
public class SessionTokenService {

    public static final String COOKIE_NAME = "session_id";

    private final SecretKey secretKey;

    @Getter
    private final Duration ttl;

    // jti -> subject
    private final Cache<String, String> revoked;

    public SessionTokenService(
            @Value("${chat.session.secret:change-me-chat-session-secret-at-least-256-bits-long}") String secret,
            @Value("${chat.session.ttl:24h}") Duration ttl) {
        this.secretKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttl = ttl;
        this.revoked = Caffeine.newBuilder()
            .maximumSize(100_000)
            .expireAfterWrite(ttl)
            .build();
    }

    /**
     * Issue a session token for an already validated username.
     */
    public String issue(String username) {
        Instant now = Instant.now();
        return Jwts.builder()
            .id(UUID.randomUUID().toString())
            .subject(username)
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(ttl)))
            .signWith(secretKey)
            .compact();
    }

    /**
     * @return the username, or empty for a missing, forged, expired or revoked token
     */
    public Optional<String> validate(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        try {
            Claims claims = parse(token);
            if (claims.getId() != null && revoked.getIfPresent(claims.getId()) != null) {
                log.debug("Revoked session token presented: user={}", claims.getSubject());
                return Optional.empty();
            }
            return Optional.ofNullable(claims.getSubject());

        } catch (ExpiredJwtException e) {
            log.debug("Expired session token: {}", e.getMessage());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Rejected session token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void revoke(String token) {
        try {
            Claims claims = parse(token);
            if (claims.getId() != null) {
                revoked.put(claims.getId(), claims.getSubject());
                log.info("Session token revoked: user={}", claims.getSubject());
            }
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Ignoring revoke of invalid token: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${chat.session.revocation-sweep-ms:600000}")
    public void purgeExpiredRevocations() {
        revoked.cleanUp();
        log.debug("Revocation cache cleaned up, size={}", revoked.estimatedSize());
    }

    long revokedCount() {
        revoked.cleanUp();
        return revoked.estimatedSize();
    }

    private Claims parse(String token) {
        return Jwts.parser()
            .verifyWith(secretKey)
            .build()
            .parseSignedClaims(token)
            .getPayload();
    }
}
