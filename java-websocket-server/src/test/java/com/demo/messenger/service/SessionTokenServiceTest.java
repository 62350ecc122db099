package com.demo.messenger.service;

import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SessionTokenServiceTest {

    private static final String SECRET = "test-secret-for-session-tokens-0123456789-abcdef";

    private final SessionTokenService service = new SessionTokenService(SECRET, Duration.ofHours(24));

    @Test
    void issuedTokenResolvesToUsername() {
        String token = service.issue("alice");
        assertEquals(Optional.of("alice"), service.validate(token));
    }

    @Test
    void eachLoginGetsADistinctToken() {
        assertNotEquals(service.issue("alice"), service.issue("alice"));
    }

    @Test
    void missingOrGarbageTokensAreRejected() {
        assertTrue(service.validate(null).isEmpty());
        assertTrue(service.validate("").isEmpty());
        assertTrue(service.validate("not-a-jwt").isEmpty());
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        SessionTokenService other = new SessionTokenService(
                "another-secret-for-session-tokens-9876543210-zyxw", Duration.ofHours(1));
        assertTrue(service.validate(other.issue("alice")).isEmpty());
    }

    @Test
    void expiredTokenIsRejected() {
        Instant past = Instant.now().minus(Duration.ofHours(2));
        String expired = Jwts.builder()
                .id("expired-1")
                .subject("alice")
                .issuedAt(Date.from(past))
                .expiration(Date.from(past.plus(Duration.ofHours(1))))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();

        assertTrue(service.validate(expired).isEmpty());
    }

    @Test
    void revokedTokenIsRejectedButOthersSurvive() {
        String first = service.issue("alice");
        String second = service.issue("bob");

        service.revoke(first);

        assertTrue(service.validate(first).isEmpty());
        assertEquals(Optional.of("bob"), service.validate(second));
        assertEquals(1, service.revokedCount());
    }

    @Test
    void revokingGarbageIsIgnored() {
        service.revoke("garbage");
        service.purgeExpiredRevocations();
        assertEquals(0, service.revokedCount());
    }
}
