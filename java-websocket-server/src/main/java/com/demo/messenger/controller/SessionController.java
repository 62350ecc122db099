package com.demo.messenger.controller;

import com.demo.messenger.domain.LoginRequest;
import com.demo.messenger.domain.UserResponse;
import com.demo.messenger.domain.ValidationResult;
import com.demo.messenger.infrastructure.ChatHub;
import com.demo.messenger.service.Authenticator;
import com.demo.messenger.service.IdentityValidator;
import com.demo.messenger.service.SessionTokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;

/**
 * Login / logout / current user
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class SessionController {

    private final IdentityValidator identityValidator;
    private final SessionTokenService sessionTokenService;
    private final Authenticator authenticator;
    private final ChatHub chatHub;

    public SessionController(IdentityValidator identityValidator,
                             SessionTokenService sessionTokenService,
                             Authenticator authenticator,
                             ChatHub chatHub) {
        this.identityValidator = identityValidator;
        this.sessionTokenService = sessionTokenService;
        this.authenticator = authenticator;
        this.chatHub = chatHub;
    }

    /**
     * POST /api/login
     */
    @PostMapping("/login")
    public ResponseEntity<UserResponse> login(@RequestBody LoginRequest request) {
        ValidationResult result = identityValidator.validate(request.getUsername());
        if (!result.isValid()) {
            throw new IllegalArgumentException(result.getErrorMessage());
        }

        String username = result.getValue();
        authenticator.ensureNotConnected(username);

        String token = sessionTokenService.issue(username);
        log.info("Login: username={}", username);

        // online flips to true once the WebSocket registers
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookie(token, sessionTokenService.getTtl()).toString())
                .body(new UserResponse(username, false));
    }

    /**
     * POST /api/logout
     */
    @PostMapping("/logout")
    public ResponseEntity<Void> logout(
            @CookieValue(name = SessionTokenService.COOKIE_NAME, required = false) String token) {
        String username = authenticator.requireIdentity(token);

        chatHub.disconnect(username);
        sessionTokenService.revoke(token);
        log.info("Logout: username={}", username);

        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, sessionCookie("", Duration.ZERO).toString())
                .build();
    }

    /**
     * GET /api/me
     */
    @GetMapping("/me")
    public UserResponse me(@CookieValue(name = SessionTokenService.COOKIE_NAME, required = false) String token) {
        String username = authenticator.requireIdentity(token);
        return new UserResponse(username, chatHub.isOnline(username));
    }

    private static ResponseCookie sessionCookie(String value, Duration maxAge) {
        return ResponseCookie.from(SessionTokenService.COOKIE_NAME, value)
                .httpOnly(true)
                .secure(false) // Set to true in production with HTTPS
                .sameSite("Strict")
                .path("/")
                .maxAge(maxAge)
                .build();
    }
}
