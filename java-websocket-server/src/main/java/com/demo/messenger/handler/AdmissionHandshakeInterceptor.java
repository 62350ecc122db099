package com.demo.messenger.handler;

import com.demo.messenger.service.AdmissionConflictException;
import com.demo.messenger.service.Authenticator;
import com.demo.messenger.service.MetricsService;
import com.demo.messenger.service.SessionTokenService;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.WebUtils;

import java.util.Map;
import java.util.Optional;

/**
 * Gate in front of the WebSocket upgrade: 401 without a valid session, 409 when the
 * identity is already connected. The hub still evicts on the race between this check
 * and registration.
 */
@Slf4j
@Component
public class AdmissionHandshakeInterceptor implements HandshakeInterceptor {

    public static final String USERNAME_ATTRIBUTE = "chat.username";

    private final Authenticator authenticator;
    private final MetricsService metricsService;

    public AdmissionHandshakeInterceptor(Authenticator authenticator, MetricsService metricsService) {
        this.authenticator = authenticator;
        this.metricsService = metricsService;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request,
                                   ServerHttpResponse response,
                                   WebSocketHandler wsHandler,
                                   Map<String, Object> attributes) {

        Optional<String> username = extractSessionToken(request).flatMap(authenticator::authenticate);
        if (username.isEmpty()) {
            log.warn("WebSocket upgrade without valid session: remote={}", request.getRemoteAddress());
            metricsService.recordAdmissionRejected("unauthenticated");
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        try {
            authenticator.ensureNotConnected(username.get());
        } catch (AdmissionConflictException e) {
            log.warn("Rejecting WebSocket upgrade: {}", e.getMessage());
            metricsService.recordAdmissionRejected("conflict");
            response.setStatusCode(HttpStatus.CONFLICT);
            return false;
        }

        attributes.put(USERNAME_ATTRIBUTE, username.get());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request,
                               ServerHttpResponse response,
                               WebSocketHandler wsHandler,
                               Exception exception) {
        if (exception != null) {
            log.error("WebSocket upgrade failed", exception);
        }
    }

    private Optional<String> extractSessionToken(ServerHttpRequest request) {
        if (request instanceof ServletServerHttpRequest) {
            HttpServletRequest servletRequest = ((ServletServerHttpRequest) request).getServletRequest();
            Cookie cookie = WebUtils.getCookie(servletRequest, SessionTokenService.COOKIE_NAME);
            return Optional.ofNullable(cookie).map(Cookie::getValue);
        }
        return Optional.empty();
    }
}
