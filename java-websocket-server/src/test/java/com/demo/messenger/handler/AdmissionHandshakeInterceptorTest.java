package com.demo.messenger.handler;

import com.demo.messenger.service.AdmissionConflictException;
import com.demo.messenger.service.Authenticator;
import com.demo.messenger.service.MetricsService;
import com.demo.messenger.service.SessionTokenService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AdmissionHandshakeInterceptorTest {

    private Authenticator authenticator;
    private MetricsService metricsService;
    private AdmissionHandshakeInterceptor interceptor;

    private MockHttpServletRequest servletRequest;
    private MockHttpServletResponse servletResponse;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        authenticator = mock(Authenticator.class);
        metricsService = new MetricsService(new SimpleMeterRegistry());
        interceptor = new AdmissionHandshakeInterceptor(authenticator, metricsService);

        servletRequest = new MockHttpServletRequest("GET", "/ws");
        servletResponse = new MockHttpServletResponse();
        attributes = new HashMap<>();
    }

    private boolean handshake() {
        return interceptor.beforeHandshake(
                new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(servletResponse),
                mock(WebSocketHandler.class),
                attributes);
    }

    @Test
    void admitsAuthenticatedIdentity() {
        servletRequest.setCookies(new Cookie(SessionTokenService.COOKIE_NAME, "token-a"));
        when(authenticator.authenticate("token-a")).thenReturn(Optional.of("alice"));

        assertTrue(handshake());
        assertEquals("alice", attributes.get(AdmissionHandshakeInterceptor.USERNAME_ATTRIBUTE));
    }

    @Test
    void rejectsMissingCookieWith401() {
        assertFalse(handshake());
        assertEquals(401, servletResponse.getStatus());
        assertTrue(attributes.isEmpty());
        verify(authenticator, never()).authenticate(any());
        assertEquals(1, metricsService.getCounterValue("chat.admission.rejected"));
    }

    @Test
    void rejectsInvalidSessionWith401() {
        servletRequest.setCookies(new Cookie(SessionTokenService.COOKIE_NAME, "stale"));
        when(authenticator.authenticate("stale")).thenReturn(Optional.empty());

        assertFalse(handshake());
        assertEquals(401, servletResponse.getStatus());
    }

    @Test
    void rejectsAlreadyConnectedIdentityWith409() {
        servletRequest.setCookies(new Cookie(SessionTokenService.COOKIE_NAME, "token-a"));
        when(authenticator.authenticate("token-a")).thenReturn(Optional.of("alice"));
        doThrow(new AdmissionConflictException("alice")).when(authenticator).ensureNotConnected("alice");

        assertFalse(handshake());
        assertEquals(409, servletResponse.getStatus());
        assertFalse(attributes.containsKey(AdmissionHandshakeInterceptor.USERNAME_ATTRIBUTE));
    }
}
