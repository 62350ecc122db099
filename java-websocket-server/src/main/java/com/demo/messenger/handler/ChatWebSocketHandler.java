package com.demo.messenger.handler;

import com.demo.messenger.infrastructure.ChatHub;
import com.demo.messenger.infrastructure.ClientConnection;
import com.demo.messenger.infrastructure.ConnectionSettings;
import com.demo.messenger.infrastructure.EnvelopeCodec;
import com.demo.messenger.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Binds upgraded sessions to hub connections. Container callbacks only feed the
 * session's {@link WebSocketFrameSocket}; all routing happens on the connection's pumps.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    private final ChatHub chatHub;
    private final EnvelopeCodec codec;
    private final MetricsService metricsService;
    private final ConnectionSettings settings;
    private final ExecutorService pumpExecutor;

    // wsSessionId -> socket
    private final Map<String, WebSocketFrameSocket> sockets = new ConcurrentHashMap<>();

    public ChatWebSocketHandler(ChatHub chatHub,
                                EnvelopeCodec codec,
                                MetricsService metricsService,
                                ConnectionSettings settings,
                                @Qualifier("pumpExecutor") ExecutorService pumpExecutor) {
        this.chatHub = chatHub;
        this.codec = codec;
        this.metricsService = metricsService;
        this.settings = settings;
        this.pumpExecutor = pumpExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        String username = (String) wsSession.getAttributes().get(AdmissionHandshakeInterceptor.USERNAME_ATTRIBUTE);
        if (username == null) {
            log.warn("WebSocket session {} has no authenticated user, closing", wsSession.getId());
            wsSession.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        WebSocketFrameSocket socket = new WebSocketFrameSocket(wsSession, settings);
        sockets.put(wsSession.getId(), socket);

        ClientConnection client = new ClientConnection(username, socket, chatHub, codec, metricsService, settings);

        // Pumps start only once the hub has installed the connection
        chatHub.register(client).whenComplete((registered, error) -> {
            if (error != null) {
                log.error("Failed to register client: username={}, wsId={}", username, wsSession.getId(), error);
                socket.close();
                return;
            }
            client.start(pumpExecutor);
        });

        log.info("WebSocket connected: wsId={}, username={}", wsSession.getId(), username);
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        WebSocketFrameSocket socket = sockets.get(wsSession.getId());
        if (socket == null) {
            log.warn("Frame for unknown WebSocket session: {}", wsSession.getId());
            return;
        }
        log.debug("Received frame from {}: {} bytes", wsSession.getId(), message.getPayloadLength());
        socket.textReceived(message.getPayload());
    }

    @Override
    protected void handlePongMessage(WebSocketSession wsSession, PongMessage message) {
        WebSocketFrameSocket socket = sockets.get(wsSession.getId());
        if (socket != null) {
            socket.pongReceived();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        WebSocketFrameSocket socket = sockets.remove(wsSession.getId());
        if (socket != null) {
            socket.markClosed(status);
        }
        log.info("WebSocket closed: wsId={}, status={}", wsSession.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        log.warn("WebSocket transport error: wsId={}, error={}", wsSession.getId(), exception.getMessage());
        WebSocketFrameSocket socket = sockets.get(wsSession.getId());
        if (socket != null) {
            socket.markClosed(CloseStatus.SERVER_ERROR);
        }
    }

    int openSocketCount() {
        return sockets.size();
    }
}
