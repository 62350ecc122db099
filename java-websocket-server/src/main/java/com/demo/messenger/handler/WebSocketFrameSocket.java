package com.demo.messenger.handler;

import com.demo.messenger.infrastructure.ConnectionSettings;
import com.demo.messenger.infrastructure.FrameSocket;
import com.demo.messenger.infrastructure.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link FrameSocket} over a Spring {@link WebSocketSession}.
 *
 * Spring pushes inbound frames through callbacks on container threads; they are
 * buffered here so the reader pump can block on {@link #receive(Duration)}. The
 * buffer is bounded: a peer that outruns its reader is disconnected with a policy
 * violation and its unread frames are discarded.
 */
@Slf4j
public class WebSocketFrameSocket implements FrameSocket {

    // Tomcat's blocking-send timeout, honoured when running on the embedded container
    static final String BLOCKING_SEND_TIMEOUT = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    static final CloseStatus INBOUND_OVERFLOW = CloseStatus.POLICY_VIOLATION.withReason("Inbound buffer full");

    private static final InboundFrame END_OF_STREAM = new InboundFrame(null);

    private final WebSocketSession session;
    private final BlockingQueue<InboundFrame> inbound;
    // set once, by the first close observed
    private final AtomicReference<CloseStatus> closeStatus = new AtomicReference<>();
    private volatile Runnable pongHandler = () -> { };

    public WebSocketFrameSocket(WebSocketSession session, ConnectionSettings settings) {
        this.inbound = new LinkedBlockingQueue<>(settings.getInboundBufferSize());
        int writeWaitMillis = (int) settings.getWriteWait().toMillis();
        session.setTextMessageSizeLimit(settings.getMaxMessageSize());
        applySendTimeout(session, writeWaitMillis);
        this.session = new ConcurrentWebSocketSessionDecorator(
                session, writeWaitMillis, settings.getMaxMessageSize());
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public String receive(Duration timeout) throws TransportException, InterruptedException {
        // end of stream may not fit into a full buffer; it is implied once drained
        if (isClosed() && inbound.isEmpty()) {
            throw closedException();
        }
        InboundFrame frame = inbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (frame == null) {
            if (isClosed() && inbound.isEmpty()) {
                throw closedException();
            }
            return null;
        }
        if (frame == END_OF_STREAM) {
            inbound.offer(END_OF_STREAM); // later calls fail fast too
            throw closedException();
        }
        return frame.text;
    }

    @Override
    public void send(String frame) throws TransportException {
        if (!isOpen()) {
            throw closedException();
        }
        try {
            session.sendMessage(new TextMessage(frame));
        } catch (IOException | RuntimeException e) {
            throw new TransportException("Write failed on " + getId(), e);
        }
    }

    @Override
    public void ping() throws TransportException {
        if (!isOpen()) {
            throw closedException();
        }
        try {
            session.sendMessage(new PingMessage());
        } catch (IOException | RuntimeException e) {
            throw new TransportException("Ping failed on " + getId(), e);
        }
    }

    @Override
    public void onPong(Runnable handler) {
        this.pongHandler = handler;
    }

    @Override
    public void close() {
        markClosed(CloseStatus.NORMAL);
        closeSession(CloseStatus.NORMAL);
    }

    @Override
    public boolean isOpen() {
        return !isClosed() && session.isOpen();
    }

    // ===== Container callbacks =====

    void textReceived(String text) {
        if (isClosed()) {
            log.debug("Dropping frame received after close on {}", getId());
            return;
        }
        if (!inbound.offer(new InboundFrame(text))) {
            log.warn("Inbound buffer full on {}, closing connection", getId());
            inbound.clear();
            markClosed(INBOUND_OVERFLOW);
            closeSession(INBOUND_OVERFLOW);
        }
    }

    void pongReceived() {
        pongHandler.run();
    }

    void markClosed(CloseStatus status) {
        if (closeStatus.compareAndSet(null, status)) {
            inbound.offer(END_OF_STREAM);
        }
    }

    private boolean isClosed() {
        return closeStatus.get() != null;
    }

    private void closeSession(CloseStatus status) {
        if (session.isOpen()) {
            try {
                session.close(status);
            } catch (IOException | RuntimeException e) {
                log.debug("Error closing WebSocket session {}: {}", getId(), e.getMessage());
            }
        }
    }

    private TransportException closedException() {
        CloseStatus status = closeStatus.get();
        if (status == null || status.equalsCode(CloseStatus.NORMAL) || status.equalsCode(CloseStatus.GOING_AWAY)) {
            return TransportException.closed(status != null ? status.toString() : "socket closed");
        }
        return new TransportException("Connection closed: " + status);
    }

    private static void applySendTimeout(WebSocketSession session, int writeWaitMillis) {
        if (session instanceof NativeWebSocketSession) {
            Object nativeSession = ((NativeWebSocketSession) session).getNativeSession();
            if (nativeSession instanceof jakarta.websocket.Session) {
                ((jakarta.websocket.Session) nativeSession).getUserProperties()
                        .put(BLOCKING_SEND_TIMEOUT, (long) writeWaitMillis);
            }
        }
    }

    private static final class InboundFrame {
        private final String text;

        private InboundFrame(String text) {
            this.text = text;
        }
    }
}
