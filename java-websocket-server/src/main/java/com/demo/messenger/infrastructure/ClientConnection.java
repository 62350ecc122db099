package com.demo.messenger.infrastructure;

import com.demo.messenger.domain.InboundEnvelope;
import com.demo.messenger.domain.InboundMessage;
import com.demo.messenger.domain.TypingEvent;
import com.demo.messenger.service.MetricsService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * One live socket bound to one identity, driven by a reader pump and a writer pump.
 *
 * The writer pump is the only thread that writes to the socket. It stops when the
 * outbound queue is closed (eviction, unregister, backpressure) or a write fails, and
 * closes the socket on the way out. The reader pump stops when the socket closes,
 * fails or misses its read deadline, and then unregisters the connection.
 */
@Slf4j
public class ClientConnection {

    @Getter
    private final String username;

    @Getter
    private final OutboundQueue outbound;

    private final FrameSocket socket;
    private final ChatHub hub;
    private final EnvelopeCodec codec;
    private final MetricsService metricsService;
    private final ConnectionSettings settings;

    private final CountDownLatch pumpsFinished = new CountDownLatch(2);
    private volatile long readDeadline;

    public ClientConnection(String username,
                            FrameSocket socket,
                            ChatHub hub,
                            EnvelopeCodec codec,
                            MetricsService metricsService,
                            ConnectionSettings settings) {
        this.username = username;
        this.socket = socket;
        this.hub = hub;
        this.codec = codec;
        this.metricsService = metricsService;
        this.settings = settings;
        this.outbound = new OutboundQueue(settings.getSendBufferSize());
    }

    public String getId() {
        return socket.getId();
    }

    /**
     * Starts both pumps. Call once, after the hub has registered the connection.
     */
    public void start(Executor executor) {
        socket.onPong(this::refreshReadDeadline);
        refreshReadDeadline();
        executor.execute(this::writePump);
        executor.execute(this::readPump);
    }

    /**
     * Cancels the writer pump; idempotent.
     */
    public boolean closeOutbound() {
        return outbound.close();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return pumpsFinished.await(timeout, unit);
    }

    // ===== Reader pump =====

    void readPump() {
        try {
            while (true) {
                handleFrame(receiveFrame());
            }
        } catch (TransportException e) {
            if (e.isNormalClosure()) {
                log.debug("WebSocket closed for {}: {}", username, e.getMessage());
            } else {
                log.warn("WebSocket read error for {}: {}", username, e.getMessage());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Read pump interrupted for {}", username);
        } catch (RuntimeException e) {
            log.error("Unexpected error in read pump for {}", username, e);
        } finally {
            hub.unregister(this);
            socket.close();
            pumpsFinished.countDown();
        }
    }

    private String receiveFrame() throws TransportException, InterruptedException {
        while (true) {
            long remaining = readDeadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TransportException("No traffic within " + settings.getPongWait());
            }
            String frame = socket.receive(Duration.ofNanos(remaining));
            if (frame != null) {
                refreshReadDeadline();
                return frame;
            }
        }
    }

    void handleFrame(String frame) {
        InboundEnvelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (MalformedEnvelopeException e) {
            log.warn("Skipping envelope from {}: {}", username, e.getMessage());
            metricsService.recordMalformedEnvelope(username);
            return;
        }

        switch (envelope.getType()) {
            case MESSAGE:
                handleMessage(envelope.getMessage());
                break;
            case TYPING:
                handleTyping(envelope.getTyping());
                break;
            default:
                log.warn("Ignoring {} envelope from {}", envelope.getType(), username);
        }
    }

    private void handleMessage(InboundMessage inbound) {
        if (isBlank(inbound.getTo())) {
            log.warn("Skipping message from {} without recipient", username);
            metricsService.recordMalformedEnvelope(username);
            return;
        }
        String content = inbound.getContent() != null ? inbound.getContent() : "";
        hub.routeMessageFrom(this, inbound.getTo(), content);
    }

    private void handleTyping(TypingEvent typing) {
        if (isBlank(typing.getTo())) {
            log.warn("Skipping typing event from {} without recipient", username);
            metricsService.recordMalformedEnvelope(username);
            return;
        }
        hub.routeTypingFrom(this, typing.getTo(), typing.typing());
    }

    private void refreshReadDeadline() {
        readDeadline = System.nanoTime() + settings.getPongWait().toNanos();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ===== Writer pump =====

    void writePump() {
        long pingPeriod = settings.getPingPeriod().toNanos();
        long nextPing = System.nanoTime() + pingPeriod;
        try {
            while (true) {
                long untilPing = nextPing - System.nanoTime();
                if (untilPing <= 0) {
                    socket.ping();
                    nextPing = System.nanoTime() + pingPeriod;
                    continue;
                }

                String frame = outbound.poll(untilPing, TimeUnit.NANOSECONDS);
                if (frame == null) {
                    if (outbound.isDrained()) {
                        log.debug("Send queue closed for {}, closing connection {}", username, getId());
                        return;
                    }
                    continue;
                }

                socket.send(frame);

                // Flush whatever piled up meanwhile, one frame each
                for (String queued : outbound.drain()) {
                    socket.send(queued);
                }
            }
        } catch (TransportException e) {
            log.warn("WebSocket write error for {}: {}", username, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Write pump interrupted for {}", username);
        } catch (RuntimeException e) {
            log.error("Unexpected error in write pump for {}", username, e);
        } finally {
            socket.close();
            pumpsFinished.countDown();
        }
    }

    @Override
    public String toString() {
        return "ClientConnection{username=" + username + ", id=" + getId() + "}";
    }
}
