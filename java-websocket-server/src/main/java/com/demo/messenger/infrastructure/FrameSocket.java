package com.demo.messenger.infrastructure;

import java.time.Duration;

/**
 * Bidirectional text-frame socket handed to a {@link ClientConnection}.
 *
 * {@link #receive(Duration)} is called only by the reader pump; {@link #send(String)}
 * and {@link #ping()} only by the writer pump. {@link #close()} may be called from
 * any thread, any number of times.
 */
public interface FrameSocket {

    String getId();

    /**
     * Blocks for the next inbound text frame.
     *
     * @return the frame, or {@code null} if none arrived within the timeout
     * @throws TransportException when the socket is closed or failed
     */
    String receive(Duration timeout) throws TransportException, InterruptedException;

    void send(String frame) throws TransportException;

    void ping() throws TransportException;

    /** Handler run for every pong received from the peer. */
    void onPong(Runnable handler);

    /** Sends a normal close frame if the socket is still open; never throws. */
    void close();

    boolean isOpen();
}
