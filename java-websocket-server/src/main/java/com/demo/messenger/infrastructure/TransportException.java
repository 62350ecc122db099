package com.demo.messenger.infrastructure;

import java.io.IOException;

/**
 * Read, write or ping failure on a connection's socket. Always fatal to the
 * owning pump pair.
 */
public class TransportException extends IOException {

    private final boolean normalClosure;

    public TransportException(String message) {
        this(message, false, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, false, cause);
    }

    private TransportException(String message, boolean normalClosure, Throwable cause) {
        super(message, cause);
        this.normalClosure = normalClosure;
    }

    public static TransportException closed(String reason) {
        return new TransportException("Connection closed: " + reason, true, null);
    }

    /** Peer or server closed the socket cleanly. */
    public boolean isNormalClosure() {
        return normalClosure;
    }
}
