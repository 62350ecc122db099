package com.demo.messenger.infrastructure;

/**
 * Inbound frame that cannot be turned into a routable envelope. The frame is
 * skipped and the connection stays open.
 */
public class MalformedEnvelopeException extends Exception {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
