package com.demo.messenger.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Envelope kinds. MESSAGE and TYPING travel both ways; STATUS and ACK are server to client only.
 */
public enum EnvelopeType {
    MESSAGE(true),
    TYPING(true),
    STATUS(false),
    ACK(false);

    private final boolean inbound;

    EnvelopeType(boolean inbound) {
        this.inbound = inbound;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isInbound() {
        return inbound;
    }

    public static Optional<EnvelopeType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.wireName().equals(wireName))
                .findFirst();
    }
}
