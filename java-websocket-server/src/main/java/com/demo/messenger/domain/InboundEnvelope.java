package com.demo.messenger.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Decoded client envelope. Exactly one payload is set, matching {@link #getType()}.
 */
@Getter
@ToString
@AllArgsConstructor
public class InboundEnvelope {

    private final EnvelopeType type;
    private final InboundMessage message;
    private final TypingEvent typing;

    public static InboundEnvelope message(InboundMessage message) {
        return new InboundEnvelope(EnvelopeType.MESSAGE, message, null);
    }

    public static InboundEnvelope typing(TypingEvent typing) {
        return new InboundEnvelope(EnvelopeType.TYPING, null, typing);
    }
}
