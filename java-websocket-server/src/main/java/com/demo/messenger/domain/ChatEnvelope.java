package com.demo.messenger.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire envelope {@code {"type": kind, "payload": {...}}} sent to clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatEnvelope {

    private EnvelopeType type;
    private Object payload;

    // Factory methods

    public static ChatEnvelope message(Message message, Message.DeliveryStatus status) {
        return ChatEnvelope.builder()
            .type(EnvelopeType.MESSAGE)
            .payload(OutboundMessage.from(message, status))
            .build();
    }

    public static ChatEnvelope typing(String from, boolean isTyping) {
        return ChatEnvelope.builder()
            .type(EnvelopeType.TYPING)
            .payload(TypingEvent.builder()
                .from(from)
                .isTyping(isTyping)
                .build())
            .build();
    }

    public static ChatEnvelope status(String username, boolean online) {
        return ChatEnvelope.builder()
            .type(EnvelopeType.STATUS)
            .payload(new StatusEvent(username, online))
            .build();
    }

    public static ChatEnvelope ack(String messageId, Message.DeliveryStatus status) {
        return ChatEnvelope.builder()
            .type(EnvelopeType.ACK)
            .payload(new AckEvent(messageId, status.wireName()))
            .build();
    }
}
