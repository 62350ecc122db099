package com.demo.messenger.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Server to client {@code message} payload; also the shape of history entries.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboundMessage {

    private String id;
    private String from;
    private String to;
    private String content;
    private String timestamp; // RFC 3339
    private String status;

    public static OutboundMessage from(Message message) {
        return from(message, message.getStatus());
    }

    public static OutboundMessage from(Message message, Message.DeliveryStatus status) {
        return OutboundMessage.builder()
                .id(message.getId())
                .from(message.getFrom())
                .to(message.getTo())
                .content(message.getContent())
                .timestamp(formatTimestamp(message.getCreatedAt()))
                .status(status.wireName())
                .build();
    }

    static String formatTimestamp(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }
}
