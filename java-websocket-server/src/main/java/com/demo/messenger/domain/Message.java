package com.demo.messenger.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Locale;

/**
 * One chat message as held in a conversation log. Only {@link #status} changes
 * after creation, and only from SENT to DELIVERED.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private String id;
    private String from;
    private String to;
    private String content;
    private Instant createdAt;
    private DeliveryStatus status;

    public enum DeliveryStatus {
        SENT, DELIVERED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
