package com.demo.messenger.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code typing} payload: inbound carries {@code to}, outbound carries {@code from}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TypingEvent {
    private String from;
    private String to;
    private Boolean isTyping;

    public boolean typing() {
        return Boolean.TRUE.equals(isTyping);
    }
}
