package com.demo.messenger.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client to server {@code message} payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {
    private String to;
    private String content;
    private String tempId; // client-side correlation, not echoed
}
