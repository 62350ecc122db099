package com.demo.messenger.infrastructure;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-connection timing and sizing limits.
 */
@Value
@Builder
public class ConnectionSettings {

    /** Read deadline; refreshed by pongs and inbound frames. */
    @Builder.Default
    Duration pongWait = Duration.ofSeconds(60);

    /** Must stay below pongWait so a healthy peer never hits the read deadline. */
    @Builder.Default
    Duration pingPeriod = Duration.ofSeconds(54);

    @Builder.Default
    Duration writeWait = Duration.ofSeconds(10);

    @Builder.Default
    int maxMessageSize = 512 * 1024;

    @Builder.Default
    int sendBufferSize = 256;

    /** Frames received but not yet read; overflow closes the connection. */
    @Builder.Default
    int inboundBufferSize = 256;

    public static ConnectionSettings defaults() {
        return ConnectionSettings.builder().build();
    }
}
