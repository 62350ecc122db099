package com.demo.messenger.domain;

import com.demo.messenger.infrastructure.ClientConnection;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Presence record of a known identity. Records are never removed, only marked offline.
 *
 * {@code currentConnection} is a non-owning reference; it is {@code null} while offline.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class UserPresence {

    private String username;
    private boolean online;
    private Instant lastSeen;

    @JsonIgnore
    @ToString.Exclude
    private ClientConnection currentConnection;

    /** Copy safe to hand out of the hub. */
    public UserPresence snapshot() {
        return toBuilder().currentConnection(null).build();
    }
}
