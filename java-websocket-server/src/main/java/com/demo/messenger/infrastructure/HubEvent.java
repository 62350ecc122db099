package com.demo.messenger.infrastructure;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * Unit of work for the hub's event loop.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
final class HubEvent {

    enum Type {
        REGISTER, UNREGISTER, TYPING
    }

    private final Type type;
    private final ClientConnection client;
    private final String from;
    private final String to;
    private final boolean typing;
    private final CompletableFuture<Boolean> completion = new CompletableFuture<>();

    static HubEvent register(ClientConnection client) {
        return new HubEvent(Type.REGISTER, client, client.getUsername(), null, false);
    }

    static HubEvent unregister(ClientConnection client) {
        return new HubEvent(Type.UNREGISTER, client, client.getUsername(), null, false);
    }

    /** {@code origin} is null when the signal does not come from a connection. */
    static HubEvent typing(ClientConnection origin, String from, String to, boolean isTyping) {
        return new HubEvent(Type.TYPING, origin, from, to, isTyping);
    }

    @Override
    public String toString() {
        return "HubEvent{type=" + type + ", from=" + from + (to != null ? ", to=" + to : "") + "}";
    }
}
