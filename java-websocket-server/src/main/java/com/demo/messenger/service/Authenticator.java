package com.demo.messenger.service;

import java.util.Optional;

/**
 * Resolves request credentials to a validated identity and answers the admission
 * precondition used before a socket is upgraded.
 */
public interface Authenticator {

    Optional<String> authenticate(String credential);

    boolean isConnected(String username);

    default String requireIdentity(String credential) {
        return authenticate(credential)
                .orElseThrow(() -> new UnauthenticatedException("Not authenticated"));
    }

    default void ensureNotConnected(String username) {
        if (isConnected(username)) {
            throw new AdmissionConflictException(username);
        }
    }
}
