package com.demo.messenger.service;

import lombok.Getter;

/**
 * Identity already has a live connection; the new login or upgrade is refused.
 */
@Getter
public class AdmissionConflictException extends RuntimeException {

    private final String username;

    public AdmissionConflictException(String username) {
        super("User " + username + " already has an active connection");
        this.username = username;
    }
}
