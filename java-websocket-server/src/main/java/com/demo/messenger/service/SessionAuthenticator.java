package com.demo.messenger.service;

import com.demo.messenger.infrastructure.ChatHub;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Session-cookie authenticator: the credential is a token from {@link SessionTokenService}.
 */
@Service
public class SessionAuthenticator implements Authenticator {

    private final SessionTokenService sessionTokenService;
    private final ChatHub chatHub;

    public SessionAuthenticator(SessionTokenService sessionTokenService, ChatHub chatHub) {
        this.sessionTokenService = sessionTokenService;
        this.chatHub = chatHub;
    }

    @Override
    public Optional<String> authenticate(String credential) {
        return sessionTokenService.validate(credential);
    }

    @Override
    public boolean isConnected(String username) {
        return chatHub.isRegistered(username);
    }
}
