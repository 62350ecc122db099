package com.demo.messenger.controller;

import com.demo.messenger.domain.ConversationSummary;
import com.demo.messenger.domain.OutboundMessage;
import com.demo.messenger.domain.UserResponse;
import com.demo.messenger.infrastructure.ChatHub;
import com.demo.messenger.service.Authenticator;
import com.demo.messenger.service.SessionTokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only views over the hub: user search, conversation list and history.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class ConversationController {

    private final ChatHub chatHub;
    private final Authenticator authenticator;

    public ConversationController(ChatHub chatHub, Authenticator authenticator) {
        this.chatHub = chatHub;
        this.authenticator = authenticator;
    }

    /**
     * GET /api/users?search=
     */
    @GetMapping("/users")
    public List<UserResponse> searchUsers(
            @CookieValue(name = SessionTokenService.COOKIE_NAME, required = false) String token,
            @RequestParam(name = "search", required = false, defaultValue = "") String search) {
        String username = authenticator.requireIdentity(token);
        return chatHub.searchIdentities(search, username).stream()
                .map(UserResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * GET /api/conversations
     */
    @GetMapping("/conversations")
    public List<ConversationSummary> listConversations(
            @CookieValue(name = SessionTokenService.COOKIE_NAME, required = false) String token) {
        String username = authenticator.requireIdentity(token);
        return chatHub.listConversations(username);
    }

    /**
     * GET /api/conversations/{peerUsername}
     */
    @GetMapping("/conversations/{peerUsername}")
    public List<OutboundMessage> getConversation(
            @CookieValue(name = SessionTokenService.COOKIE_NAME, required = false) String token,
            @PathVariable String peerUsername) {
        String username = authenticator.requireIdentity(token);
        String peer = peerUsername.trim();
        if (peer.isEmpty()) {
            throw new IllegalArgumentException("Peer username required");
        }

        List<OutboundMessage> history = chatHub.getConversation(username, peer).stream()
                .map(OutboundMessage::from)
                .collect(Collectors.toList());
        log.debug("History requested: username={}, peer={}, count={}", username, peer, history.size());
        return history;
    }
}
