package com.demo.messenger.controller;

import com.demo.messenger.infrastructure.ChatHub;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class HealthController {

    private final ChatHub chatHub;

    public HealthController(ChatHub chatHub) {
        this.chatHub = chatHub;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "healthy");
        response.put("activeConnections", chatHub.activeConnectionCount());
        response.put("knownUsers", chatHub.knownIdentityCount());
        return response;
    }
}
