package com.demo.messenger.config;

import com.demo.messenger.handler.AdmissionHandshakeInterceptor;
import com.demo.messenger.handler.ChatWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChatWebSocketHandler chatWebSocketHandler;
    private final AdmissionHandshakeInterceptor admissionHandshakeInterceptor;

    @Value("${chat.websocket.path:/ws}")
    private String path;

    @Value("${chat.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    public WebSocketConfig(ChatWebSocketHandler chatWebSocketHandler,
                           AdmissionHandshakeInterceptor admissionHandshakeInterceptor) {
        this.chatWebSocketHandler = chatWebSocketHandler;
        this.admissionHandshakeInterceptor = admissionHandshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(chatWebSocketHandler, path)
                .addInterceptors(admissionHandshakeInterceptor)
                .setAllowedOrigins(allowedOrigins); // In production, specify exact origins
    }
}
