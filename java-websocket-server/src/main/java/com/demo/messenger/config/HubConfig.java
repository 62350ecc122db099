package com.demo.messenger.config;

import com.demo.messenger.infrastructure.ConnectionSettings;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class HubConfig {

    @Bean
    public ConnectionSettings connectionSettings(
            @Value("${chat.websocket.pong-wait:60s}") Duration pongWait,
            @Value("${chat.websocket.ping-period:54s}") Duration pingPeriod,
            @Value("${chat.websocket.write-wait:10s}") Duration writeWait,
            @Value("${chat.websocket.max-message-size:524288}") int maxMessageSize,
            @Value("${chat.websocket.send-buffer-size:256}") int sendBufferSize,
            @Value("${chat.websocket.inbound-buffer-size:256}") int inboundBufferSize) {

        if (pingPeriod.compareTo(pongWait) >= 0) {
            throw new IllegalStateException(
                    "chat.websocket.ping-period (" + pingPeriod + ") must be shorter than pong-wait (" + pongWait + ")");
        }

        ConnectionSettings settings = ConnectionSettings.builder()
                .pongWait(pongWait)
                .pingPeriod(pingPeriod)
                .writeWait(writeWait)
                .maxMessageSize(maxMessageSize)
                .sendBufferSize(sendBufferSize)
                .inboundBufferSize(inboundBufferSize)
                .build();
        log.info("Connection settings: {}", settings);
        return settings;
    }

    /**
     * One reader and one writer thread per live connection.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pumpExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("pump-"));
    }

    /**
     * Runs @Scheduled housekeeping. Named so it wins over the WebSocket support's scheduler.
     */
    @Bean(name = "taskScheduler")
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("chat-housekeeping-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    /**
     * ObjectMapper for envelopes and the HTTP API, with Java 8 time support
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
