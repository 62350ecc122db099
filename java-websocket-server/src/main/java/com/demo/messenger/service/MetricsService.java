package com.demo.messenger.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chat metrics on top of Micrometer.
 *
 * Counters:
 * - chat.connections / chat.disconnections
 * - chat.messages.routed{delivered=true|false}
 * - chat.typing.signals{dropped=true|false}
 * - chat.envelopes.malformed
 * - chat.backpressure.evictions
 * - chat.admission.rejected{reason}
 *
 * Gauge: chat.connections.active
 */
@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry registry;
    private final AtomicInteger activeConnections = new AtomicInteger();

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
        registry.gauge("chat.connections.active", activeConnections);
        log.info("MetricsService initialized: registry={}", registry.getClass().getSimpleName());
    }

    // ===== Counter Metrics =====

    public void incrementCounter(String name) {
        incrementCounter(name, Tags.empty());
    }

    public void incrementCounter(String name, Tags tags) {
        Counter counter = registry.counter(name, tags);
        counter.increment();
        log.debug("[METRIC] Counter: {}{} = {}", name, tags, (long) counter.count());
    }

    // ===== Business Metrics =====

    public void recordConnection(String username) {
        incrementCounter("chat.connections");
        int active = activeConnections.incrementAndGet();
        log.debug("[METRIC] Gauge: chat.connections.active = {} (connected {})", active, username);
    }

    public void recordDisconnection(String username) {
        incrementCounter("chat.disconnections");
        int active = activeConnections.decrementAndGet();
        log.debug("[METRIC] Gauge: chat.connections.active = {} (disconnected {})", active, username);
    }

    public void recordMessageRouted(boolean delivered) {
        incrementCounter("chat.messages.routed", Tags.of("delivered", Boolean.toString(delivered)));
    }

    public void recordTypingSignal(boolean dropped) {
        incrementCounter("chat.typing.signals", Tags.of("dropped", Boolean.toString(dropped)));
    }

    public void recordMalformedEnvelope(String username) {
        incrementCounter("chat.envelopes.malformed");
        log.debug("Malformed envelope counted for {}", username);
    }

    public void recordBackpressureEviction(String username) {
        incrementCounter("chat.backpressure.evictions");
        log.warn("Backpressure eviction: username={}", username);
    }

    public void recordAdmissionRejected(String reason) {
        incrementCounter("chat.admission.rejected", Tags.of("reason", reason));
    }

    // ===== Utility Methods =====

    /**
     * Current counter value summed over all tag combinations.
     */
    public long getCounterValue(String name) {
        return (long) registry.find(name).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }
}
