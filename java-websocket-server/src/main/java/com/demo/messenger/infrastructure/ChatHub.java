package com.demo.messenger.infrastructure;

import com.demo.messenger.domain.ChatEnvelope;
import com.demo.messenger.domain.ConversationSummary;
import com.demo.messenger.domain.Message;
import com.demo.messenger.domain.UserPresence;
import com.demo.messenger.service.MetricsService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Routing table for live connections, presence and conversation logs.
 *
 * All maps are guarded by one read/write lock: queries take the read lock, every
 * mutation takes the write lock. Register, unregister and typing go through a
 * single event-loop thread so connection churn is serialized; message routing runs
 * directly on the calling reader thread. Delivery only enqueues onto outbound
 * queues, so the lock is never held across socket I/O.
 */
@Slf4j
@Component
public class ChatHub {

    private static final String KEY_SEPARATOR = "|";

    private final EnvelopeCodec codec;
    private final MetricsService metricsService;

    private final Map<String, ClientConnection> clients = new HashMap<>();
    private final Map<String, UserPresence> users = new HashMap<>();
    private final Map<String, List<Message>> conversations = new HashMap<>();

    // Connections whose queue overflowed during the current write-locked operation
    private final Deque<ClientConnection> overflowed = new ArrayDeque<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final BlockingQueue<HubEvent> events;
    private final ExecutorService eventLoop;
    private volatile boolean running;

    public ChatHub(EnvelopeCodec codec,
                   MetricsService metricsService,
                   @Value("${chat.hub.event-queue-size:256}") int eventQueueSize) {
        this.codec = codec;
        this.metricsService = metricsService;
        this.events = new ArrayBlockingQueue<>(eventQueueSize);
        this.eventLoop = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "chat-hub-events");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void start() {
        running = true;
        eventLoop.execute(this::run);
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down ChatHub...");
        running = false;
        eventLoop.shutdownNow();
        try {
            if (!eventLoop.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Hub event loop did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        List<HubEvent> pending = new ArrayList<>();
        events.drainTo(pending);
        pending.forEach(event -> event.getCompletion()
                .completeExceptionally(new CancellationException("Hub is shut down")));
    }

    // ===== Event loop =====

    /**
     * Queues a connection for registration. Completes with {@code true} once the
     * connection is the registered one for its identity.
     */
    public CompletableFuture<Boolean> register(ClientConnection client) {
        return submit(HubEvent.register(client));
    }

    /**
     * Queues an unregister. Completes with {@code false} when the connection was
     * already replaced or removed (stale unregister).
     */
    public CompletableFuture<Boolean> unregister(ClientConnection client) {
        return submit(HubEvent.unregister(client));
    }

    /**
     * Queues a typing signal. Completes with {@code false} when the recipient is
     * offline and the signal was dropped.
     */
    public CompletableFuture<Boolean> routeTyping(String from, String to, boolean isTyping) {
        return submit(HubEvent.typing(null, from, to, isTyping));
    }

    /**
     * Typing signal from a live connection; dropped if that connection has been
     * replaced or removed.
     */
    public CompletableFuture<Boolean> routeTypingFrom(ClientConnection origin, String to, boolean isTyping) {
        return submit(HubEvent.typing(origin, origin.getUsername(), to, isTyping));
    }

    /**
     * Unregisters whatever connection is currently live for the identity.
     */
    public CompletableFuture<Boolean> disconnect(String username) {
        ClientConnection client;
        lock.readLock().lock();
        try {
            client = clients.get(username);
        } finally {
            lock.readLock().unlock();
        }
        if (client == null) {
            return CompletableFuture.completedFuture(false);
        }
        return unregister(client);
    }

    private CompletableFuture<Boolean> submit(HubEvent event) {
        if (!running) {
            event.getCompletion().completeExceptionally(new IllegalStateException("Hub is not running"));
            return event.getCompletion();
        }
        try {
            events.put(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            event.getCompletion().completeExceptionally(e);
        }
        return event.getCompletion();
    }

    private void run() {
        log.info("Hub event loop started");
        while (running) {
            HubEvent event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }

            try {
                event.getCompletion().complete(dispatch(event));
            } catch (RuntimeException e) {
                log.error("Failed to process hub event: {}", event, e);
                event.getCompletion().completeExceptionally(e);
            }
        }
        log.info("Hub event loop stopped");
    }

    private boolean dispatch(HubEvent event) {
        switch (event.getType()) {
            case REGISTER:
                return registerClient(event.getClient());
            case UNREGISTER:
                return unregisterClient(event.getClient());
            case TYPING:
                return deliverTyping(event.getClient(), event.getFrom(), event.getTo(), event.isTyping());
            default:
                throw new IllegalArgumentException("Unknown hub event type: " + event.getType());
        }
    }

    private boolean registerClient(ClientConnection client) {
        lock.writeLock().lock();
        try {
            String username = client.getUsername();

            ClientConnection previous = clients.put(username, client);
            if (previous != null && previous != client) {
                log.info("User {} already has an active connection, closing old connection {}",
                        username, previous.getId());
                previous.closeOutbound();
                metricsService.recordDisconnection(username);
            }

            UserPresence presence = users.computeIfAbsent(username,
                    name -> UserPresence.builder().username(name).build());
            presence.setOnline(true);
            presence.setLastSeen(Instant.now());
            presence.setCurrentConnection(client);
            if (previous != client) {
                metricsService.recordConnection(username);
            }

            broadcast(ChatEnvelope.status(username, true), username);

            // Tell the newcomer who is already here
            for (String other : clients.keySet()) {
                if (!other.equals(username)) {
                    deliver(client, ChatEnvelope.status(other, true));
                }
            }

            evictOverflowed();
            log.info("Client registered: username={}, connectionId={}, online={}",
                    username, client.getId(), clients.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean unregisterClient(ClientConnection client) {
        lock.writeLock().lock();
        try {
            String username = client.getUsername();
            if (clients.get(username) != client) {
                log.debug("Client {} already replaced, skipping unregister of connection {}",
                        username, client.getId());
                return false;
            }

            removeClient(client);
            evictOverflowed();
            log.info("Client unregistered: username={}, connectionId={}, online={}",
                    username, client.getId(), clients.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean deliverTyping(ClientConnection origin, String from, String to, boolean isTyping) {
        lock.writeLock().lock();
        try {
            if (origin != null && clients.get(from) != origin) {
                log.debug("Dropping typing event from replaced connection {} of {}", origin.getId(), from);
                metricsService.recordTypingSignal(true);
                return false;
            }

            ClientConnection recipient = clients.get(to);
            if (recipient == null) {
                log.debug("Recipient {} not found for typing event from {}", to, from);
                metricsService.recordTypingSignal(true);
                return false;
            }

            boolean queued = deliver(recipient, ChatEnvelope.typing(from, isTyping));
            evictOverflowed();
            metricsService.recordTypingSignal(!queued);
            return queued;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ===== Message routing =====

    /**
     * Appends a message to the pair's log and fans it out: a {@code sent} copy to the
     * sender, and if the recipient is connected a {@code delivered} copy to the
     * recipient followed by an ack to the sender.
     *
     * @return snapshot of the stored message, with its final delivery status
     */
    public Message routeMessage(String from, String to, String content) {
        requireRecipient(to);

        lock.writeLock().lock();
        try {
            return appendAndDeliver(from, to, content);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Routes a message read from a live connection. Nothing is stored or sent when
     * that connection has been replaced or removed, since its identity now belongs
     * to another connection (or to none).
     *
     * @return the routed message, or empty for a stale origin
     */
    public Optional<Message> routeMessageFrom(ClientConnection origin, String to, String content) {
        requireRecipient(to);

        lock.writeLock().lock();
        try {
            String from = origin.getUsername();
            if (clients.get(from) != origin) {
                log.debug("Dropping message from replaced connection {} of {}", origin.getId(), from);
                metricsService.incrementCounter("chat.messages.stale");
                return Optional.empty();
            }
            return Optional.of(appendAndDeliver(from, to, content));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static void requireRecipient(String to) {
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("Recipient must not be empty");
        }
    }

    // write lock held
    private Message appendAndDeliver(String from, String to, String content) {
        Message message = Message.builder()
                .id(UUID.randomUUID().toString())
                .from(from)
                .to(to)
                .content(content)
                .createdAt(Instant.now())
                .status(Message.DeliveryStatus.SENT)
                .build();

        conversations.computeIfAbsent(conversationKey(from, to), key -> new ArrayList<>())
                .add(message);

        ClientConnection sender = clients.get(from);
        ClientConnection recipient = clients.get(to);

        if (sender != null) {
            deliver(sender, ChatEnvelope.message(message, Message.DeliveryStatus.SENT));
        } else {
            log.debug("Sender {} not connected, no send confirmation for {}", from, message.getId());
        }

        if (recipient != null
                && deliver(recipient, ChatEnvelope.message(message, Message.DeliveryStatus.DELIVERED))) {
            message.setStatus(Message.DeliveryStatus.DELIVERED);
            if (sender != null) {
                deliver(sender, ChatEnvelope.ack(message.getId(), Message.DeliveryStatus.DELIVERED));
            }
        }

        evictOverflowed();

        boolean delivered = message.getStatus() == Message.DeliveryStatus.DELIVERED;
        metricsService.recordMessageRouted(delivered);
        log.debug("Routed message {}: {} -> {}, delivered={}", message.getId(), from, to, delivered);
        return message.toBuilder().build();
    }

    // ===== Queries =====

    /**
     * One entry per peer the identity has exchanged messages with, most recent first.
     */
    public List<ConversationSummary> listConversations(String username) {
        lock.readLock().lock();
        try {
            List<ConversationSummary> summaries = new ArrayList<>();
            Set<String> seenPeers = new HashSet<>();

            for (List<Message> messages : conversations.values()) {
                if (messages.isEmpty()) {
                    continue;
                }

                Message last = messages.get(messages.size() - 1);
                String peer;
                if (username.equals(last.getFrom())) {
                    peer = last.getTo();
                } else if (username.equals(last.getTo())) {
                    peer = last.getFrom();
                } else {
                    continue;
                }

                if (!seenPeers.add(peer)) {
                    continue;
                }

                UserPresence peerPresence = users.get(peer);
                summaries.add(ConversationSummary.builder()
                        .peerUsername(peer)
                        .lastMessagePreview(last.getContent())
                        .lastMessageTime(last.getCreatedAt())
                        .peerOnline(peerPresence != null && peerPresence.isOnline())
                        .build());
            }

            summaries.sort(Comparator.comparing(ConversationSummary::getLastMessageTime).reversed()
                    .thenComparing(ConversationSummary::getPeerUsername));
            return summaries;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Full log for the pair in chronological order; empty if they never talked.
     */
    public List<Message> getConversation(String username, String peer) {
        lock.readLock().lock();
        try {
            List<Message> messages = conversations.get(conversationKey(username, peer));
            if (messages == null) {
                return List.of();
            }
            return messages.stream()
                    .map(message -> message.toBuilder().build())
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Case-insensitive substring search over every identity ever seen, excluding the caller.
     */
    public List<UserPresence> searchIdentities(String query, String excludeUsername) {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);

        lock.readLock().lock();
        try {
            return users.values().stream()
                    .filter(user -> !user.getUsername().equals(excludeUsername))
                    .filter(user -> needle.isEmpty()
                            || user.getUsername().toLowerCase(Locale.ROOT).contains(needle))
                    .map(UserPresence::snapshot)
                    .sorted(Comparator.comparing(UserPresence::getUsername))
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(String username) {
        lock.readLock().lock();
        try {
            return clients.containsKey(username);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isOnline(String username) {
        lock.readLock().lock();
        try {
            UserPresence presence = users.get(username);
            return presence != null && presence.isOnline();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int activeConnectionCount() {
        lock.readLock().lock();
        try {
            return clients.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int knownIdentityCount() {
        lock.readLock().lock();
        try {
            return users.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public static String conversationKey(String a, String b) {
        return a.compareTo(b) <= 0 ? a + KEY_SEPARATOR + b : b + KEY_SEPARATOR + a;
    }

    // ===== Delivery (write lock held) =====

    private void broadcast(ChatEnvelope envelope, String excludeUsername) {
        String frame = codec.encode(envelope);
        for (Map.Entry<String, ClientConnection> entry : clients.entrySet()) {
            if (!entry.getKey().equals(excludeUsername)) {
                deliverFrame(entry.getValue(), frame, envelope);
            }
        }
    }

    private boolean deliver(ClientConnection client, ChatEnvelope envelope) {
        return deliverFrame(client, codec.encode(envelope), envelope);
    }

    private boolean deliverFrame(ClientConnection client, String frame, ChatEnvelope envelope) {
        switch (client.getOutbound().offer(frame)) {
            case QUEUED:
                log.debug("Message queued for client {}, type: {}", client.getUsername(), envelope.getType());
                return true;
            case FULL:
                log.warn("Client {} send queue full, closing connection {}", client.getUsername(), client.getId());
                client.closeOutbound();
                overflowed.addLast(client);
                return false;
            case CLOSED:
            default:
                log.debug("Dropping {} for client {}, send queue closed", envelope.getType(), client.getUsername());
                return false;
        }
    }

    /**
     * Removes every connection that overflowed during this operation. Removal broadcasts
     * an offline status, which can overflow further queues; those are picked up by the
     * same loop.
     */
    private void evictOverflowed() {
        while (!overflowed.isEmpty()) {
            ClientConnection client = overflowed.pollFirst();
            if (clients.get(client.getUsername()) != client) {
                continue;
            }
            removeClient(client);
            metricsService.recordBackpressureEviction(client.getUsername());
        }
    }

    private void removeClient(ClientConnection client) {
        String username = client.getUsername();
        clients.remove(username);

        UserPresence presence = users.get(username);
        if (presence != null) {
            presence.setOnline(false);
            presence.setCurrentConnection(null);
            presence.setLastSeen(Instant.now());
        }

        client.closeOutbound();
        metricsService.recordDisconnection(username);
        broadcast(ChatEnvelope.status(username, false), username);
    }
}
