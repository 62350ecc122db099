package com.demo.messenger.infrastructure;

import com.demo.messenger.domain.ConversationSummary;
import com.demo.messenger.domain.Message;
import com.demo.messenger.domain.UserPresence;
import com.demo.messenger.service.MetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.demo.messenger.infrastructure.TestSupport.isStatus;
import static com.demo.messenger.infrastructure.TestSupport.isType;
import static com.demo.messenger.infrastructure.TestSupport.parse;
import static org.junit.jupiter.api.Assertions.*;

class ChatHubTest {

    private EnvelopeCodec codec;
    private MetricsService metricsService;
    private ChatHub hub;

    @BeforeEach
    void setUp() {
        codec = new EnvelopeCodec(TestSupport.MAPPER);
        metricsService = new MetricsService(new SimpleMeterRegistry());
        hub = new ChatHub(codec, metricsService, 64);
        hub.start();
    }

    @AfterEach
    void tearDown() {
        hub.shutdown();
    }

    private ClientConnection client(String username) {
        return client(username, ConnectionSettings.defaults());
    }

    private ClientConnection client(String username, ConnectionSettings settings) {
        return new ClientConnection(username, new InMemoryFrameSocket(username + "-socket"),
                hub, codec, metricsService, settings);
    }

    private ClientConnection connect(String username) throws Exception {
        ClientConnection client = client(username);
        assertTrue(hub.register(client).get(1, TimeUnit.SECONDS));
        return client;
    }

    @Test
    void registerAnnouncesPresenceBothWays() throws Exception {
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");

        List<String> aliceFrames = alice.getOutbound().drain();
        assertEquals(1, aliceFrames.size());
        assertTrue(isStatus(aliceFrames.get(0), "bob", true));

        // newcomer learns the current online set
        List<String> bobFrames = bob.getOutbound().drain();
        assertEquals(1, bobFrames.size());
        assertTrue(isStatus(bobFrames.get(0), "alice", true));

        assertTrue(hub.isOnline("alice"));
        assertTrue(hub.isRegistered("bob"));
        assertEquals(2, hub.activeConnectionCount());
        assertEquals(2, metricsService.getActiveConnections());
    }

    @Test
    void messageToOnlineRecipientIsDeliveredAndAcked() throws Exception {
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        alice.getOutbound().drain();
        bob.getOutbound().drain();

        Message routed = hub.routeMessage("alice", "bob", "hi bob");

        assertEquals(Message.DeliveryStatus.DELIVERED, routed.getStatus());
        assertNotNull(routed.getId());
        assertNotNull(routed.getCreatedAt());

        List<String> aliceFrames = alice.getOutbound().drain();
        assertEquals(2, aliceFrames.size());
        JsonNode confirmation = parse(aliceFrames.get(0));
        assertEquals("message", confirmation.path("type").asText());
        assertEquals("sent", confirmation.path("payload").path("status").asText());
        assertEquals(routed.getId(), confirmation.path("payload").path("id").asText());
        JsonNode ack = parse(aliceFrames.get(1));
        assertEquals("ack", ack.path("type").asText());
        assertEquals(routed.getId(), ack.path("payload").path("messageId").asText());
        assertEquals("delivered", ack.path("payload").path("status").asText());

        List<String> bobFrames = bob.getOutbound().drain();
        assertEquals(1, bobFrames.size());
        JsonNode delivered = parse(bobFrames.get(0)).path("payload");
        assertEquals("alice", delivered.path("from").asText());
        assertEquals("hi bob", delivered.path("content").asText());
        assertEquals("delivered", delivered.path("status").asText());

        List<Message> history = hub.getConversation("bob", "alice");
        assertEquals(1, history.size());
        assertEquals(Message.DeliveryStatus.DELIVERED, history.get(0).getStatus());
        assertEquals(1, metricsService.getCounterValue("chat.messages.routed"));
    }

    @Test
    void messageToOfflineRecipientStaysSentWithoutAck() throws Exception {
        ClientConnection alice = connect("alice");

        Message routed = hub.routeMessage("alice", "carol", "are you there?");

        assertEquals(Message.DeliveryStatus.SENT, routed.getStatus());
        List<String> aliceFrames = alice.getOutbound().drain();
        assertEquals(1, aliceFrames.size());
        assertEquals("sent", parse(aliceFrames.get(0)).path("payload").path("status").asText());

        List<Message> history = hub.getConversation("alice", "carol");
        assertEquals(1, history.size());
        assertEquals(Message.DeliveryStatus.SENT, history.get(0).getStatus());

        // routing alone does not create a presence record
        assertTrue(hub.searchIdentities("carol", "alice").isEmpty());
        assertFalse(hub.isOnline("carol"));
    }

    @Test
    void returnedMessageIsASnapshot() throws Exception {
        connect("alice");

        Message routed = hub.routeMessage("alice", "bob", "as sent");
        routed.setContent("tampered");

        assertEquals("as sent", hub.getConversation("alice", "bob").get(0).getContent());
    }

    @Test
    void routeMessageRejectsBlankRecipient() {
        assertThrows(IllegalArgumentException.class, () -> hub.routeMessage("alice", " ", "x"));
        assertThrows(IllegalArgumentException.class, () -> hub.routeMessage("alice", null, "x"));
    }

    @Test
    void conversationIsSharedBetweenBothParticipants() throws Exception {
        connect("alice");
        connect("bob");

        hub.routeMessage("alice", "bob", "one");
        hub.routeMessage("bob", "alice", "two");
        hub.routeMessage("alice", "bob", "three");

        assertEquals(ChatHub.conversationKey("alice", "bob"), ChatHub.conversationKey("bob", "alice"));
        List<String> fromAlice = hub.getConversation("alice", "bob").stream()
                .map(Message::getContent).collect(Collectors.toList());
        List<String> fromBob = hub.getConversation("bob", "alice").stream()
                .map(Message::getContent).collect(Collectors.toList());
        assertEquals(List.of("one", "two", "three"), fromAlice);
        assertEquals(fromAlice, fromBob);
    }

    @Test
    void getConversationIsEmptyForStrangers() {
        assertTrue(hub.getConversation("alice", "zed").isEmpty());
    }

    @Test
    void listConversationsIsNewestFirstWithOneEntryPerPeer() throws Exception {
        connect("alice");
        connect("bob");

        hub.routeMessage("alice", "bob", "first to bob");
        Thread.sleep(5);
        hub.routeMessage("alice", "carol", "hello carol");
        Thread.sleep(5);
        hub.routeMessage("bob", "alice", "latest from bob");

        List<ConversationSummary> summaries = hub.listConversations("alice");

        assertEquals(2, summaries.size());
        assertEquals("bob", summaries.get(0).getPeerUsername());
        assertEquals("latest from bob", summaries.get(0).getLastMessagePreview());
        assertTrue(summaries.get(0).isPeerOnline());
        assertEquals("carol", summaries.get(1).getPeerUsername());
        assertFalse(summaries.get(1).isPeerOnline());
        assertFalse(summaries.get(0).getLastMessageTime().isBefore(summaries.get(1).getLastMessageTime()));

        assertEquals(1, hub.listConversations("carol").size());
        assertTrue(hub.listConversations("dave").isEmpty());
    }

    @Test
    void secondRegistrationEvictsFirstConnection() throws Exception {
        ClientConnection first = connect("alice");
        ClientConnection second = connect("alice");

        assertTrue(first.getOutbound().isClosed());
        assertFalse(second.getOutbound().isClosed());
        assertEquals(1, hub.activeConnectionCount());
        assertEquals(1, metricsService.getActiveConnections());

        // the evicted connection's own unregister must not take the new one down
        assertFalse(hub.unregister(first).get(1, TimeUnit.SECONDS));
        assertTrue(hub.isRegistered("alice"));
        assertTrue(hub.isOnline("alice"));

        List<UserPresence> found = hub.searchIdentities("ali", "bob");
        assertEquals(1, found.size());
        assertTrue(found.get(0).isOnline());
    }

    @Test
    void evictedConnectionCannotSpeakForItsIdentity() throws Exception {
        ClientConnection first = connect("alice");
        ClientConnection bob = connect("bob");
        ClientConnection second = connect("alice");
        bob.getOutbound().drain();
        second.getOutbound().drain();

        assertTrue(hub.routeMessageFrom(first, "bob", "stale").isEmpty());
        assertFalse(hub.routeTypingFrom(first, "bob", true).get(1, TimeUnit.SECONDS));

        assertTrue(bob.getOutbound().drain().isEmpty());
        assertTrue(second.getOutbound().drain().isEmpty());
        assertTrue(hub.getConversation("alice", "bob").isEmpty());
        assertEquals(1, metricsService.getCounterValue("chat.messages.stale"));

        // the live connection still routes normally
        Message routed = hub.routeMessageFrom(second, "bob", "fresh").orElseThrow();
        assertEquals(Message.DeliveryStatus.DELIVERED, routed.getStatus());
        assertTrue(hub.routeTypingFrom(second, "bob", false).get(1, TimeUnit.SECONDS));
    }

    @Test
    void unregisterMarksOfflineAndBroadcasts() throws Exception {
        ClientConnection alice = connect("alice");
        ClientConnection bob = connect("bob");
        bob.getOutbound().drain();

        assertTrue(hub.unregister(alice).get(1, TimeUnit.SECONDS));

        assertTrue(alice.getOutbound().isClosed());
        assertFalse(hub.isRegistered("alice"));
        assertFalse(hub.isOnline("alice"));
        List<String> bobFrames = bob.getOutbound().drain();
        assertEquals(1, bobFrames.size());
        assertTrue(isStatus(bobFrames.get(0), "alice", false));

        List<UserPresence> found = hub.searchIdentities("ali", "bob");
        assertEquals(1, found.size());
        assertFalse(found.get(0).isOnline());
        assertNotNull(found.get(0).getLastSeen());
        assertNull(found.get(0).getCurrentConnection());
    }

    @Test
    void disconnectUnknownIdentityIsNoop() throws Exception {
        assertFalse(hub.disconnect("ghost").get(1, TimeUnit.SECONDS));
    }

    @Test
    void disconnectRemovesLiveConnection() throws Exception {
        ClientConnection alice = connect("alice");

        assertTrue(hub.disconnect("alice").get(1, TimeUnit.SECONDS));
        assertTrue(alice.getOutbound().isClosed());
        assertFalse(hub.isRegistered("alice"));
    }

    @Test
    void typingReachesOnlineRecipientOnly() throws Exception {
        connect("alice");
        ClientConnection bob = connect("bob");
        bob.getOutbound().drain();

        assertTrue(hub.routeTyping("alice", "bob", true).get(1, TimeUnit.SECONDS));
        assertFalse(hub.routeTyping("alice", "carol", true).get(1, TimeUnit.SECONDS));

        List<String> bobFrames = bob.getOutbound().drain();
        assertEquals(1, bobFrames.size());
        JsonNode typing = parse(bobFrames.get(0));
        assertEquals("typing", typing.path("type").asText());
        assertEquals("alice", typing.path("payload").path("from").asText());
        assertTrue(typing.path("payload").path("isTyping").asBoolean());

        // typing is never stored
        assertTrue(hub.getConversation("alice", "bob").isEmpty());
    }

    @Test
    void overflowingRecipientIsEvictedAndMessageStaysSent() throws Exception {
        ConnectionSettings tiny = ConnectionSettings.builder().sendBufferSize(2).build();
        ClientConnection bob = client("bob", tiny);
        assertTrue(hub.register(bob).get(1, TimeUnit.SECONDS));
        ClientConnection alice = connect("alice");

        // bob's queue now holds alice's online status
        assertEquals(Message.DeliveryStatus.DELIVERED, hub.routeMessage("alice", "bob", "fills the queue").getStatus());
        Message overflowed = hub.routeMessage("alice", "bob", "one too many");

        assertEquals(Message.DeliveryStatus.SENT, overflowed.getStatus());
        assertTrue(bob.getOutbound().isClosed());
        assertFalse(hub.isRegistered("bob"));
        assertFalse(hub.isOnline("bob"));
        assertEquals(1, metricsService.getCounterValue("chat.backpressure.evictions"));

        List<String> aliceFrames = alice.getOutbound().drain();
        assertTrue(aliceFrames.stream().anyMatch(frame -> isStatus(frame, "bob", false)));
        long acks = aliceFrames.stream().filter(frame -> isType(frame, "ack")).count();
        assertEquals(1, acks);
    }

    @Test
    void searchIsCaseInsensitiveSortedAndExcludesCaller() throws Exception {
        connect("Bobby");
        connect("alice");
        connect("bob");
        connect("carol");

        List<String> names = hub.searchIdentities("BOB", "alice").stream()
                .map(UserPresence::getUsername).collect(Collectors.toList());
        assertEquals(List.of("Bobby", "bob"), names);

        List<String> everyoneButBob = hub.searchIdentities("", "bob").stream()
                .map(UserPresence::getUsername).collect(Collectors.toList());
        assertEquals(List.of("Bobby", "alice", "carol"), everyoneButBob);
        assertEquals(4, hub.knownIdentityCount());
    }

    @Test
    void eventsAfterShutdownFail() {
        hub.shutdown();

        ExecutionException failure = assertThrows(ExecutionException.class,
                () -> hub.register(client("late")).get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, failure.getCause());
    }
}
