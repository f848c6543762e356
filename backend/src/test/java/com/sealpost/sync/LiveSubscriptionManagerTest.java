package com.sealpost.sync;

import com.sealpost.conversation.ConversationId;
import com.sealpost.conversation.MergeEngine;
import com.sealpost.conversation.MessagingState;
import com.sealpost.conversation.Protocol;
import com.sealpost.conversation.SyncState;
import com.sealpost.crypto.CryptoCodec;
import com.sealpost.crypto.LocalKeySigner;
import com.sealpost.event.EventFilter;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import com.sealpost.relay.FakeRelayTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class LiveSubscriptionManagerTest {

    private static final long NOW = 1_700_000_000L;
    private static final List<String> INBOX = List.of("wss://inbox.test");
    private static final List<String> DISCOVERY = List.of("wss://discovery.test");

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
    private final FakeRelayTransport transport = new FakeRelayTransport();
    private final List<MessagingState> written = new CopyOnWriteArrayList<>();
    private final List<NostrEvent> routingDocuments = new CopyOnWriteArrayList<>();

    private LocalKeySigner alice;
    private LocalKeySigner bob;
    private MessagingStateHolder holder;
    private LiveSubscriptionManager manager;

    @BeforeEach
    void setup() {
        alice = LocalKeySigner.generate();
        bob = LocalKeySigner.generate();
        init(MessagingState.empty());
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void init(MessagingState initial) {
        holder = new MessagingStateHolder(new MergeEngine(alice.publicKey(), Duration.ofSeconds(60)), initial);
        DebouncedCacheWriter writer = new DebouncedCacheWriter(state -> Mono.fromRunnable(() -> written.add(state)),
                Duration.ofSeconds(15), VirtualTimeScheduler.create());
        MessageDecoder decoder = new MessageDecoder(new CryptoCodec(alice, clock), clock, Duration.ofSeconds(5));
        manager = new LiveSubscriptionManager(alice.publicKey(), transport, decoder, holder, writer, clock,
                routingDocuments::add);
    }

    private EventFilter filterOfKind(int kind) {
        return transport.subscriptions.stream()
                .flatMap(subscription -> subscription.filters().stream())
                .filter(filter -> filter.kinds().contains(kind))
                .findFirst()
                .orElseThrow();
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void subscribesPerProtocolAndWatchesMyRoutingDocuments() {
        assertTrue(manager.start(INBOX, DISCOVERY));

        assertEquals(3, transport.activeSubscriptions().size());
        assertEquals(NOW - 10, filterOfKind(EventKinds.LEGACY_DIRECT_MESSAGE).since());
        assertEquals(NOW - 10 - 172_800, filterOfKind(EventKinds.GIFT_WRAP).since());
        EventFilter routing = filterOfKind(EventKinds.DM_INBOX_RELAYS);
        assertEquals(List.of(alice.publicKey()), routing.authors());
        assertEquals(NOW, routing.since());
        assertEquals(3, manager.activeSubscriptions().size());
    }

    @Test
    void subscriptionsResumeFromTheCursor() {
        init(MessagingState.empty().withSyncState(new SyncState(NOW - 500, List.of(), false,
                Map.of(Protocol.LEGACY, NOW - 100))));

        manager.start(INBOX, DISCOVERY);

        assertEquals(NOW - 110, filterOfKind(EventKinds.LEGACY_DIRECT_MESSAGE).since());
        assertEquals(NOW - 510 - 172_800, filterOfKind(EventKinds.GIFT_WRAP).since());
    }

    @Test
    void sameRelaySetsDoNotResubscribe() {
        manager.start(INBOX, DISCOVERY);

        assertFalse(manager.start(INBOX, DISCOVERY));
        assertEquals(3, transport.subscriptions.size());

        assertTrue(manager.start(List.of("wss://other.test"), DISCOVERY));
        assertEquals(3, transport.activeSubscriptions().size(), "old subscriptions were closed");
        assertEquals(List.of("wss://other.test"), manager.inboxRelays());
    }

    @Test
    void liveMessageIsMergedAdvancesTheCursorAndIsCached() throws Exception {
        manager.start(INBOX, DISCOVERY);
        NostrEvent event = new CryptoCodec(bob, clock).encryptLegacy(alice.publicKey(), "live");

        transport.deliver(event);

        MessagingState state = holder.current();
        assertEquals("live", state.messagesOf(ConversationId.of(alice.publicKey(), bob.publicKey())).get(0).content());
        assertEquals(NOW, state.syncState().cursors().get(Protocol.LEGACY));
        assertNull(state.syncState().cursors().get(Protocol.PRIVATE));
        assertEquals(1, written.size(), "new messages are written right away");
    }

    @Test
    void liveGiftWrapIsMerged() throws Exception {
        manager.start(INBOX, DISCOVERY);
        NostrEvent wrap = new CryptoCodec(bob, clock)
                .wrapPrivate(List.of(alice.publicKey()), "sealed", EventKinds.PRIVATE_MESSAGE, List.of())
                .wraps().get(0).giftWrap();

        transport.deliver(wrap);

        assertEquals("sealed", holder.current()
                .messagesOf(ConversationId.of(alice.publicKey(), bob.publicKey())).get(0).content());
        assertEquals(wrap.createdAt(), holder.current().syncState().cursors().get(Protocol.PRIVATE));
    }

    @Test
    void eventsThatAreNotMessagesLeaveTheCursorAlone() {
        NostrEvent note = bob.sign(NostrEvent.unsigned(bob.publicKey(), NOW, 1, List.of(), "hello"));

        assertFalse(manager.process(Protocol.LEGACY, note));
        assertTrue(holder.current().syncState().cursors().isEmpty());
        assertTrue(written.isEmpty());
    }

    @Test
    void myRoutingDocumentsAreHandedOn() {
        manager.start(INBOX, DISCOVERY);
        NostrEvent list = alice.sign(NostrEvent.unsigned(alice.publicKey(), NOW + 1, EventKinds.DM_INBOX_RELAYS,
                List.of(List.of("relay", "wss://new.test")), ""));

        transport.deliver(list);

        assertEquals(List.of(list), routingDocuments);
    }

    @Test
    void stopClosesEverything() {
        manager.start(INBOX, DISCOVERY);

        manager.stop();

        assertTrue(transport.activeSubscriptions().isEmpty());
        assertTrue(manager.activeSubscriptions().isEmpty());
    }
}
