package com.sealpost.sync;

import com.sealpost.config.DirectMessageProperties;
import com.sealpost.conversation.ConversationId;
import com.sealpost.conversation.MergeEngine;
import com.sealpost.conversation.Message;
import com.sealpost.conversation.MessagingState;
import com.sealpost.conversation.Protocol;
import com.sealpost.conversation.SyncState;
import com.sealpost.crypto.CryptoCodec;
import com.sealpost.crypto.LocalKeySigner;
import com.sealpost.event.EventFilter;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import com.sealpost.relay.FakeRelayTransport;
import com.sealpost.relay.RelayMode;
import com.sealpost.relay.RelaySetResolver;
import com.sealpost.store.CachePayload;
import com.sealpost.store.MessageStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SyncOrchestratorTest {

    private static final long NOW = 1_700_000_000L;
    private static final long EARLIER = NOW - 3_600;
    private static final String DISCOVERY = "wss://discovery.test";
    private static final String ALICE_INBOX = "wss://alice-inbox.test";
    private static final String BOB_INBOX = "wss://bob-inbox.test";

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
    private final Clock earlierClock = Clock.fixed(Instant.ofEpochSecond(EARLIER), ZoneOffset.UTC);
    private final FakeRelayTransport transport = new FakeRelayTransport();
    private final List<SyncPhase> phases = new ArrayList<>();
    private final List<SyncPhase> failedPhases = new ArrayList<>();
    private final List<RelayError> relayErrors = new ArrayList<>();

    private LocalKeySigner alice;
    private LocalKeySigner bob;
    private MessageStore store;
    private MessagingStateHolder holder;
    private MessageDecoder decoder;
    private LiveSubscriptionManager subscriptions;

    @BeforeEach
    void setup() {
        alice = LocalKeySigner.generate();
        bob = LocalKeySigner.generate();
        store = mock(MessageStore.class);
        when(store.readCache(anyString())).thenReturn(Mono.empty());
        when(store.writeCache(anyString(), any())).thenReturn(Mono.empty());

        transport.store(DISCOVERY,
                inboxList(alice, ALICE_INBOX),
                inboxList(bob, BOB_INBOX));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static NostrEvent inboxList(LocalKeySigner owner, String relay) {
        return owner.sign(NostrEvent.unsigned(owner.publicKey(), 1, EventKinds.DM_INBOX_RELAYS,
                List.of(List.of("relay", relay)), ""));
    }

    private SyncOrchestrator orchestrator(MessagingState initial) {
        holder = new MessagingStateHolder(new MergeEngine(alice.publicKey(), Duration.ofSeconds(60)), initial);
        decoder = new MessageDecoder(new CryptoCodec(alice, clock), clock, Duration.ofSeconds(5));
        DebouncedCacheWriter writer = new DebouncedCacheWriter(state -> store.writeCache(alice.publicKey(), state),
                Duration.ofSeconds(15), VirtualTimeScheduler.create());
        subscriptions = new LiveSubscriptionManager(alice.publicKey(), transport, decoder, holder, writer, clock,
                event -> { });
        RelaySetResolver resolver = new RelaySetResolver(transport, List.of(DISCOVERY), RelayMode.STRICT_OUTBOX,
                Duration.ofSeconds(5), 0.6, clock);
        SyncListener listener = new SyncListener() {
            @Override
            public void onPhase(SyncPhase phase) {
                phases.add(phase);
            }

            @Override
            public void onPhaseFailed(SyncPhase phase, Throwable error) {
                failedPhases.add(phase);
            }

            @Override
            public void onRelayError(RelayError error) {
                relayErrors.add(error);
            }
        };
        return new SyncOrchestrator(alice.publicKey(), resolver,
                new BatchedQuery(transport, 100, 1000, Duration.ofSeconds(5)), decoder, holder, store, writer,
                subscriptions, Duration.ofHours(24), clock, listener);
    }

    private String withBob() {
        return ConversationId.of(alice.publicKey(), bob.publicKey());
    }

    private List<EventFilter> filtersOfKind(int kind) {
        return transport.queries.stream()
                .flatMap(call -> call.filters().stream())
                .filter(filter -> filter.kinds().contains(kind))
                .toList();
    }

    private static MessagingState warmState(long lastCacheTime, List<String> queriedRelays) {
        return MessagingState.empty().withSyncState(new SyncState(lastCacheTime, queriedRelays, false, Map.of()));
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void coldStartQueriesMyInboxThenFillsTheGapFromCounterpartRelays() throws Exception {
        NostrEvent fromBob = new CryptoCodec(bob, earlierClock).encryptLegacy(alice.publicKey(), "hi alice");
        NostrEvent toBob = new CryptoCodec(alice, earlierClock).encryptLegacy(bob.publicKey(), "hi bob");
        transport.store(ALICE_INBOX, fromBob);
        transport.store(BOB_INBOX, toBob);

        orchestrator(MessagingState.empty()).run().block();

        MessagingState state = holder.current();
        assertEquals(List.of("hi alice", "hi bob"),
                state.messagesOf(withBob()).stream().map(Message::content).sorted().toList());
        assertEquals(NOW, state.syncState().lastCacheTime());
        assertTrue(state.syncState().queriedRelays().containsAll(List.of(ALICE_INBOX, BOB_INBOX)));
        assertEquals(List.of(SyncPhase.CACHE, SyncPhase.INITIAL_QUERY, SyncPhase.GAP_FILL, SyncPhase.SUBSCRIPTIONS,
                SyncPhase.READY), phases);
        assertTrue(failedPhases.isEmpty());
        assertEquals(List.of(ALICE_INBOX), subscriptions.inboxRelays());
        verify(store, atLeastOnce()).writeCache(eq(alice.publicKey()), any());
    }

    @Test
    void coldStartQueriesFromTheBeginning() {
        orchestrator(MessagingState.empty()).run().block();

        filtersOfKind(EventKinds.GIFT_WRAP).forEach(filter -> assertNull(filter.since()));
        filtersOfKind(EventKinds.LEGACY_DIRECT_MESSAGE).forEach(filter -> assertNull(filter.since()));
    }

    @Test
    void warmStartQueriesOnlyWhatIsNewWithOverlap() {
        long lastCacheTime = NOW - 600;

        orchestrator(warmState(lastCacheTime, List.of("wss://old.test"))).run().block();

        filtersOfKind(EventKinds.LEGACY_DIRECT_MESSAGE)
                .forEach(filter -> assertEquals(lastCacheTime - 10, filter.since()));
        filtersOfKind(EventKinds.GIFT_WRAP)
                .forEach(filter -> assertEquals(lastCacheTime - 10 - 172_800, filter.since()));
        verify(store, never()).readCache(anyString());
        assertTrue(transport.queries.stream().anyMatch(call -> call.relays().contains("wss://old.test")),
                "relays of earlier passes are queried again");
    }

    @Test
    void sinceValuesForWarmStart() {
        Map<Protocol, Long> since = orchestrator(MessagingState.empty()).sinceFor(warmState(NOW, List.of()));

        assertEquals(NOW - 10, since.get(Protocol.LEGACY));
        assertEquals(NOW - 10 - 172_800, since.get(Protocol.PRIVATE));
    }

    @Test
    void cacheRestoresMessagesBeforeQuerying() throws Exception {
        NostrEvent cached = new CryptoCodec(bob, earlierClock).encryptLegacy(alice.publicKey(), "from cache");
        CachePayload payload = new CachePayload(1, DirectMessageProperties.defaults().fingerprint(), Map.of(),
                List.of(cached), new SyncState(EARLIER, List.of(), false, Map.of()), Map.of());
        when(store.readCache(alice.publicKey())).thenReturn(Mono.just(payload));

        orchestrator(MessagingState.empty()).run().block();

        assertEquals("from cache", holder.current().messagesOf(withBob()).get(0).content());
        filtersOfKind(EventKinds.LEGACY_DIRECT_MESSAGE)
                .forEach(filter -> assertEquals(EARLIER - 10, filter.since()));
    }

    @Test
    void failedInitialQueryIsReportedAndKeepsTheCacheTime() {
        transport.fail(ALICE_INBOX);

        orchestrator(MessagingState.empty()).run().block();

        assertEquals(List.of(SyncPhase.INITIAL_QUERY), failedPhases);
        assertFalse(relayErrors.isEmpty());
        assertNull(holder.current().syncState().lastCacheTime(), "next pass is a full one");
        assertEquals(SyncPhase.READY, phases.get(phases.size() - 1), "the pass goes on");
    }

    @Test
    void unreadableCacheFallsBackToColdStart() {
        when(store.readCache(alice.publicKey())).thenReturn(Mono.error(new IllegalStateException("cassandra down")));

        orchestrator(MessagingState.empty()).run().block();

        assertEquals(List.of(SyncPhase.CACHE), failedPhases);
        filtersOfKind(EventKinds.GIFT_WRAP).forEach(filter -> assertNull(filter.since()));
    }

    @Test
    void counterpartsAreResolvedOnlyWhenUnknownOrStale() throws Exception {
        NostrEvent fromBob = new CryptoCodec(bob, earlierClock).encryptLegacy(alice.publicKey(), "hi");
        SyncOrchestrator orchestrator = orchestrator(MessagingState.empty());
        holder.propose(decoder.decodeAll(List.of(fromBob)));

        assertEquals(List.of(bob.publicKey()), List.copyOf(orchestrator.participantsToResolve(holder.current())));

        orchestrator.run().block();

        assertTrue(orchestrator.participantsToResolve(holder.current()).isEmpty());
    }

    @Test
    void undecryptableGiftWrapKeysAreNotResolved() {
        LocalKeySigner oneTime = LocalKeySigner.generate();
        NostrEvent unreadable = oneTime.sign(NostrEvent.unsigned(oneTime.publicKey(), EARLIER, EventKinds.GIFT_WRAP,
                List.of(List.of("p", alice.publicKey())), "not-an-encrypted-payload"));
        SyncOrchestrator orchestrator = orchestrator(MessagingState.empty());
        holder.propose(decoder.decodeAll(List.of(unreadable)));

        Message placeholder = holder.current().messagesOf(ConversationId.of(oneTime.publicKey())).get(0);
        assertTrue(placeholder.failedToDecrypt());
        assertTrue(orchestrator.participantsToResolve(holder.current()).isEmpty());
    }
}
