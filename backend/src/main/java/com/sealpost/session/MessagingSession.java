package com.sealpost.session;

import com.sealpost.config.DirectMessageProperties;
import com.sealpost.conversation.Conversation;
import com.sealpost.conversation.MergeEngine;
import com.sealpost.conversation.Message;
import com.sealpost.conversation.MessagingState;
import com.sealpost.conversation.Protocol;
import com.sealpost.crypto.CryptoCodec;
import com.sealpost.crypto.Signer;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import com.sealpost.relay.PublishReport;
import com.sealpost.relay.RelayPurpose;
import com.sealpost.relay.RelayRouter;
import com.sealpost.relay.RelaySetResolver;
import com.sealpost.relay.RelayTransport;
import com.sealpost.relay.RelayUrls;
import com.sealpost.relay.ResolverSnapshot;
import com.sealpost.store.MessageStore;
import com.sealpost.sync.BatchedQuery;
import com.sealpost.sync.DebouncedCacheWriter;
import com.sealpost.sync.LiveSubscriptionManager;
import com.sealpost.sync.MessageDecoder;
import com.sealpost.sync.MessagingStateHolder;
import com.sealpost.sync.RelayError;
import com.sealpost.sync.ScanProgress;
import com.sealpost.sync.SyncListener;
import com.sealpost.sync.SyncOrchestrator;
import com.sealpost.sync.SyncPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything that belongs to one logged-in user: the state holder, the sync pass, live
 * subscriptions, the cache writer and the sender. {@link #close()} stops all of it.
 */
public class MessagingSession implements SyncListener {

    private static final Logger log = LoggerFactory.getLogger(MessagingSession.class);

    private static final int MAX_NOTICES = 20;

    private final String localPubkey;
    private final Signer signer;
    private final RelayTransport transport;
    private final RelaySetResolver resolver;
    private final MessageStore store;
    private final Clock clock;
    private final MessagingStateHolder holder;
    private final DebouncedCacheWriter cacheWriter;
    private final LiveSubscriptionManager subscriptions;
    private final SyncOrchestrator orchestrator;
    private final MessageSender sender;
    private final Sinks.Many<MessagingSnapshot> snapshots = Sinks.many().replay().latest();

    // Status fields are guarded by statusLock, lifecycle fields by this. Nothing is called out
    // to while statusLock is held. Lock order is emitLock then statusLock.
    private final Object statusLock = new Object();
    private final Object emitLock = new Object();
    private SyncPhase phase = SyncPhase.IDLE;
    private final Set<SyncPhase> failedPhases = EnumSet.noneOf(SyncPhase.class);
    private final Map<Protocol, ScanProgress> progress = new EnumMap<>(Protocol.class);
    private final Deque<String> notices = new ArrayDeque<>();
    private RelayError relayError;
    private Disposable syncRun;
    private Disposable stateFeed;
    private volatile boolean closed;

    public MessagingSession(Signer signer, RelayTransport transport, RelaySetResolver resolver, MessageStore store,
                            DirectMessageProperties properties, Scheduler cacheWriteScheduler, Clock clock) {
        this.localPubkey = signer.publicKey();
        this.signer = signer;
        this.transport = transport;
        this.resolver = resolver;
        this.store = store;
        this.clock = clock;

        CryptoCodec codec = new CryptoCodec(signer, clock);
        MessageDecoder decoder = new MessageDecoder(codec, clock, properties.recentMessageThreshold());
        this.holder = new MessagingStateHolder(new MergeEngine(localPubkey, properties.reconcileTolerance()),
                MessagingState.empty());
        this.cacheWriter = new DebouncedCacheWriter(state -> store.writeCache(localPubkey, state),
                properties.cacheWriteDelay(), cacheWriteScheduler);
        this.subscriptions = new LiveSubscriptionManager(localPubkey, transport, decoder, holder, cacheWriter, clock,
                this::onRoutingDocument);
        this.orchestrator = new SyncOrchestrator(localPubkey, resolver,
                new BatchedQuery(transport, properties.batchSize(), properties.queryLimit(), properties.queryTimeout()),
                decoder, holder, store, cacheWriter, subscriptions, properties.relayTtl(), clock, this);
        this.sender = new MessageSender(codec, transport, resolver, decoder, holder, clock);
    }

    public String localPubkey() {
        return localPubkey;
    }

    /** Starts a sync pass unless one is running. Also used to retry after a relay error. */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Session is closed");
        }
        if (stateFeed == null) {
            stateFeed = holder.states().subscribe(state -> emitSnapshot());
        }
        if (syncRun != null && !syncRun.isDisposed()) {
            log.debug("Sync pass already running");
            return;
        }
        synchronized (statusLock) {
            failedPhases.clear();
            progress.clear();
        }
        syncRun = orchestrator.run()
                .subscribe(
                        unused -> { },
                        error -> {
                            log.error("Sync pass aborted: {}", error.getMessage(), error);
                            onPhaseFailed(currentPhase(), error);
                        });
    }

    public synchronized boolean isSyncing() {
        return syncRun != null && !syncRun.isDisposed();
    }

    public MessagingSnapshot snapshot() {
        MessagingState state = holder.current();
        List<Conversation> conversations = new ArrayList<>(state.conversations().values());
        conversations.sort(Comparator.comparingLong(Conversation::lastActivity).reversed());
        Map<String, List<Message>> messages = new LinkedHashMap<>();
        conversations.forEach(conversation -> messages.put(conversation.id(), state.messagesOf(conversation.id())));
        List<String> active = subscriptions.activeSubscriptions();
        synchronized (statusLock) {
            return new MessagingSnapshot(localPubkey, conversations, messages, phase, Set.copyOf(failedPhases),
                    state.relayHealth(), List.copyOf(progress.values()), relayError, List.copyOf(notices),
                    active, state.syncState().lastCacheTime());
        }
    }

    public Flux<MessagingSnapshot> snapshots() {
        return snapshots.asFlux();
    }

    public List<Message> messages(String conversationId) {
        return holder.current().messagesOf(conversationId);
    }

    public Mono<SendReceipt> sendMessage(SendMessageRequest request) {
        return sender.send(request)
                .doOnSuccess(receipt -> cacheWriter.submit(holder.current(), true));
    }

    /**
     * Drops the cache and all in-memory state, then runs a cold start.
     */
    public Mono<Void> clearCacheAndRefetch() {
        return Mono.fromRunnable(() -> {
                    synchronized (this) {
                        if (syncRun != null) {
                            syncRun.dispose();
                            syncRun = null;
                        }
                        subscriptions.stop();
                        cacheWriter.discardPending();
                    }
                })
                .then(store.deleteCache(localPubkey))
                .then(Mono.fromRunnable(() -> {
                    synchronized (statusLock) {
                        relayError = null;
                        notices.clear();
                        phase = SyncPhase.IDLE;
                    }
                    holder.replace(MessagingState.empty());
                    log.info("Cache cleared, refetching from relays");
                    start();
                }));
    }

    public void dismissRelayError() {
        synchronized (statusLock) {
            relayError = null;
        }
        emitSnapshot();
    }

    /**
     * Signs and publishes one of the user's routing documents, then re-resolves the user's own
     * relays so the new list takes effect.
     */
    public Mono<PublishReport> publishRelayList(int kind, List<String> relays) {
        return Mono.defer(() -> {
            if (!EventKinds.isRoutingDocument(kind)) {
                throw new IllegalArgumentException("Not a relay list kind: " + kind);
            }
            if (relays.stream().anyMatch(url -> !RelayUrls.isValid(url))) {
                throw new IllegalArgumentException("Relay URLs must be ws:// or wss:// URLs");
            }
            String tagName = kind == EventKinds.DM_INBOX_RELAYS ? "relay" : "r";
            List<List<String>> tags = RelayUrls.clean(relays).stream().map(url -> List.of(tagName, url)).toList();
            NostrEvent event = signer.sign(NostrEvent.unsigned(localPubkey, clock.instant().getEpochSecond(), kind,
                    tags, ""));

            return resolver.resolve(localPubkey, RelayPurpose.WRITE)
                    .flatMap(outbox -> {
                        ResolverSnapshot snapshot = ResolverSnapshot.of(localPubkey, resolver.discoveryRelays(),
                                outbox.relays(), holder.current().participants());
                        return transport.publish(RelayRouter.routeEvent(event, snapshot), event);
                    })
                    .flatMap(report -> {
                        if (!report.delivered()) {
                            return Mono.error(new PublishFailedException("No relay accepted the relay list",
                                    report.rejected()));
                        }
                        log.info("Published relay list kind {} to {} relays", kind, report.accepted().size());
                        return refreshOwnRelays().thenReturn(report);
                    });
        });
    }

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (syncRun != null) {
            syncRun.dispose();
        }
        subscriptions.stop();
        cacheWriter.cancel();
        if (stateFeed != null) {
            stateFeed.dispose();
        }
        holder.complete();
        snapshots.tryEmitComplete();
        log.info("Closed messaging session for {}", localPubkey);
    }

    // ── Sync listener ─────────────────────────────────────────────────────────

    @Override
    public void onPhase(SyncPhase next) {
        synchronized (statusLock) {
            phase = next;
        }
        log.info("Sync phase {}", next);
        emitSnapshot();
    }

    @Override
    public void onPhaseFailed(SyncPhase failed, Throwable error) {
        synchronized (statusLock) {
            failedPhases.add(failed);
            phase = SyncPhase.ERROR;
        }
        emitSnapshot();
    }

    @Override
    public void onProgress(ScanProgress scan) {
        synchronized (statusLock) {
            progress.put(scan.protocol(), scan);
        }
        emitSnapshot();
    }

    @Override
    public void onRelayError(RelayError error) {
        synchronized (statusLock) {
            relayError = error;
        }
        emitSnapshot();
    }

    @Override
    public void onNotice(String notice) {
        synchronized (statusLock) {
            notices.addLast(notice);
            while (notices.size() > MAX_NOTICES) {
                notices.removeFirst();
            }
        }
        emitSnapshot();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void onRoutingDocument(NostrEvent event) {
        log.info("Routing document kind {} changed, re-resolving own relays", event.kind());
        refreshOwnRelays()
                .subscribe(
                        unused -> { },
                        error -> log.warn("Could not re-resolve own relays: {}", error.getMessage()));
    }

    /** Re-resolves the local user's relays. A changed inbox set restarts subscriptions and runs a warm pass. */
    Mono<Void> refreshOwnRelays() {
        return resolver.resolveParticipants(List.of(localPubkey))
                .doOnNext(lookup -> {
                    lookup.degraded().forEach(degraded -> onNotice(degraded.describe()));
                    MessagingState state = holder.update(current ->
                            MergeEngine.mergeParticipants(current, lookup.participants()));
                    if (subscriptions.start(orchestrator.inboxRelays(state), resolver.discoveryRelays())) {
                        log.info("Inbox relays changed, running a sync pass");
                        start();
                    }
                })
                .then();
    }

    private SyncPhase currentPhase() {
        synchronized (statusLock) {
            return phase;
        }
    }

    private void emitSnapshot() {
        if (closed) {
            return;
        }
        // Built under emitLock so emission order matches state order.
        synchronized (emitLock) {
            snapshots.tryEmitNext(snapshot());
        }
    }
}
