package com.sealpost.sync;

import com.sealpost.conversation.MergeResult;
import com.sealpost.conversation.Message;
import com.sealpost.conversation.MessagingState;
import com.sealpost.conversation.Protocol;
import com.sealpost.crypto.CryptoCodec;
import com.sealpost.event.EventFilter;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import com.sealpost.relay.RelayTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Standing subscriptions for one session: one per protocol on the inbox relays, plus a watch on
 * the local user's own routing documents on the discovery relays.
 *
 * <p>A protocol's cursor moves forward only once an event has been decoded and merged. Calling
 * {@link #start} with a different relay set tears everything down and subscribes again.
 */
public class LiveSubscriptionManager {

    private static final Logger log = LoggerFactory.getLogger(LiveSubscriptionManager.class);

    private final String localPubkey;
    private final RelayTransport transport;
    private final MessageDecoder decoder;
    private final MessagingStateHolder holder;
    private final DebouncedCacheWriter cacheWriter;
    private final Clock clock;
    private final Consumer<NostrEvent> routingDocumentHandler;

    private Disposable.Composite active;
    private volatile List<String> inboxRelays = List.of();
    private List<String> discoveryRelays = List.of();
    private volatile List<String> descriptions = List.of();

    public LiveSubscriptionManager(String localPubkey, RelayTransport transport, MessageDecoder decoder,
                                   MessagingStateHolder holder, DebouncedCacheWriter cacheWriter, Clock clock,
                                   Consumer<NostrEvent> routingDocumentHandler) {
        this.localPubkey = localPubkey;
        this.transport = transport;
        this.decoder = decoder;
        this.holder = holder;
        this.cacheWriter = cacheWriter;
        this.clock = clock;
        this.routingDocumentHandler = routingDocumentHandler;
    }

    /**
     * Subscribes on {@code inbox}. Returns false when the same relay sets are already subscribed.
     */
    public synchronized boolean start(List<String> inbox, List<String> discovery) {
        if (active != null && !active.isDisposed() && inbox.equals(inboxRelays) && discovery.equals(discoveryRelays)) {
            return false;
        }
        stop();
        inboxRelays = List.copyOf(inbox);
        discoveryRelays = List.copyOf(discovery);

        MessagingState state = holder.current();
        long now = clock.instant().getEpochSecond();
        long overlap = SyncOrchestrator.SYNC_OVERLAP.getSeconds();
        long legacySince = state.syncState().cursorOrCacheTime(Protocol.LEGACY, now) - overlap;
        long privateSince = state.syncState().cursorOrCacheTime(Protocol.PRIVATE, now) - overlap
                - CryptoCodec.GIFT_WRAP_FUZZ.getSeconds();

        List<EventFilter> legacy = List.of(
                QueryStream.LEGACY_TO_ME.filter(localPubkey).since(legacySince),
                QueryStream.LEGACY_FROM_ME.filter(localPubkey).since(legacySince));
        List<EventFilter> sealed = List.of(QueryStream.PRIVATE_TO_ME.filter(localPubkey).since(privateSince));
        EventFilter routing = EventFilter.ofKinds(EventKinds.RELAY_LIST, EventKinds.DM_INBOX_RELAYS,
                        EventKinds.BLOCKED_RELAYS)
                .authors(List.of(localPubkey))
                .since(now);

        active = Disposables.composite();
        List<String> described = new ArrayList<>();
        if (!inboxRelays.isEmpty()) {
            active.add(subscribe(Protocol.LEGACY, legacy));
            active.add(subscribe(Protocol.PRIVATE, sealed));
            described.add("LEGACY on " + inboxRelays.size() + " relays since " + legacySince);
            described.add("PRIVATE on " + inboxRelays.size() + " relays since " + privateSince);
        } else {
            log.warn("No inbox relays, live direct-message subscriptions not started");
        }
        if (!discoveryRelays.isEmpty()) {
            active.add(transport.subscribe(discoveryRelays, List.of(routing))
                    .subscribe(this::onRoutingDocument,
                            error -> log.warn("Routing document watch ended: {}", error.getMessage())));
            described.add("Routing documents on " + discoveryRelays.size() + " relays");
        }
        descriptions = List.copyOf(described);
        log.info("Live subscriptions started on {} inbox relays", inboxRelays.size());
        return true;
    }

    public synchronized void stop() {
        if (active != null) {
            active.dispose();
            active = null;
        }
        descriptions = List.of();
    }

    public List<String> activeSubscriptions() {
        return descriptions;
    }

    public List<String> inboxRelays() {
        return inboxRelays;
    }

    private Disposable subscribe(Protocol protocol, List<EventFilter> filters) {
        return transport.subscribe(inboxRelays, filters)
                .concatMap(event -> Mono.fromCallable(() -> process(protocol, event))
                        .onErrorResume(error -> {
                            log.warn("Failed to process live {} event {}: {}", protocol, event.id(), error.getMessage());
                            return Mono.empty();
                        }))
                .subscribe(
                        processed -> { },
                        error -> log.warn("Live {} subscription ended: {}", protocol, error.getMessage()));
    }

    /** Decodes, merges and advances the cursor. Returns whether the event produced a message. */
    boolean process(Protocol protocol, NostrEvent event) {
        Optional<Message> message = decoder.decode(event);
        if (message.isEmpty()) {
            return false;
        }
        MergeResult result = holder.propose(List.of(message.get()));
        MessagingState next = holder.update(state ->
                state.withSyncState(state.syncState().withCursor(protocol, event.createdAt())));
        cacheWriter.submit(next, result.changed());
        if (result.changed()) {
            log.debug("Live {} message {} merged", protocol, event.id());
        }
        return true;
    }

    private void onRoutingDocument(NostrEvent event) {
        if (!localPubkey.equals(event.pubkey())) {
            return;
        }
        try {
            routingDocumentHandler.accept(event);
        } catch (RuntimeException e) {
            log.warn("Failed to apply routing document {}: {}", event.id(), e.getMessage(), e);
        }
    }
}
