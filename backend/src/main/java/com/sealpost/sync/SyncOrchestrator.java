package com.sealpost.sync;

import com.sealpost.conversation.Conversation;
import com.sealpost.conversation.MergeEngine;
import com.sealpost.conversation.Message;
import com.sealpost.conversation.MessagingState;
import com.sealpost.conversation.Protocol;
import com.sealpost.crypto.CryptoCodec;
import com.sealpost.relay.Participant;
import com.sealpost.relay.ParticipantLookup;
import com.sealpost.relay.RelayResolutionDegraded;
import com.sealpost.relay.RelaySetResolver;
import com.sealpost.store.CachePayload;
import com.sealpost.store.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs one sync pass for the local user: {@code CACHE → INITIAL_QUERY → GAP_FILL →
 * SUBSCRIPTIONS → READY}.
 *
 * <p>A cold start (no usable cache) queries the user's own relays from the beginning, then
 * resolves every counterpart found and queries the relays not yet covered. A warm start also
 * queries the relays of earlier passes, but only from the last cache time minus
 * {@link #SYNC_OVERLAP} (and minus {@link CryptoCodec#GIFT_WRAP_FUZZ} for gift wraps, whose
 * timestamps lie in the past). A failed phase is reported and the pass moves on.
 */
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    public static final Duration SYNC_OVERLAP = Duration.ofSeconds(10);

    private final String localPubkey;
    private final RelaySetResolver resolver;
    private final BatchedQuery query;
    private final MessageDecoder decoder;
    private final MessagingStateHolder holder;
    private final MessageStore store;
    private final DebouncedCacheWriter cacheWriter;
    private final LiveSubscriptionManager subscriptions;
    private final Duration relayTtl;
    private final Clock clock;
    private final SyncListener listener;

    public SyncOrchestrator(String localPubkey, RelaySetResolver resolver, BatchedQuery query,
                            MessageDecoder decoder, MessagingStateHolder holder, MessageStore store,
                            DebouncedCacheWriter cacheWriter, LiveSubscriptionManager subscriptions,
                            Duration relayTtl, Clock clock, SyncListener listener) {
        this.localPubkey = localPubkey;
        this.resolver = resolver;
        this.query = query;
        this.decoder = decoder;
        this.holder = holder;
        this.store = store;
        this.cacheWriter = cacheWriter;
        this.subscriptions = subscriptions;
        this.relayTtl = relayTtl;
        this.clock = clock;
        this.listener = listener;
    }

    public Mono<Void> run() {
        return Mono.defer(() -> {
                    long startedAt = clock.instant().getEpochSecond();
                    return loadCache()
                            .flatMap(warm -> initialQuery(warm))
                            .flatMap(initial -> gapFill(initial)
                                    .flatMap(gap -> complete(startedAt, initial, gap)));
                })
                .then(startSubscriptions())
                .doOnSuccess(unused -> {
                    listener.onPhase(SyncPhase.READY);
                    log.info("Sync ready: {} conversations, {} messages", holder.current().conversations().size(),
                            holder.current().messageCount());
                });
    }

    /** Emits whether the pass is a warm start. */
    Mono<Boolean> loadCache() {
        listener.onPhase(SyncPhase.CACHE);
        if (holder.current().syncState().lastCacheTime() != null) {
            return Mono.just(true);
        }
        return store.readCache(localPubkey)
                .map(payload -> {
                    holder.replace(restore(payload));
                    log.info("Warm start from cache: {} envelopes, last sync at {}", payload.envelopes().size(),
                            payload.syncState().lastCacheTime());
                    return holder.current().syncState().lastCacheTime() != null;
                })
                .defaultIfEmpty(false)
                .onErrorResume(error -> {
                    phaseFailed(SyncPhase.CACHE, error);
                    return Mono.just(false);
                });
    }

    Mono<InitialPass> initialQuery(boolean warm) {
        return Mono.defer(() -> {
                    listener.onPhase(SyncPhase.INITIAL_QUERY);
                    return resolver.resolveParticipants(List.of(localPubkey));
                })
                .flatMap(lookup -> {
                    absorbLookup(lookup);
                    MessagingState state = holder.current();
                    Participant self = state.participants().get(localPubkey);
                    LinkedHashSet<String> relays = new LinkedHashSet<>(self.derivedRelays());
                    if (warm) {
                        relays.addAll(state.syncState().queriedRelays());
                    }
                    self.blockedRelays().forEach(relays::remove);
                    Map<Protocol, Long> since = warm ? sinceFor(state) : Map.of();
                    log.info("{} start: querying {} relays", warm ? "Warm" : "Cold", relays.size());

                    return query.run(localPubkey, new ArrayList<>(relays), since, listener)
                            .map(pass -> {
                                absorbPass(pass, self.blockedRelays());
                                pass.firstError().ifPresent(error -> {
                                    listener.onRelayError(error);
                                    phaseFailed(SyncPhase.INITIAL_QUERY, new RelayQueryFailedException(error));
                                });
                                return new InitialPass(pass.relays(), pass.limitReached(), pass.errors().isEmpty());
                            });
                })
                .onErrorResume(error -> {
                    phaseFailed(SyncPhase.INITIAL_QUERY, error);
                    return Mono.just(new InitialPass(List.of(), false, false));
                });
    }

    Mono<QueryPass> gapFill(InitialPass initial) {
        return Mono.defer(() -> {
                    listener.onPhase(SyncPhase.GAP_FILL);
                    return resolver.resolveParticipants(participantsToResolve(holder.current()));
                })
                .flatMap(lookup -> {
                    absorbLookup(lookup);
                    MessagingState state = holder.current();
                    LinkedHashSet<String> relays = new LinkedHashSet<>();
                    for (String pubkey : counterparts(state)) {
                        Participant participant = state.participants().get(pubkey);
                        if (participant != null) {
                            relays.addAll(participant.derivedRelays());
                        }
                    }
                    relays.removeAll(initial.relays());
                    relays.removeAll(state.syncState().queriedRelays());
                    List<String> blocked = myBlockedRelays(state);
                    blocked.forEach(relays::remove);
                    if (relays.isEmpty()) {
                        log.debug("Gap fill: no relays left to query");
                        return Mono.just(QueryPass.empty());
                    }
                    log.info("Gap fill: querying {} additional relays", relays.size());
                    return query.run(localPubkey, new ArrayList<>(relays), Map.of(), listener)
                            .map(pass -> {
                                absorbPass(pass, blocked);
                                pass.firstError().ifPresent(error ->
                                        log.warn("Gap fill incomplete: {} ({} of {} relays failing)", error.message(),
                                                error.failingEndpoints().size(), error.totalEndpoints()));
                                return pass;
                            });
                })
                .onErrorResume(error -> {
                    log.warn("Gap fill failed: {}", error.getMessage(), error);
                    return Mono.just(QueryPass.empty());
                });
    }

    /**
     * Records the pass in the sync state and persists. The cache time only moves forward when
     * the initial query succeeded, so a failed pass is repeated in full next time.
     */
    Mono<Void> complete(long startedAt, InitialPass initial, QueryPass gap) {
        MessagingState state = holder.update(current -> {
            if (!initial.succeeded()) {
                return current;
            }
            List<String> queried = new ArrayList<>(initial.relays());
            queried.addAll(gap.relays());
            return current.withSyncState(current.syncState().withCompletedPass(startedAt, queried,
                    initial.limitReached() || gap.limitReached()));
        });
        return cacheWriter.flushNow(state)
                .onErrorResume(error -> {
                    log.warn("Could not persist sync state: {}", error.getMessage(), error);
                    return Mono.empty();
                });
    }

    Mono<Void> startSubscriptions() {
        return Mono.fromRunnable(() -> {
                    listener.onPhase(SyncPhase.SUBSCRIPTIONS);
                    subscriptions.start(inboxRelays(holder.current()), resolver.discoveryRelays());
                })
                .onErrorResume(error -> {
                    phaseFailed(SyncPhase.SUBSCRIPTIONS, error);
                    return Mono.empty();
                })
                .then();
    }

    /** My derived relays without the ones I blocked. */
    public List<String> inboxRelays(MessagingState state) {
        Participant self = state.participants().get(localPubkey);
        if (self == null) {
            return resolver.discoveryRelays();
        }
        List<String> relays = new ArrayList<>(self.derivedRelays());
        relays.removeAll(self.blockedRelays());
        return relays;
    }

    MessagingState restore(CachePayload payload) {
        MessagingState base = MessagingState.empty()
                .withParticipants(payload.participants())
                .withSyncState(payload.syncState())
                .withRelayHealth(payload.relayHealth());
        List<Message> messages = decoder.decodeAll(payload.envelopes());
        MergeEngine engine = holder.mergeEngine();
        return engine.merge(base, messages).state();
    }

    Map<Protocol, Long> sinceFor(MessagingState state) {
        long lastCacheTime = state.syncState().lastCacheTime();
        long legacy = lastCacheTime - SYNC_OVERLAP.getSeconds();
        Map<Protocol, Long> since = new EnumMap<>(Protocol.class);
        since.put(Protocol.LEGACY, legacy);
        since.put(Protocol.PRIVATE, legacy - CryptoCodec.GIFT_WRAP_FUZZ.getSeconds());
        return since;
    }

    /** Counterparts never resolved, or resolved longer ago than the relay TTL. */
    Set<String> participantsToResolve(MessagingState state) {
        long now = clock.instant().getEpochSecond();
        Set<String> pubkeys = new LinkedHashSet<>();
        for (String pubkey : counterparts(state)) {
            Participant known = state.participants().get(pubkey);
            if (known == null || known.isStale(now, relayTtl)) {
                pubkeys.add(pubkey);
            }
        }
        return pubkeys;
    }

    // Conversations holding only undecryptable gift wraps are keyed by one-time wrap keys.
    private Set<String> counterparts(MessagingState state) {
        Set<String> pubkeys = new LinkedHashSet<>();
        for (Conversation conversation : state.conversations().values()) {
            if (onlyUnreadableWraps(state.messagesOf(conversation.id()))) {
                continue;
            }
            pubkeys.addAll(conversation.participantPubkeys());
        }
        pubkeys.remove(localPubkey);
        return pubkeys;
    }

    private static boolean onlyUnreadableWraps(List<Message> messages) {
        return !messages.isEmpty() && messages.stream()
                .allMatch(message -> message.failedToDecrypt() && message.protocol() == Protocol.PRIVATE);
    }

    private List<String> myBlockedRelays(MessagingState state) {
        Participant self = state.participants().get(localPubkey);
        return self == null ? List.of() : self.blockedRelays();
    }

    private void absorbLookup(ParticipantLookup lookup) {
        for (RelayResolutionDegraded degraded : lookup.degraded()) {
            listener.onNotice(degraded.describe());
        }
        holder.update(state -> {
            MessagingState next = MergeEngine.mergeParticipants(state, lookup.participants());
            return MergeEngine.mergeRelayHealth(next, lookup.health(), myBlockedRelays(next));
        });
    }

    private void absorbPass(QueryPass pass, Collection<String> blocked) {
        List<Message> messages = decoder.decodeAll(pass.events());
        holder.propose(messages);
        holder.update(state -> MergeEngine.mergeRelayHealth(state, pass.health(), blocked));
    }

    private void phaseFailed(SyncPhase phase, Throwable error) {
        log.warn("Sync phase {} failed: {}", phase, error.getMessage());
        listener.onPhaseFailed(phase, error);
    }

    /** What the initial query covered. */
    record InitialPass(List<String> relays, boolean limitReached, boolean succeeded) {
    }
}
