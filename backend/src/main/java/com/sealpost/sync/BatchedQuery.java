package com.sealpost.sync;

import com.sealpost.conversation.Protocol;
import com.sealpost.event.EventFilter;
import com.sealpost.event.NostrEvent;
import com.sealpost.relay.RelayHealth;
import com.sealpost.relay.RelayResponse;
import com.sealpost.relay.RelayTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetches direct-message events in bounded batches.
 *
 * <p>Three filter streams run side by side (legacy to me, legacy from me, private to me). Each
 * batch asks every relay for up to {@code batchSize} events; the next batch ends at the oldest
 * event seen. A stream stops when a batch comes back short, adds nothing new, or the running
 * total across streams hits {@code queryLimit}. If every relay fails for a batch the stream stops
 * with a {@link RelayError}; what was fetched so far is kept.
 */
public class BatchedQuery {

    private static final Logger log = LoggerFactory.getLogger(BatchedQuery.class);

    private final RelayTransport transport;
    private final int batchSize;
    private final int queryLimit;
    private final Duration timeout;

    public BatchedQuery(RelayTransport transport, int batchSize, int queryLimit, Duration timeout) {
        this.transport = transport;
        this.batchSize = batchSize;
        this.queryLimit = queryLimit;
        this.timeout = timeout;
    }

    /**
     * @param since lower bound per protocol in epoch seconds; a missing entry means from the beginning
     */
    public Mono<QueryPass> run(String localPubkey, List<String> relays, Map<Protocol, Long> since,
                               SyncListener listener) {
        if (relays.isEmpty()) {
            log.warn("No relays to query for direct messages");
            return Mono.just(QueryPass.empty());
        }
        AtomicInteger total = new AtomicInteger();
        Map<Protocol, AtomicInteger> perProtocol = new EnumMap<>(Protocol.class);
        for (Protocol protocol : Protocol.values()) {
            perProtocol.put(protocol, new AtomicInteger());
        }

        return Flux.fromArray(QueryStream.values())
                .flatMap(stream -> {
                    EventFilter base = stream.filter(localPubkey).since(since.get(stream.protocol()));
                    return nextBatch(new StreamState(stream, base), relays, total, perProtocol, listener);
                })
                .collectList()
                .map(states -> combine(relays, states, total.get()));
    }

    private Mono<StreamState> nextBatch(StreamState state, List<String> relays, AtomicInteger total,
                                        Map<Protocol, AtomicInteger> perProtocol, SyncListener listener) {
        int limit = Math.min(batchSize, queryLimit - total.get());
        if (limit <= 0) {
            state.limitReached = true;
            return Mono.just(state);
        }
        EventFilter filter = state.base.until(state.until).limit(limit);

        return transport.query(relays, List.of(filter), timeout)
                .collectList()
                .flatMap(responses -> {
                    List<String> failing = new ArrayList<>();
                    Map<String, NostrEvent> batch = new LinkedHashMap<>();
                    for (RelayResponse response : responses) {
                        state.health.merge(response.relay(), response.health(), RelayHealth::mergeNewer);
                        if (response.succeeded()) {
                            response.events().stream()
                                    .filter(event -> event.id() != null)
                                    .forEach(event -> batch.putIfAbsent(event.id(), event));
                        } else {
                            failing.add(response.relay());
                        }
                    }
                    if (!responses.isEmpty() && failing.size() == responses.size()) {
                        state.error = new RelayError("All relays failed while fetching " + describe(state.stream),
                                state.stream.protocol(), failing, responses.size());
                        log.warn("{} after {} events: {}", state.error.message(), state.events.size(), failing);
                        return Mono.just(state);
                    }

                    int fresh = 0;
                    long oldest = Long.MAX_VALUE;
                    for (NostrEvent event : batch.values()) {
                        oldest = Math.min(oldest, event.createdAt());
                        if (state.seen.add(event.id())) {
                            state.events.add(event);
                            fresh++;
                        }
                    }
                    int runningTotal = total.addAndGet(fresh);
                    int protocolCount = perProtocol.get(state.stream.protocol()).addAndGet(fresh);
                    listener.onProgress(new ScanProgress(state.stream.protocol(), protocolCount,
                            "Fetched " + protocolCount + " " + state.stream.protocol().name().toLowerCase() + " events"));

                    if (runningTotal >= queryLimit) {
                        state.limitReached = true;
                        return Mono.just(state);
                    }
                    if (batch.size() < limit || fresh == 0) {
                        return Mono.just(state);
                    }
                    state.until = oldest;
                    return nextBatch(state, relays, total, perProtocol, listener);
                });
    }

    private QueryPass combine(List<String> relays, List<StreamState> states, int total) {
        Map<String, NostrEvent> events = new LinkedHashMap<>();
        Map<String, RelayHealth> health = new HashMap<>();
        List<RelayError> errors = new ArrayList<>();
        boolean limitReached = total >= queryLimit;
        for (StreamState state : states) {
            state.events.forEach(event -> events.putIfAbsent(event.id(), event));
            state.health.forEach((relay, value) -> health.merge(relay, value, RelayHealth::mergeNewer));
            if (state.error != null) {
                errors.add(state.error);
            }
            limitReached |= state.limitReached;
        }
        log.debug("Query pass over {} relays fetched {} events (limit reached: {})", relays.size(), events.size(),
                limitReached);
        return new QueryPass(relays, new ArrayList<>(events.values()), health, limitReached, errors);
    }

    private static String describe(QueryStream stream) {
        return switch (stream) {
            case LEGACY_TO_ME -> "legacy messages to you";
            case LEGACY_FROM_ME -> "legacy messages from you";
            case PRIVATE_TO_ME -> "private messages";
        };
    }

    private static final class StreamState {
        final QueryStream stream;
        final EventFilter base;
        final Set<String> seen = new HashSet<>();
        final List<NostrEvent> events = new ArrayList<>();
        final Map<String, RelayHealth> health = new HashMap<>();
        Long until;
        RelayError error;
        boolean limitReached;

        StreamState(QueryStream stream, EventFilter base) {
            this.stream = stream;
            this.base = base;
        }
    }
}
