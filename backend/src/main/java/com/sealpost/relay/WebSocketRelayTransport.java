package com.sealpost.relay;

import com.sealpost.event.EventFilter;
import com.sealpost.event.NostrEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link RelayTransport} over WebSocket connections, one connection per relay per operation.
 *
 * <p>Queries send {@code REQ} and collect events until {@code EOSE}; subscriptions stay open
 * and reconnect with backoff; publishes send {@code EVENT} and wait for the matching {@code OK}.
 */
public class WebSocketRelayTransport implements RelayTransport {

    private static final Logger log = LoggerFactory.getLogger(WebSocketRelayTransport.class);

    private static final Duration RECONNECT_MIN_BACKOFF = Duration.ofSeconds(2);
    private static final Duration RECONNECT_MAX_BACKOFF = Duration.ofMinutes(1);

    private final WebSocketClient client;
    private final Duration publishTimeout;

    public WebSocketRelayTransport(WebSocketClient client, Duration publishTimeout) {
        this.client = client;
        this.publishTimeout = publishTimeout;
    }

    @Override
    public Flux<RelayResponse> query(Collection<String> relays, List<EventFilter> filters, Duration timeout) {
        return Flux.fromIterable(new LinkedHashSet<>(relays))
                .flatMap(relay -> queryOne(relay, filters, timeout));
    }

    @Override
    public Flux<NostrEvent> subscribe(Collection<String> relays, List<EventFilter> filters) {
        return Flux.fromIterable(new LinkedHashSet<>(relays))
                .flatMap(relay -> subscribeOne(relay, filters));
    }

    @Override
    public Mono<PublishReport> publish(Collection<String> relays, NostrEvent event) {
        return Flux.fromIterable(new LinkedHashSet<>(relays))
                .flatMap(relay -> publishOne(relay, event).map(error -> Map.entry(relay, error)))
                .collectList()
                .map(results -> {
                    List<String> accepted = new ArrayList<>();
                    Map<String, String> rejected = new HashMap<>();
                    results.forEach(result -> result.getValue().ifPresentOrElse(
                            error -> rejected.put(result.getKey(), error),
                            () -> accepted.add(result.getKey())));
                    return new PublishReport(event.id(), accepted, rejected);
                });
    }

    // ── Per relay ─────────────────────────────────────────────────────────────

    private Mono<RelayResponse> queryOne(String relay, List<EventFilter> filters, Duration timeout) {
        String subscriptionId = newSubscriptionId();
        List<NostrEvent> events = new CopyOnWriteArrayList<>();

        return Mono.defer(() -> client.execute(URI.create(relay), session -> {
                    Mono<Void> collect = frames(session)
                            .<RelayFrame>handle((frame, sink) -> {
                                if (frame instanceof RelayFrame.Closed closed
                                        && subscriptionId.equals(closed.subscriptionId())) {
                                    sink.error(new RelayClosedException(relay, closed.message()));
                                } else {
                                    sink.next(frame);
                                }
                            })
                            .takeUntil(frame -> frame instanceof RelayFrame.EndOfStored eose
                                    && subscriptionId.equals(eose.subscriptionId()))
                            .doOnNext(frame -> {
                                if (frame instanceof RelayFrame.Event received
                                        && subscriptionId.equals(received.subscriptionId())) {
                                    events.add(received.event());
                                }
                            })
                            .then();
                    return send(session, RelayFrames.req(subscriptionId, filters))
                            .then(collect)
                            .then(send(session, RelayFrames.close(subscriptionId)))
                            .then(session.close());
                }))
                .timeout(timeout)
                .then(Mono.fromSupplier(() -> RelayResponse.success(relay, List.copyOf(events))))
                .onErrorResume(error -> {
                    log.debug("Query to {} failed: {}", relay, describe(error));
                    return Mono.just(RelayResponse.failure(relay, describe(error)));
                });
    }

    private Flux<NostrEvent> subscribeOne(String relay, List<EventFilter> filters) {
        return Flux.<NostrEvent>create(sink -> {
                    String subscriptionId = newSubscriptionId();
                    Disposable connection = Mono.defer(() -> client.execute(URI.create(relay), session ->
                                    send(session, RelayFrames.req(subscriptionId, filters))
                                            .thenMany(frames(session))
                                            .doOnNext(frame -> {
                                                if (frame instanceof RelayFrame.Event received
                                                        && subscriptionId.equals(received.subscriptionId())) {
                                                    sink.next(received.event());
                                                } else if (frame instanceof RelayFrame.Closed closed
                                                        && subscriptionId.equals(closed.subscriptionId())) {
                                                    throw new RelayClosedException(relay, closed.message());
                                                } else if (frame instanceof RelayFrame.Notice notice) {
                                                    log.debug("Notice from {}: {}", relay, notice.message());
                                                }
                                            })
                                            .then()))
                            .subscribe(unused -> { }, sink::error, sink::complete);
                    sink.onDispose(connection);
                })
                .repeatWhen(completed -> completed.delayElements(RECONNECT_MIN_BACKOFF))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, RECONNECT_MIN_BACKOFF)
                        .maxBackoff(RECONNECT_MAX_BACKOFF)
                        .doBeforeRetry(signal -> log.warn("Subscription to {} dropped, reconnecting: {}",
                                relay, describe(signal.failure()))));
    }

    private Mono<Optional<String>> publishOne(String relay, NostrEvent event) {
        AtomicReference<RelayFrame.Ok> ack = new AtomicReference<>();

        return Mono.defer(() -> client.execute(URI.create(relay), session ->
                        send(session, RelayFrames.event(event))
                                .thenMany(frames(session))
                                .filter(frame -> frame instanceof RelayFrame.Ok ok && event.id().equals(ok.eventId()))
                                .next()
                                .doOnNext(frame -> ack.set((RelayFrame.Ok) frame))
                                .then(session.close())))
                .timeout(publishTimeout)
                .then(Mono.fromSupplier(() -> {
                    RelayFrame.Ok ok = ack.get();
                    if (ok == null) {
                        return Optional.of("connection closed without acknowledgement");
                    }
                    return ok.accepted() ? Optional.<String>empty() : Optional.of(ok.message());
                }))
                .onErrorResume(error -> {
                    log.debug("Publish of {} to {} failed: {}", event.id(), relay, describe(error));
                    return Mono.just(Optional.of(describe(error)));
                });
    }

    private static Flux<RelayFrame> frames(WebSocketSession session) {
        return session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .flatMap(text -> Mono.justOrEmpty(RelayFrames.parse(text)));
    }

    private static Mono<Void> send(WebSocketSession session, String text) {
        return session.send(Mono.just(session.textMessage(text)));
    }

    private static String newSubscriptionId() {
        return "dm-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "timeout";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
