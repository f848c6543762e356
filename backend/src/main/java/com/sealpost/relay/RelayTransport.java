package com.sealpost.relay;

import com.sealpost.event.EventFilter;
import com.sealpost.event.NostrEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Publish/subscribe access to a set of relays.
 */
public interface RelayTransport {

    /**
     * Queries every relay independently until it signals end of stored events. Emits exactly one
     * {@link RelayResponse} per relay, in completion order; failures and timeouts are emitted as
     * failed responses rather than errors.
     */
    Flux<RelayResponse> query(Collection<String> relays, List<EventFilter> filters, Duration timeout);

    /**
     * Standing subscription across all relays. Events may arrive more than once.
     */
    Flux<NostrEvent> subscribe(Collection<String> relays, List<EventFilter> filters);

    Mono<PublishReport> publish(Collection<String> relays, NostrEvent event);
}
