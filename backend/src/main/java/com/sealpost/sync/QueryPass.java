package com.sealpost.sync;

import com.sealpost.event.NostrEvent;
import com.sealpost.relay.RelayHealth;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one batched query pass over a relay set. {@code events} holds everything fetched
 * even when {@code errors} is not empty.
 */
public record QueryPass(
        List<String> relays,
        List<NostrEvent> events,
        Map<String, RelayHealth> health,
        boolean limitReached,
        List<RelayError> errors
) {

    public QueryPass {
        relays = List.copyOf(relays);
        events = List.copyOf(events);
        health = Map.copyOf(health);
        errors = List.copyOf(errors);
    }

    public static QueryPass empty() {
        return new QueryPass(List.of(), List.of(), Map.of(), false, List.of());
    }

    public Optional<RelayError> firstError() {
        return errors.stream().findFirst();
    }
}
