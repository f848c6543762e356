package com.sealpost.relay;

import java.time.Duration;
import java.util.List;

/**
 * A known correspondent (the local user included) and the relays used to reach them.
 * {@code lastResolvedAt} is epoch seconds.
 */
public record Participant(String publicKey, List<String> derivedRelays, List<String> blockedRelays, long lastResolvedAt) {

    public Participant {
        derivedRelays = derivedRelays == null ? List.of() : List.copyOf(derivedRelays);
        blockedRelays = blockedRelays == null ? List.of() : List.copyOf(blockedRelays);
    }

    public boolean isStale(long now, Duration ttl) {
        return lastResolvedAt < now - ttl.getSeconds();
    }
}
