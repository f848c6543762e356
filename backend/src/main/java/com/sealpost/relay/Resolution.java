package com.sealpost.relay;

import java.util.List;
import java.util.Optional;

/**
 * Relays chosen for one pubkey and purpose, plus the degradation signal when the routing
 * documents could not be read.
 */
public record Resolution(String pubkey, RelayPurpose purpose, List<String> relays, RelayResolutionDegraded degraded) {

    public Resolution {
        relays = List.copyOf(relays);
    }

    public Optional<RelayResolutionDegraded> degradation() {
        return Optional.ofNullable(degraded);
    }
}
