package com.sealpost.relay;

import java.util.List;

/**
 * Relay resolution could not read routing documents and fell back to the discovery set.
 * Informational: the caller keeps going with {@code fallbackRelays}.
 */
public record RelayResolutionDegraded(String pubkey, RelayPurpose purpose, String reason, List<String> fallbackRelays) {

    public RelayResolutionDegraded {
        fallbackRelays = List.copyOf(fallbackRelays);
    }

    public String describe() {
        return "Could not load relay lists for " + abbreviate(pubkey) + " (" + reason
                + "), using " + fallbackRelays.size() + " discovery relays";
    }

    private static String abbreviate(String pubkey) {
        return pubkey == null || pubkey.length() <= 12 ? String.valueOf(pubkey) : pubkey.substring(0, 12) + "…";
    }
}
