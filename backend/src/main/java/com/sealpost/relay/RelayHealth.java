package com.sealpost.relay;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Last known query outcome for one relay.
 */
public record RelayHealth(boolean lastQuerySucceeded, String lastQueryError, boolean blocked) {

    public static RelayHealth success() {
        return new RelayHealth(true, null, false);
    }

    public static RelayHealth failure(String error) {
        return new RelayHealth(false, error, false);
    }

    /** Success is sticky across merges; a newer error replaces an older one. */
    public RelayHealth mergeNewer(RelayHealth newer) {
        return new RelayHealth(
                lastQuerySucceeded || newer.lastQuerySucceeded,
                newer.lastQueryError != null ? newer.lastQueryError : lastQueryError,
                blocked || newer.blocked);
    }

    public RelayHealth asBlocked() {
        return new RelayHealth(lastQuerySucceeded, lastQueryError, true);
    }

    public static Map<String, RelayHealth> merge(Map<String, RelayHealth> older, Map<String, RelayHealth> newer) {
        Map<String, RelayHealth> merged = new HashMap<>(older);
        newer.forEach((relay, health) -> merged.merge(relay, health, RelayHealth::mergeNewer));
        return merged;
    }

    public static Map<String, RelayHealth> markBlocked(Map<String, RelayHealth> health, Collection<String> blockedRelays) {
        Map<String, RelayHealth> marked = new HashMap<>(health);
        for (String relay : blockedRelays) {
            marked.computeIfPresent(relay, (key, value) -> value.asBlocked());
        }
        return marked;
    }
}
