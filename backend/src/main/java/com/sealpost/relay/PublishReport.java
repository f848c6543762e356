package com.sealpost.relay;

import java.util.List;
import java.util.Map;

/**
 * Per-relay outcome of publishing one event. A publish counts as delivered when at least one
 * relay accepted it.
 */
public record PublishReport(String eventId, List<String> accepted, Map<String, String> rejected) {

    public PublishReport {
        accepted = List.copyOf(accepted);
        rejected = Map.copyOf(rejected);
    }

    public boolean delivered() {
        return !accepted.isEmpty();
    }
}
