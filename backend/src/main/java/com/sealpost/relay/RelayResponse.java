package com.sealpost.relay;

import com.sealpost.event.NostrEvent;

import java.util.List;

/**
 * What one relay returned for a query, or why it returned nothing.
 */
public record RelayResponse(String relay, List<NostrEvent> events, String error) {

    public RelayResponse {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static RelayResponse success(String relay, List<NostrEvent> events) {
        return new RelayResponse(relay, events, null);
    }

    public static RelayResponse failure(String relay, String error) {
        return new RelayResponse(relay, List.of(), error == null ? "unknown error" : error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public RelayHealth health() {
        return succeeded() ? RelayHealth.success() : RelayHealth.failure(error);
    }
}
