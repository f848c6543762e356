package com.sealpost.relay;

import java.util.List;
import java.util.Map;

/**
 * Participants built from freshly fetched routing documents.
 */
public record ParticipantLookup(Map<String, Participant> participants, Map<String, RelayHealth> health,
                                List<RelayResolutionDegraded> degraded) {

    public ParticipantLookup {
        participants = Map.copyOf(participants);
        health = Map.copyOf(health);
        degraded = List.copyOf(degraded);
    }

    public static ParticipantLookup empty() {
        return new ParticipantLookup(Map.of(), Map.of(), List.of());
    }
}
