package com.sealpost.store;

import com.sealpost.conversation.SyncState;
import com.sealpost.event.NostrEvent;
import com.sealpost.relay.Participant;
import com.sealpost.relay.RelayHealth;

import java.util.List;
import java.util.Map;

/**
 * Serialized form of a cached messaging state. Messages are stored as their wire envelopes and
 * decrypted again on load.
 */
public record CachePayload(
        int formatVersion,
        String fingerprint,
        Map<String, Participant> participants,
        List<NostrEvent> envelopes,
        SyncState syncState,
        Map<String, RelayHealth> relayHealth
) {

    public CachePayload {
        participants = participants == null ? Map.of() : Map.copyOf(participants);
        relayHealth = relayHealth == null ? Map.of() : Map.copyOf(relayHealth);
    }

    /** Structure checks applied after parsing. */
    public boolean isWellFormed() {
        return envelopes != null
                && syncState != null
                && envelopes.stream().allMatch(event -> event != null && event.id() != null && event.pubkey() != null);
    }
}
