package com.sealpost.relay;

import java.util.List;
import java.util.Map;

/**
 * Everything routing decisions depend on, captured at one point in time.
 *
 * @param localPubkey   the logged-in user
 * @param discovery     configured discovery relays
 * @param myInbox       relays the local user reads direct messages from
 * @param myOutbox      relays the local user publishes to
 * @param myBlocked     relays the local user never wants contacted
 * @param participants  known correspondents by pubkey
 */
public record ResolverSnapshot(
        String localPubkey,
        List<String> discovery,
        List<String> myInbox,
        List<String> myOutbox,
        List<String> myBlocked,
        Map<String, Participant> participants
) {

    public ResolverSnapshot {
        discovery = List.copyOf(discovery);
        myInbox = List.copyOf(myInbox);
        myOutbox = List.copyOf(myOutbox);
        myBlocked = List.copyOf(myBlocked);
        participants = Map.copyOf(participants);
    }

    /**
     * Snapshot from known participants. The local user's inbox and blocked relays come from their
     * own participant entry, when there is one.
     */
    public static ResolverSnapshot of(String localPubkey, List<String> discovery, List<String> myOutbox,
                                      Map<String, Participant> participants) {
        Participant self = participants.get(localPubkey);
        return new ResolverSnapshot(localPubkey, discovery,
                self == null ? List.of() : self.derivedRelays(),
                myOutbox,
                self == null ? List.of() : self.blockedRelays(),
                participants);
    }

    /** Inbox relays of {@code pubkey}, discovery if unknown or empty. */
    public List<String> inboxOf(String pubkey) {
        if (localPubkey.equals(pubkey) && !myInbox.isEmpty()) {
            return myInbox;
        }
        Participant participant = participants.get(pubkey);
        if (participant == null || participant.derivedRelays().isEmpty()) {
            return discovery;
        }
        return participant.derivedRelays();
    }
}
