package com.sealpost.relay;

import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The three routing documents published by one user, any of which may be absent.
 */
public record RelayLists(NostrEvent relayList, NostrEvent dmInbox, NostrEvent blockedRelays) {

    public static final RelayLists EMPTY = new RelayLists(null, null, null);

    /** Keeps the newest document per kind among {@code events} authored by {@code pubkey}. */
    public static RelayLists newestOf(String pubkey, Collection<NostrEvent> events) {
        NostrEvent relayList = null;
        NostrEvent dmInbox = null;
        NostrEvent blocked = null;
        for (NostrEvent event : events) {
            if (!pubkey.equals(event.pubkey())) {
                continue;
            }
            switch (event.kind()) {
                case EventKinds.RELAY_LIST -> relayList = newer(relayList, event);
                case EventKinds.DM_INBOX_RELAYS -> dmInbox = newer(dmInbox, event);
                case EventKinds.BLOCKED_RELAYS -> blocked = newer(blocked, event);
                default -> {
                }
            }
        }
        return new RelayLists(relayList, dmInbox, blocked);
    }

    public RelayLists mergeNewer(RelayLists other) {
        return new RelayLists(
                newer(relayList, other.relayList),
                newer(dmInbox, other.dmInbox),
                newer(blockedRelays, other.blockedRelays));
    }

    public boolean isEmpty() {
        return relayList == null && dmInbox == null && blockedRelays == null;
    }

    /** {@code relay} tags of the DM inbox document. */
    public List<String> inboxRelays() {
        return dmInbox == null ? List.of() : RelayUrls.clean(dmInbox.tagValues("relay"));
    }

    /** {@code r} tags with no marker or the {@code read} marker. */
    public List<String> readRelays() {
        return markedRelays(relayList, "read");
    }

    /** {@code r} tags with no marker or the {@code write} marker. */
    public List<String> writeRelays() {
        return markedRelays(relayList, "write");
    }

    /** {@code r} tags of the blocked-relays document. */
    public List<String> blocked() {
        return blockedRelays == null ? List.of() : RelayUrls.clean(blockedRelays.tagValues("r"));
    }

    static List<String> markedRelays(NostrEvent document, String marker) {
        if (document == null) {
            return List.of();
        }
        List<String> relays = new ArrayList<>();
        for (List<String> tag : document.tagsNamed("r")) {
            if (tag.size() < 2) {
                continue;
            }
            if (tag.size() == 2 || tag.get(2).isBlank() || marker.equals(tag.get(2))) {
                relays.add(tag.get(1));
            }
        }
        return RelayUrls.clean(relays);
    }

    private static NostrEvent newer(NostrEvent current, NostrEvent candidate) {
        if (candidate == null) {
            return current;
        }
        if (current == null || candidate.createdAt() > current.createdAt()) {
            return candidate;
        }
        return current;
    }
}
