package com.sealpost.relay;

import com.sealpost.event.EventFilter;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Pure routing: which relays an outgoing event or a filter goes to, given a
 * {@link ResolverSnapshot}. The local user's blocked relays are always removed.
 */
public final class RelayRouter {

    private RelayRouter() {
    }

    public static List<String> routeEvent(NostrEvent event, ResolverSnapshot snapshot) {
        LinkedHashSet<String> relays = new LinkedHashSet<>();
        switch (event.kind()) {
            case EventKinds.GIFT_WRAP -> event.firstTagValue("p")
                    .ifPresentOrElse(recipient -> relays.addAll(snapshot.inboxOf(recipient)),
                            () -> relays.addAll(snapshot.discovery()));
            case EventKinds.LEGACY_DIRECT_MESSAGE -> {
                relays.addAll(snapshot.inboxOf(snapshot.localPubkey()));
                event.firstTagValue("p").ifPresent(recipient -> relays.addAll(snapshot.inboxOf(recipient)));
            }
            case EventKinds.RELAY_LIST, EventKinds.DM_INBOX_RELAYS, EventKinds.BLOCKED_RELAYS -> {
                relays.addAll(RelaySetResolver.publishRelays(outboxOrDiscovery(snapshot), event));
                relays.addAll(snapshot.discovery());
            }
            default -> relays.addAll(outboxOrDiscovery(snapshot));
        }
        return withoutBlocked(relays, snapshot);
    }

    public static List<String> routeFilter(EventFilter filter, ResolverSnapshot snapshot) {
        LinkedHashSet<String> relays = new LinkedHashSet<>();
        boolean routingDocuments = filter.kinds() != null
                && !filter.kinds().isEmpty()
                && filter.kinds().stream().allMatch(EventKinds::isRoutingDocument);
        if (routingDocuments) {
            relays.addAll(snapshot.discovery());
        } else if (mentions(filter.recipients(), snapshot.localPubkey())
                || mentions(filter.authors(), snapshot.localPubkey())) {
            relays.addAll(snapshot.inboxOf(snapshot.localPubkey()));
        } else {
            relays.addAll(snapshot.discovery());
        }
        return withoutBlocked(relays, snapshot);
    }

    private static boolean mentions(List<String> keys, String pubkey) {
        return keys != null && keys.contains(pubkey);
    }

    private static List<String> outboxOrDiscovery(ResolverSnapshot snapshot) {
        return snapshot.myOutbox().isEmpty() ? snapshot.discovery() : snapshot.myOutbox();
    }

    private static List<String> withoutBlocked(LinkedHashSet<String> relays, ResolverSnapshot snapshot) {
        List<String> out = new ArrayList<>(relays);
        out.removeAll(snapshot.myBlocked());
        return out;
    }
}
