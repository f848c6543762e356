package com.sealpost.relay;

import com.sealpost.event.EventFilter;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelayRouterTest {

    private static final String ME = "a".repeat(64);
    private static final String BOB = "b".repeat(64);
    private static final String STRANGER = "c".repeat(64);
    private static final List<String> DISCOVERY = List.of("wss://discovery.test");

    private final ResolverSnapshot snapshot = ResolverSnapshot.of(ME, DISCOVERY, List.of("wss://my-write.test"),
            Map.of(
                    ME, new Participant(ME, List.of("wss://my-inbox.test", "wss://spam.test"),
                            List.of("wss://spam.test"), 0),
                    BOB, new Participant(BOB, List.of("wss://bob-inbox.test", "wss://spam.test"), List.of(), 0)));

    private static NostrEvent event(int kind, String... recipients) {
        List<List<String>> tags = Arrays.stream(recipients).map(p -> List.of("p", p)).toList();
        return new NostrEvent("id", ME, 100, kind, tags, "", "sig");
    }

    @Test
    void giftWrapGoesToTheRecipientInbox() {
        assertEquals(List.of("wss://bob-inbox.test"), RelayRouter.routeEvent(event(EventKinds.GIFT_WRAP, BOB), snapshot),
                "my blocked relays are never contacted");
    }

    @Test
    void giftWrapToAStrangerGoesToDiscovery() {
        assertEquals(DISCOVERY, RelayRouter.routeEvent(event(EventKinds.GIFT_WRAP, STRANGER), snapshot));
    }

    @Test
    void giftWrapToMyselfGoesToMyInbox() {
        assertEquals(List.of("wss://my-inbox.test"), RelayRouter.routeEvent(event(EventKinds.GIFT_WRAP, ME), snapshot));
    }

    @Test
    void legacyMessageGoesToBothInboxes() {
        assertEquals(List.of("wss://my-inbox.test", "wss://bob-inbox.test"),
                RelayRouter.routeEvent(event(EventKinds.LEGACY_DIRECT_MESSAGE, BOB), snapshot));
    }

    @Test
    void routingDocumentsGoToOutboxAndDiscovery() {
        NostrEvent list = new NostrEvent("id", ME, 100, EventKinds.DM_INBOX_RELAYS,
                List.of(List.of("relay", "wss://new-inbox.test")), "", "sig");

        assertEquals(List.of("wss://my-write.test", "wss://new-inbox.test", "wss://discovery.test"),
                RelayRouter.routeEvent(list, snapshot));
    }

    @Test
    void messageFiltersGoToMyInbox() {
        EventFilter toMe = EventFilter.ofKinds(EventKinds.GIFT_WRAP).recipients(List.of(ME));
        EventFilter fromMe = EventFilter.ofKinds(EventKinds.LEGACY_DIRECT_MESSAGE).authors(List.of(ME));

        assertEquals(List.of("wss://my-inbox.test"), RelayRouter.routeFilter(toMe, snapshot));
        assertEquals(List.of("wss://my-inbox.test"), RelayRouter.routeFilter(fromMe, snapshot));
    }

    @Test
    void routingDocumentFiltersGoToDiscovery() {
        EventFilter filter = EventFilter.ofKinds(EventKinds.RELAY_LIST, EventKinds.DM_INBOX_RELAYS)
                .authors(List.of(ME));

        assertEquals(DISCOVERY, RelayRouter.routeFilter(filter, snapshot));
    }

    @Test
    void snapshotWithoutSelfEntryFallsBackToDiscovery() {
        ResolverSnapshot empty = ResolverSnapshot.of(ME, DISCOVERY, List.of(), Map.of());

        assertEquals(DISCOVERY, empty.inboxOf(ME));
        assertEquals(DISCOVERY, RelayRouter.routeEvent(event(1), empty));
    }
}
