package com.sealpost.sync;

import com.sealpost.conversation.Protocol;
import com.sealpost.event.EventFilter;
import com.sealpost.event.EventKinds;

import java.util.List;

/**
 * The three independently paginated filter streams of a query pass.
 */
enum QueryStream {

    LEGACY_TO_ME(Protocol.LEGACY),
    LEGACY_FROM_ME(Protocol.LEGACY),
    PRIVATE_TO_ME(Protocol.PRIVATE);

    private final Protocol protocol;

    QueryStream(Protocol protocol) {
        this.protocol = protocol;
    }

    Protocol protocol() {
        return protocol;
    }

    EventFilter filter(String localPubkey) {
        return switch (this) {
            case LEGACY_TO_ME -> EventFilter.ofKinds(EventKinds.LEGACY_DIRECT_MESSAGE).recipients(List.of(localPubkey));
            case LEGACY_FROM_ME -> EventFilter.ofKinds(EventKinds.LEGACY_DIRECT_MESSAGE).authors(List.of(localPubkey));
            case PRIVATE_TO_ME -> EventFilter.ofKinds(EventKinds.GIFT_WRAP).recipients(List.of(localPubkey));
        };
    }
}
