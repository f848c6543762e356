package com.sealpost.session;

import java.util.List;

/**
 * A routing document to publish: kind 10002 (relay list), 10050 (DM inbox) or 10006 (blocked).
 */
public record RelayListRequest(int kind, List<String> relays) {

    public RelayListRequest {
        relays = relays == null ? List.of() : List.copyOf(relays);
    }
}
