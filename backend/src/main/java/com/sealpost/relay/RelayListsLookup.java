package com.sealpost.relay;

import java.util.List;
import java.util.Map;

/**
 * Routing documents fetched for a set of pubkeys, with the health of each discovery relay that
 * answered. {@code answered} is false when no discovery relay produced a successful response.
 */
public record RelayListsLookup(Map<String, RelayLists> lists, Map<String, RelayHealth> health, boolean answered,
                               List<String> errors) {

    public RelayListsLookup {
        lists = Map.copyOf(lists);
        health = Map.copyOf(health);
        errors = List.copyOf(errors);
    }

    public RelayLists listsFor(String pubkey) {
        return lists.getOrDefault(pubkey, RelayLists.EMPTY);
    }
}
