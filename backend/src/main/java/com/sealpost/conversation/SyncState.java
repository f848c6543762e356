package com.sealpost.conversation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Persisted sync bookkeeping used by warm starts. Timestamps are epoch seconds.
 *
 * @param lastCacheTime     when the last completed sync pass was persisted, null before the first
 * @param queriedRelays     every relay queried so far
 * @param queryLimitReached whether the last pass stopped at the query ceiling
 * @param cursors           newest processed timestamp per protocol from live subscriptions
 */
public record SyncState(
        Long lastCacheTime,
        List<String> queriedRelays,
        boolean queryLimitReached,
        Map<Protocol, Long> cursors
) {

    public SyncState {
        queriedRelays = queriedRelays == null ? List.of() : List.copyOf(queriedRelays);
        cursors = cursors == null || cursors.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(cursors));
    }

    public static SyncState empty() {
        return new SyncState(null, List.of(), false, Map.of());
    }

    public SyncState withCompletedPass(long time, Collection<String> relays, boolean limitReached) {
        LinkedHashSet<String> all = new LinkedHashSet<>(queriedRelays);
        all.addAll(relays);
        return new SyncState(time, new ArrayList<>(all), limitReached, cursors);
    }

    public SyncState withCursor(Protocol protocol, long timestamp) {
        Long current = cursors.get(protocol);
        if (current != null && current >= timestamp) {
            return this;
        }
        Map<Protocol, Long> next = new EnumMap<>(Protocol.class);
        next.putAll(cursors);
        next.put(protocol, timestamp);
        return new SyncState(lastCacheTime, queriedRelays, queryLimitReached, next);
    }

    public long cursorOrCacheTime(Protocol protocol, long fallback) {
        Long cursor = cursors.get(protocol);
        if (cursor != null) {
            return cursor;
        }
        return lastCacheTime != null ? lastCacheTime : fallback;
    }
}
