package com.sealpost.relay;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Relay URL normalization: trimmed, no trailing slash, websocket schemes only.
 */
public final class RelayUrls {

    private RelayUrls() {
    }

    public static String normalize(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public static boolean isValid(String url) {
        String normalized = normalize(url);
        return normalized != null
                && (normalized.startsWith("wss://") || normalized.startsWith("ws://"))
                && normalized.length() > "ws://".length();
    }

    /** Normalized, valid, de-duplicated, first occurrence wins. */
    public static List<String> clean(Collection<String> urls) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        urls.stream()
                .filter(Objects::nonNull)
                .filter(RelayUrls::isValid)
                .map(RelayUrls::normalize)
                .forEach(out::add);
        return List.copyOf(out);
    }
}
