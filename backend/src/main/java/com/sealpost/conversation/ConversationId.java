package com.sealpost.conversation;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Conversation identity: {@code "group:" + sorted unique participant keys joined by ","}.
 * The same participant set always yields the same id regardless of message order.
 */
public final class ConversationId {

    public static final String PREFIX = "group:";

    private ConversationId() {
    }

    public static String of(Collection<String> participantPubkeys) {
        TreeSet<String> sorted = new TreeSet<>();
        participantPubkeys.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(key -> !key.isEmpty())
                .forEach(sorted::add);
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("A conversation needs at least one participant");
        }
        return PREFIX + String.join(",", sorted);
    }

    public static String of(String... participantPubkeys) {
        return of(Arrays.asList(participantPubkeys));
    }

    public static List<String> participants(String conversationId) {
        if (conversationId == null || !conversationId.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Not a conversation id: " + conversationId);
        }
        String body = conversationId.substring(PREFIX.length());
        if (body.isEmpty()) {
            throw new IllegalArgumentException("Conversation id has no participants");
        }
        return List.of(body.split(","));
    }

    public static boolean isValid(String conversationId) {
        return conversationId != null
                && conversationId.startsWith(PREFIX)
                && conversationId.length() > PREFIX.length();
    }
}
