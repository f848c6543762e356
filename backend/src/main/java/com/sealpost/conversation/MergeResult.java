package com.sealpost.conversation;

import java.util.List;

/**
 * New state plus the messages that were not present before (reconciled placeholders included).
 */
public record MergeResult(MessagingState state, List<Message> added) {

    public MergeResult {
        added = List.copyOf(added);
    }

    public boolean changed() {
        return !added.isEmpty();
    }
}
