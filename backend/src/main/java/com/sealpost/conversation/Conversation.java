package com.sealpost.conversation;

import java.util.List;

/**
 * Per-conversation metadata, recomputed from the tail of its message list after every merge.
 */
public record Conversation(
        String id,
        List<String> participantPubkeys,
        String subject,
        long lastActivity,
        String lastMessagePreview,
        String lastMessageError,
        boolean known,
        boolean request,
        boolean hasLegacy,
        boolean hasPrivate,
        boolean hasDecryptionErrors
) {

    public Conversation {
        participantPubkeys = List.copyOf(participantPubkeys);
        subject = subject == null ? "" : subject;
    }
}
