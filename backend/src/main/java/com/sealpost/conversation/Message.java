package com.sealpost.conversation;

import com.sealpost.event.NostrEvent;

import java.util.List;
import java.util.Optional;

/**
 * A decrypted (or undecryptable) direct message.
 *
 * <p>{@code rawEnvelope} is the event as it came off the wire: the kind 4 event for legacy
 * messages, the kind 1059 gift wrap for private ones. It is what gets persisted; the
 * plaintext is re-derived from it on load.
 */
public record Message(
        String id,
        Protocol protocol,
        int kind,
        String senderPubkey,
        long createdAt,
        String content,
        List<List<String>> tags,
        List<Attachment> attachments,
        String conversationId,
        String giftWrapId,
        NostrEvent rawEnvelope,
        String decryptionError,
        boolean pending,
        String sendError,
        Long clientFirstSeen
) {

    public Message {
        tags = tags == null ? List.of() : List.copyOf(tags);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        content = content == null ? "" : content;
    }

    /** Gift-wrap id for private messages, event id otherwise. */
    public String dedupKey() {
        return giftWrapId != null ? giftWrapId : id;
    }

    public boolean failedToDecrypt() {
        return decryptionError != null;
    }

    public Optional<String> subject() {
        return tags.stream()
                .filter(tag -> tag.size() > 1 && "subject".equals(tag.get(0)))
                .map(tag -> tag.get(1))
                .findFirst();
    }

    public String previewText() {
        if (decryptionError != null) {
            return "";
        }
        String text = content;
        for (Attachment attachment : attachments) {
            text = text.replace(attachment.url(), "");
        }
        text = text.strip();
        if (kind == 15) {
            return text.isEmpty() ? "[Attachment]" : "[Attachment] " + text;
        }
        return text;
    }

    public Message reconciledFrom(Message placeholder) {
        return new Message(id, protocol, kind, senderPubkey, placeholder.createdAt(), content, tags, attachments,
                conversationId, giftWrapId, rawEnvelope, decryptionError, false, null,
                placeholder.clientFirstSeen());
    }

    public Message withSendError(String error) {
        return new Message(id, protocol, kind, senderPubkey, createdAt, content, tags, attachments,
                conversationId, giftWrapId, rawEnvelope, decryptionError, pending, error, clientFirstSeen);
    }

    public Message withClientFirstSeen(Long firstSeen) {
        return new Message(id, protocol, kind, senderPubkey, createdAt, content, tags, attachments,
                conversationId, giftWrapId, rawEnvelope, decryptionError, pending, sendError, firstSeen);
    }
}
