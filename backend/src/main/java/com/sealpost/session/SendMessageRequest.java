package com.sealpost.session;

import com.sealpost.conversation.Attachment;
import com.sealpost.conversation.ConversationId;
import com.sealpost.conversation.Protocol;
import com.sealpost.crypto.Secp256k1;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * An outgoing direct message. Either {@code recipients} or {@code conversationId} names who it
 * goes to; {@code protocol} defaults to {@link Protocol#PRIVATE}.
 */
public record SendMessageRequest(
        List<String> recipients,
        String conversationId,
        String content,
        Protocol protocol,
        List<Attachment> attachments,
        String subject
) {

    public SendMessageRequest {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        content = content == null ? "" : content;
        protocol = protocol == null ? Protocol.PRIVATE : protocol;
    }

    public static SendMessageRequest to(List<String> recipients, String content, Protocol protocol) {
        return new SendMessageRequest(recipients, null, content, protocol, List.of(), null);
    }

    /**
     * Recipients without the sender, or the sender alone for a note to self.
     *
     * @throws IllegalArgumentException when nobody valid is addressed or there is nothing to send
     */
    public List<String> resolveRecipients(String localPubkey) {
        if (content.isBlank() && attachments.isEmpty()) {
            throw new IllegalArgumentException("Message has no content");
        }
        LinkedHashSet<String> resolved = new LinkedHashSet<>(recipients);
        if (resolved.isEmpty() && conversationId != null) {
            if (!ConversationId.isValid(conversationId)) {
                throw new IllegalArgumentException("Invalid conversation id: " + conversationId);
            }
            resolved.addAll(ConversationId.participants(conversationId));
            if (resolved.size() > 1) {
                resolved.remove(localPubkey);
            }
        }
        if (resolved.isEmpty()) {
            throw new IllegalArgumentException("Message has no recipients");
        }
        for (String recipient : resolved) {
            if (!Secp256k1.isValidPublicKey(recipient)) {
                throw new IllegalArgumentException("Invalid recipient public key: " + recipient);
            }
        }
        return new ArrayList<>(resolved);
    }
}
