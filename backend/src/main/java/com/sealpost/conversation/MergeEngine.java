package com.sealpost.conversation;

import com.sealpost.relay.Participant;
import com.sealpost.relay.RelayHealth;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds incoming messages into a {@link MessagingState}. Pure: the same inputs always give the
 * same output and nothing is mutated.
 *
 * <ul>
 *   <li>Dedup by {@link Message#dedupKey()}; when both copies exist the one already in the state wins.</li>
 *   <li>Every touched conversation is re-sorted by {@code createdAt} ascending and its metadata is
 *       rebuilt from the sorted list.</li>
 *   <li>An incoming confirmed message from the local user replaces a pending placeholder with the
 *       same content in the same conversation if the timestamps are within the tolerance. The
 *       placeholder's {@code createdAt} and {@code clientFirstSeen} are kept.</li>
 * </ul>
 */
public class MergeEngine {

    private static final Comparator<Message> BY_CREATED_AT = Comparator.comparingLong(Message::createdAt);

    private final String localPubkey;
    private final Duration reconcileTolerance;

    public MergeEngine(String localPubkey, Duration reconcileTolerance) {
        this.localPubkey = localPubkey;
        this.reconcileTolerance = reconcileTolerance;
    }

    public MergeResult merge(MessagingState state, Collection<Message> incoming) {
        Map<String, List<Message>> byConversation = new LinkedHashMap<>();
        for (Message message : incoming) {
            byConversation.computeIfAbsent(message.conversationId(), id -> new ArrayList<>()).add(message);
        }

        Map<String, List<Message>> messages = new HashMap<>(state.messages());
        Map<String, Conversation> conversations = new HashMap<>(state.conversations());
        List<Message> added = new ArrayList<>();

        byConversation.forEach((conversationId, batch) -> {
            List<Message> current = new ArrayList<>(state.messagesOf(conversationId));
            Set<String> keys = new HashSet<>();
            current.forEach(message -> keys.add(message.dedupKey()));
            boolean touched = false;

            for (Message message : batch) {
                if (!keys.add(message.dedupKey())) {
                    continue;
                }
                int placeholder = findPlaceholder(current, message);
                if (placeholder >= 0) {
                    Message reconciled = message.reconciledFrom(current.get(placeholder));
                    current.set(placeholder, reconciled);
                    added.add(reconciled);
                } else {
                    current.add(message);
                    added.add(message);
                }
                touched = true;
            }

            if (touched) {
                current.sort(BY_CREATED_AT);
                List<Message> sorted = List.copyOf(current);
                messages.put(conversationId, sorted);
                conversations.put(conversationId, describe(conversationId, sorted));
            }
        });

        if (added.isEmpty()) {
            return new MergeResult(state, List.of());
        }
        return new MergeResult(new MessagingState(state.participants(), conversations, messages,
                state.syncState(), state.relayHealth()), added);
    }

    /** Inserts an optimistic placeholder for a message that is being sent. */
    public MergeResult addPending(MessagingState state, Message placeholder) {
        if (!placeholder.pending()) {
            throw new IllegalArgumentException("Placeholder must be pending");
        }
        return merge(state, List.of(placeholder));
    }

    /** Attaches a send error to a placeholder whose publish failed. Unknown ids leave the state as is. */
    public MessagingState markSendFailed(MessagingState state, String conversationId, String placeholderId,
                                         String error) {
        List<Message> current = state.messagesOf(conversationId);
        List<Message> updated = new ArrayList<>(current.size());
        boolean found = false;
        for (Message message : current) {
            if (message.pending() && message.id().equals(placeholderId)) {
                updated.add(message.withSendError(error));
                found = true;
            } else {
                updated.add(message);
            }
        }
        if (!found) {
            return state;
        }
        Map<String, List<Message>> messages = new HashMap<>(state.messages());
        messages.put(conversationId, List.copyOf(updated));
        Map<String, Conversation> conversations = new HashMap<>(state.conversations());
        conversations.put(conversationId, describe(conversationId, updated));
        return new MessagingState(state.participants(), conversations, messages, state.syncState(),
                state.relayHealth());
    }

    /** Participants are merged, never removed. {@code incoming} replaces entries with the same key. */
    public static MessagingState mergeParticipants(MessagingState state, Map<String, Participant> incoming) {
        if (incoming.isEmpty()) {
            return state;
        }
        Map<String, Participant> participants = new HashMap<>(state.participants());
        participants.putAll(incoming);
        return state.withParticipants(participants);
    }

    public static MessagingState mergeRelayHealth(MessagingState state, Map<String, RelayHealth> newer,
                                                  Collection<String> blockedRelays) {
        Map<String, RelayHealth> merged = RelayHealth.merge(state.relayHealth(), newer);
        return state.withRelayHealth(RelayHealth.markBlocked(merged, blockedRelays));
    }

    private int findPlaceholder(List<Message> current, Message incoming) {
        if (incoming.pending() || !localPubkey.equals(incoming.senderPubkey()) || incoming.failedToDecrypt()) {
            return -1;
        }
        long tolerance = reconcileTolerance.getSeconds();
        for (int i = 0; i < current.size(); i++) {
            Message candidate = current.get(i);
            if (candidate.pending()
                    && candidate.protocol() == incoming.protocol()
                    && candidate.content().equals(incoming.content())
                    && Math.abs(candidate.createdAt() - incoming.createdAt()) <= tolerance) {
                return i;
            }
        }
        return -1;
    }

    private Conversation describe(String conversationId, List<Message> sorted) {
        Message last = sorted.get(sorted.size() - 1);
        boolean known = false;
        boolean hasLegacy = false;
        boolean hasPrivate = false;
        boolean hasErrors = false;
        String subject = "";
        boolean subjectFound = false;

        for (int i = sorted.size() - 1; i >= 0; i--) {
            Message message = sorted.get(i);
            known |= localPubkey.equals(message.senderPubkey());
            hasLegacy |= message.protocol() == Protocol.LEGACY;
            hasPrivate |= message.protocol() == Protocol.PRIVATE;
            hasErrors |= message.failedToDecrypt();
            if (!subjectFound && message.protocol() == Protocol.PRIVATE && !message.failedToDecrypt()) {
                subject = message.subject().orElse("");
                subjectFound = true;
            }
        }

        return new Conversation(
                conversationId,
                ConversationId.participants(conversationId),
                subject,
                last.createdAt(),
                last.previewText(),
                last.decryptionError() != null ? last.decryptionError() : last.sendError(),
                known,
                !known,
                hasLegacy,
                hasPrivate,
                hasErrors);
    }
}
