package com.sealpost.conversation;

import com.sealpost.relay.Participant;
import com.sealpost.relay.RelayHealth;

import java.util.List;
import java.util.Map;

/**
 * Canonical, immutable messaging state of one user. New states are produced only by
 * {@link MergeEngine}.
 */
public record MessagingState(
        Map<String, Participant> participants,
        Map<String, Conversation> conversations,
        Map<String, List<Message>> messages,
        SyncState syncState,
        Map<String, RelayHealth> relayHealth
) {

    public MessagingState {
        participants = Map.copyOf(participants);
        conversations = Map.copyOf(conversations);
        messages = Map.copyOf(messages);
        syncState = syncState == null ? SyncState.empty() : syncState;
        relayHealth = Map.copyOf(relayHealth);
    }

    public static MessagingState empty() {
        return new MessagingState(Map.of(), Map.of(), Map.of(), SyncState.empty(), Map.of());
    }

    public List<Message> messagesOf(String conversationId) {
        return messages.getOrDefault(conversationId, List.of());
    }

    public int messageCount() {
        return messages.values().stream().mapToInt(List::size).sum();
    }

    public MessagingState withSyncState(SyncState next) {
        return new MessagingState(participants, conversations, messages, next, relayHealth);
    }

    public MessagingState withParticipants(Map<String, Participant> next) {
        return new MessagingState(next, conversations, messages, syncState, relayHealth);
    }

    public MessagingState withRelayHealth(Map<String, RelayHealth> next) {
        return new MessagingState(participants, conversations, messages, syncState, next);
    }
}
