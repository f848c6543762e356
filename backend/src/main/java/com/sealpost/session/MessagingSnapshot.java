package com.sealpost.session;

import com.sealpost.conversation.Conversation;
import com.sealpost.conversation.Message;
import com.sealpost.relay.RelayHealth;
import com.sealpost.sync.RelayError;
import com.sealpost.sync.ScanProgress;
import com.sealpost.sync.SyncPhase;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What the UI renders: conversations newest first, their messages oldest first, and the sync
 * status of the session.
 *
 * @param failedPhases phases of the current pass that ended in error
 * @param relayError   banner for the last query that failed on every relay, until dismissed
 * @param lastSync     epoch seconds of the last completed pass, null before the first
 */
public record MessagingSnapshot(
        String localPubkey,
        List<Conversation> conversations,
        Map<String, List<Message>> perConversationMessages,
        SyncPhase syncPhase,
        Set<SyncPhase> failedPhases,
        Map<String, RelayHealth> relayHealth,
        List<ScanProgress> scanProgress,
        RelayError relayError,
        List<String> notices,
        List<String> subscriptions,
        Long lastSync
) {
}
