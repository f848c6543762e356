package com.sealpost.session;

import com.sealpost.conversation.Protocol;

import java.util.List;

/**
 * Outcome of a send that reached at least the recipients.
 *
 * @param placeholderId id of the optimistic placeholder shown while sending
 * @param eventIds      ids of the published wire events
 */
public record SendReceipt(String placeholderId, String conversationId, Protocol protocol, List<String> eventIds) {

    public SendReceipt {
        eventIds = List.copyOf(eventIds);
    }
}
