package com.sealpost.crypto;

import com.sealpost.event.NostrEvent;

import java.util.List;

/**
 * The shared inner message and one gift wrap per addressee (recipients plus the sender).
 */
public record PrivateWraps(NostrEvent innerMessage, String conversationId, List<AddressedWrap> wraps) {

    public PrivateWraps {
        wraps = List.copyOf(wraps);
    }

    public record AddressedWrap(String recipient, NostrEvent giftWrap) {
    }
}
