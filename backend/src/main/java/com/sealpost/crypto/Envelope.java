package com.sealpost.crypto;

import com.sealpost.event.NostrEvent;

import java.util.List;

/**
 * The three layers of a private message. Each layer is produced only by
 * {@link EnvelopeParser}, so holding one means its shape has been checked.
 */
public sealed interface Envelope permits Envelope.GiftWrap, Envelope.Seal, Envelope.InnerMessage {

    NostrEvent event();

    /** Outer kind 1059 event, signed by a throwaway key, addressed to one recipient. */
    record GiftWrap(NostrEvent event, String recipient) implements Envelope {
    }

    /** Kind 13 event signed by the real sender. */
    record Seal(NostrEvent event) implements Envelope {

        public String sender() {
            return event.pubkey();
        }
    }

    /** Unsigned kind 14/15 event carrying the plaintext and the full recipient list. */
    record InnerMessage(NostrEvent event, List<String> recipients) implements Envelope {

        public InnerMessage {
            recipients = List.copyOf(recipients);
        }

        public String sender() {
            return event.pubkey();
        }
    }
}
