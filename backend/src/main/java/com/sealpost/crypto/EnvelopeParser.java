package com.sealpost.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sealpost.event.EventJson;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;

import java.util.List;

/**
 * Fallible per-layer parsers for private message envelopes. Anything that is not exactly the
 * expected layer is rejected with {@link MalformedEnvelopeException}.
 */
public final class EnvelopeParser {

    private EnvelopeParser() {
    }

    public static Envelope.GiftWrap parseGiftWrap(NostrEvent event) throws MalformedEnvelopeException {
        if (event == null) {
            throw new MalformedEnvelopeException("Gift wrap is missing");
        }
        if (event.kind() != EventKinds.GIFT_WRAP) {
            throw new MalformedEnvelopeException("Expected gift wrap kind 1059, got " + event.kind());
        }
        requireBasics(event, "Gift wrap");
        String recipient = event.firstTagValue("p")
                .orElseThrow(() -> new MalformedEnvelopeException("Gift wrap has no recipient tag"));
        if (!EventVerifier.verify(event)) {
            throw new MalformedEnvelopeException("Gift wrap signature is invalid");
        }
        return new Envelope.GiftWrap(event, recipient);
    }

    public static Envelope.Seal parseSeal(String json) throws MalformedEnvelopeException {
        NostrEvent event = parseJson(json, "Seal");
        if (event.kind() != EventKinds.SEAL) {
            throw new MalformedEnvelopeException("Expected seal kind 13, got " + event.kind());
        }
        requireBasics(event, "Seal");
        if (!EventVerifier.verify(event)) {
            throw new MalformedEnvelopeException("Seal signature is invalid");
        }
        return new Envelope.Seal(event);
    }

    public static Envelope.InnerMessage parseInnerMessage(String json, Envelope.Seal seal)
            throws MalformedEnvelopeException {
        NostrEvent event = parseJson(json, "Inner message");
        if (!EventKinds.isInnerMessage(event.kind())) {
            throw new MalformedEnvelopeException("Expected inner message kind 14 or 15, got " + event.kind());
        }
        if (event.pubkey() == null || !event.pubkey().equals(seal.sender())) {
            throw new MalformedEnvelopeException("Inner message author does not match seal signer");
        }
        if (event.sig() != null) {
            throw new MalformedEnvelopeException("Inner message must not be signed");
        }
        List<String> recipients = event.tagValues("p");
        return new Envelope.InnerMessage(event, recipients);
    }

    private static NostrEvent parseJson(String json, String layer) throws MalformedEnvelopeException {
        if (json == null || json.isBlank()) {
            throw new MalformedEnvelopeException(layer + " is empty");
        }
        try {
            NostrEvent event = EventJson.parse(json);
            if (event == null) {
                throw new MalformedEnvelopeException(layer + " is not an event");
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException(layer + " is not valid JSON", e);
        }
    }

    private static void requireBasics(NostrEvent event, String layer) throws MalformedEnvelopeException {
        if (event.pubkey() == null || event.pubkey().length() != 64) {
            throw new MalformedEnvelopeException(layer + " has no valid pubkey");
        }
        if (event.content().isBlank()) {
            throw new MalformedEnvelopeException(layer + " has no content");
        }
        if (!event.isSigned()) {
            throw new MalformedEnvelopeException(layer + " is not signed");
        }
    }
}
