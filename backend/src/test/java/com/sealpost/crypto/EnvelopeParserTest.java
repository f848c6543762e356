package com.sealpost.crypto;

import com.sealpost.event.EventJson;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Each envelope layer is parsed on its own and rejects anything that is not exactly its shape.
 */
class EnvelopeParserTest {

    private static final long NOW = 1_700_000_000L;

    private final LocalKeySigner sender = LocalKeySigner.generate();
    private final LocalKeySigner recipient = LocalKeySigner.generate();

    @Test
    void acceptsWellFormedGiftWrap() throws Exception {
        NostrEvent wrap = signedWrap(List.of(List.of("p", recipient.publicKey())));

        Envelope.GiftWrap parsed = EnvelopeParser.parseGiftWrap(wrap);

        assertEquals(recipient.publicKey(), parsed.recipient());
    }

    @Test
    void giftWrapWithoutRecipientTagIsRejected() {
        NostrEvent wrap = signedWrap(List.of());

        MalformedEnvelopeException e = assertThrows(MalformedEnvelopeException.class,
                () -> EnvelopeParser.parseGiftWrap(wrap));
        assertTrue(e.getMessage().contains("recipient"));
    }

    @Test
    void giftWrapWithWrongKindOrBadSignatureIsRejected() {
        NostrEvent seal = sender.sign(NostrEvent.unsigned(sender.publicKey(), NOW, EventKinds.SEAL, List.of(), "x"));
        assertThrows(MalformedEnvelopeException.class, () -> EnvelopeParser.parseGiftWrap(seal));

        NostrEvent wrap = signedWrap(List.of(List.of("p", recipient.publicKey())));
        NostrEvent tampered = new NostrEvent(wrap.id(), wrap.pubkey(), wrap.createdAt(), wrap.kind(), wrap.tags(),
                "other-content", wrap.sig());
        assertThrows(MalformedEnvelopeException.class, () -> EnvelopeParser.parseGiftWrap(tampered));

        NostrEvent unsigned = NostrEvent.unsigned(sender.publicKey(), NOW, EventKinds.GIFT_WRAP,
                List.of(List.of("p", recipient.publicKey())), "ciphertext");
        assertThrows(MalformedEnvelopeException.class, () -> EnvelopeParser.parseGiftWrap(unsigned));
    }

    @Test
    void sealMustBeValidJsonOfKindThirteen() {
        assertThrows(MalformedEnvelopeException.class, () -> EnvelopeParser.parseSeal("{not json"));
        assertThrows(MalformedEnvelopeException.class, () -> EnvelopeParser.parseSeal(""));

        NostrEvent wrongKind = sender.sign(NostrEvent.unsigned(sender.publicKey(), NOW,
                EventKinds.PRIVATE_MESSAGE, List.of(), "x"));
        assertThrows(MalformedEnvelopeException.class, () -> EnvelopeParser.parseSeal(EventJson.toJson(wrongKind)));
    }

    @Test
    void innerMessageMustBeUnsignedAndAuthoredBySealSigner() throws Exception {
        Envelope.Seal seal = EnvelopeParser.parseSeal(EventJson.toJson(
                sender.sign(NostrEvent.unsigned(sender.publicKey(), NOW, EventKinds.SEAL, List.of(), "sealed"))));

        NostrEvent inner = NostrEvent.unsigned(sender.publicKey(), NOW, EventKinds.PRIVATE_MESSAGE,
                List.of(List.of("p", recipient.publicKey())), "hello");
        Envelope.InnerMessage parsed = EnvelopeParser.parseInnerMessage(EventJson.toJson(inner), seal);
        assertEquals(List.of(recipient.publicKey()), parsed.recipients());
        assertEquals(sender.publicKey(), parsed.sender());

        NostrEvent impostor = NostrEvent.unsigned(recipient.publicKey(), NOW, EventKinds.PRIVATE_MESSAGE,
                List.of(List.of("p", sender.publicKey())), "spoofed");
        assertThrows(MalformedEnvelopeException.class,
                () -> EnvelopeParser.parseInnerMessage(EventJson.toJson(impostor), seal));

        NostrEvent signedInner = sender.sign(inner);
        assertThrows(MalformedEnvelopeException.class,
                () -> EnvelopeParser.parseInnerMessage(EventJson.toJson(signedInner), seal));
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private NostrEvent signedWrap(List<List<String>> tags) {
        LocalKeySigner ephemeral = LocalKeySigner.generate();
        return ephemeral.sign(NostrEvent.unsigned(ephemeral.publicKey(), NOW, EventKinds.GIFT_WRAP, tags,
                "ciphertext"));
    }
}
