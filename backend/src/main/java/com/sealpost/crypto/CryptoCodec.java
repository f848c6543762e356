package com.sealpost.crypto;

import com.sealpost.conversation.ConversationId;
import com.sealpost.event.EventJson;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Encrypts and decrypts direct messages for one local identity.
 *
 * <p><strong>Legacy:</strong> one signed kind 4 event per message, readable by sender and the
 * single recipient.
 *
 * <p><strong>Private:</strong> inner message → seal (signed by the sender, encrypted for one
 * addressee) → gift wrap (signed by a one-off key, encrypted for the same addressee, timestamp
 * pushed up to {@link #GIFT_WRAP_FUZZ} into the past). One gift wrap is produced for every
 * recipient plus the sender's own copy. The one-off key is dropped as soon as the wrap is signed.
 */
public class CryptoCodec {

    private static final Logger log = LoggerFactory.getLogger(CryptoCodec.class);

    /** Maximum backdating of a gift wrap timestamp. */
    public static final Duration GIFT_WRAP_FUZZ = Duration.ofDays(2);

    private final Signer signer;
    private final Clock clock;

    public CryptoCodec(Signer signer, Clock clock) {
        this.signer = signer;
        this.clock = clock;
    }

    public String localPubkey() {
        return signer.publicKey();
    }

    // ── Legacy ────────────────────────────────────────────────────────────────

    public NostrEvent encryptLegacy(String recipientPubkey, String plaintext) throws GeneralSecurityException {
        return encryptLegacy(recipientPubkey, plaintext, List.of());
    }

    public NostrEvent encryptLegacy(String recipientPubkey, String plaintext, List<List<String>> extraTags)
            throws GeneralSecurityException {
        List<List<String>> tags = new ArrayList<>();
        tags.add(List.of("p", recipientPubkey));
        tags.addAll(extraTags);
        String content = signer.encryptLegacy(recipientPubkey, plaintext);
        return signer.sign(NostrEvent.unsigned(signer.publicKey(), now(), EventKinds.LEGACY_DIRECT_MESSAGE,
                tags, content));
    }

    public CodecResult<LegacyDecrypted> decryptLegacy(NostrEvent event) {
        if (event.kind() != EventKinds.LEGACY_DIRECT_MESSAGE) {
            return CodecResult.failed(DecryptFailure.malformed("expected kind 4, got " + event.kind()));
        }
        String recipient = event.firstTagValue("p").orElse(null);
        if (recipient == null) {
            return CodecResult.failed(DecryptFailure.malformed("legacy message has no recipient tag"));
        }
        if (!event.content().contains("?iv=")) {
            return CodecResult.failed(DecryptFailure.malformed("legacy payload has no iv"));
        }
        if (!EventVerifier.verify(event)) {
            return CodecResult.failed(DecryptFailure.malformed("legacy message signature is invalid"));
        }

        String me = signer.publicKey();
        String peer;
        if (me.equals(event.pubkey())) {
            peer = recipient;
        } else if (me.equals(recipient)) {
            peer = event.pubkey();
        } else {
            return CodecResult.failed(DecryptFailure.malformed("legacy message is not addressed to this user"));
        }

        try {
            String plaintext = signer.decryptLegacy(peer, event.content());
            return CodecResult.ok(new LegacyDecrypted(plaintext, peer, recipient,
                    ConversationId.of(event.pubkey(), recipient)));
        } catch (GeneralSecurityException e) {
            log.debug("Legacy message {} could not be decrypted: {}", event.id(), e.getMessage());
            return CodecResult.failed(DecryptFailure.decryption(e.getMessage()));
        }
    }

    // ── Private ───────────────────────────────────────────────────────────────

    public PrivateWraps wrapPrivate(Collection<String> recipients, String content, int kind,
                                    List<List<String>> extraTags) throws GeneralSecurityException {
        if (!EventKinds.isInnerMessage(kind)) {
            throw new IllegalArgumentException("Inner message kind must be 14 or 15, got " + kind);
        }
        Set<String> uniqueRecipients = new LinkedHashSet<>(recipients);
        if (uniqueRecipients.isEmpty()) {
            throw new IllegalArgumentException("A private message needs at least one recipient");
        }
        String me = signer.publicKey();
        long createdAt = now();

        List<List<String>> tags = new ArrayList<>();
        uniqueRecipients.forEach(recipient -> tags.add(List.of("p", recipient)));
        tags.addAll(extraTags);
        NostrEvent inner = NostrEvent.unsigned(me, createdAt, kind, tags, content);
        inner = inner.withId(EventJson.computeId(inner));
        String innerJson = EventJson.toJson(inner);

        Set<String> addressees = new LinkedHashSet<>(uniqueRecipients);
        addressees.add(me);

        List<PrivateWraps.AddressedWrap> wraps = new ArrayList<>();
        for (String addressee : addressees) {
            NostrEvent seal = signer.sign(NostrEvent.unsigned(me, createdAt, EventKinds.SEAL, List.of(),
                    signer.encryptPrivate(addressee, innerJson)));

            LocalKeySigner ephemeral = LocalKeySigner.generate();
            NostrEvent giftWrap = ephemeral.sign(NostrEvent.unsigned(ephemeral.publicKey(), fuzzedTimestamp(createdAt),
                    EventKinds.GIFT_WRAP, List.of(List.of("p", addressee)),
                    ephemeral.encryptPrivate(addressee, EventJson.toJson(seal))));
            wraps.add(new PrivateWraps.AddressedWrap(addressee, giftWrap));
        }

        List<String> participants = new ArrayList<>(uniqueRecipients);
        participants.add(me);
        return new PrivateWraps(inner, ConversationId.of(participants), wraps);
    }

    public CodecResult<Unwrapped> unwrap(NostrEvent event) {
        try {
            Envelope.GiftWrap giftWrap = EnvelopeParser.parseGiftWrap(event);
            String sealJson = signer.decryptPrivate(event.pubkey(), event.content());
            Envelope.Seal seal = EnvelopeParser.parseSeal(sealJson);
            String innerJson = signer.decryptPrivate(seal.sender(), seal.event().content());
            Envelope.InnerMessage inner = EnvelopeParser.parseInnerMessage(innerJson, seal);

            List<String> participants = new ArrayList<>(inner.recipients());
            participants.add(seal.sender());
            return CodecResult.ok(new Unwrapped(giftWrap, seal, inner, ConversationId.of(participants)));
        } catch (MalformedEnvelopeException e) {
            log.debug("Gift wrap {} rejected: {}", event.id(), e.getMessage());
            return CodecResult.failed(DecryptFailure.malformed(e.getMessage()));
        } catch (GeneralSecurityException e) {
            log.debug("Gift wrap {} could not be decrypted: {}", event.id(), e.getMessage());
            return CodecResult.failed(DecryptFailure.decryption(e.getMessage()));
        }
    }

    long fuzzedTimestamp(long createdAt) {
        return createdAt - ThreadLocalRandom.current().nextLong(GIFT_WRAP_FUZZ.getSeconds());
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
