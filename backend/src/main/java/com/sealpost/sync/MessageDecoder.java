package com.sealpost.sync;

import com.sealpost.conversation.Attachment;
import com.sealpost.conversation.ConversationId;
import com.sealpost.conversation.Message;
import com.sealpost.conversation.Protocol;
import com.sealpost.crypto.CodecResult;
import com.sealpost.crypto.CryptoCodec;
import com.sealpost.crypto.DecryptFailure;
import com.sealpost.crypto.LegacyDecrypted;
import com.sealpost.crypto.Unwrapped;
import com.sealpost.event.EventJson;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Turns wire events (kind 4 and kind 1059) into {@link Message}s.
 *
 * <p>Events that are not direct messages at all are dropped. Events that are direct messages
 * but cannot be opened become error placeholders so the conversation shows them.
 */
public class MessageDecoder {

    private static final Logger log = LoggerFactory.getLogger(MessageDecoder.class);

    static final String UNABLE_TO_DECRYPT = "Unable to decrypt";

    private final CryptoCodec codec;
    private final Clock clock;
    private final Duration recentThreshold;

    public MessageDecoder(CryptoCodec codec, Clock clock, Duration recentThreshold) {
        this.codec = codec;
        this.clock = clock;
        this.recentThreshold = recentThreshold;
    }

    public List<Message> decodeAll(Collection<NostrEvent> events) {
        List<Message> messages = new ArrayList<>(events.size());
        int failed = 0;
        for (NostrEvent event : events) {
            Optional<Message> message = decode(event);
            if (message.isEmpty()) {
                continue;
            }
            if (message.get().failedToDecrypt()) {
                failed++;
            }
            messages.add(message.get());
        }
        if (failed > 0) {
            log.info("Decoded {} direct messages, {} could not be decrypted", messages.size(), failed);
        }
        return messages;
    }

    public Optional<Message> decode(NostrEvent event) {
        if (event.id() == null || event.pubkey() == null) {
            return Optional.empty();
        }
        return switch (event.kind()) {
            case EventKinds.LEGACY_DIRECT_MESSAGE -> decodeLegacy(event);
            case EventKinds.GIFT_WRAP -> Optional.of(decodePrivate(event));
            default -> Optional.empty();
        };
    }

    private Optional<Message> decodeLegacy(NostrEvent event) {
        Optional<String> recipient = event.firstTagValue("p");
        if (recipient.isEmpty() || event.content().isBlank()) {
            return Optional.empty();
        }
        CodecResult<LegacyDecrypted> result = codec.decryptLegacy(event);
        if (result instanceof CodecResult.Ok<LegacyDecrypted> ok) {
            LegacyDecrypted decrypted = ok.value();
            return Optional.of(new Message(event.id(), Protocol.LEGACY, event.kind(), event.pubkey(),
                    event.createdAt(), decrypted.plaintext(), event.tags(), List.of(), decrypted.conversationId(),
                    null, event, null, false, null, firstSeen(event.createdAt())));
        }
        DecryptFailure failure = ((CodecResult.Failed<LegacyDecrypted>) result).failure();
        if (failure.reason() == DecryptFailure.Reason.MALFORMED_ENVELOPE) {
            log.debug("Dropping legacy event {}: {}", event.id(), failure.detail());
            return Optional.empty();
        }
        return Optional.of(new Message(event.id(), Protocol.LEGACY, event.kind(), event.pubkey(),
                event.createdAt(), "", event.tags(), List.of(), ConversationId.of(event.pubkey(), recipient.get()),
                null, event, UNABLE_TO_DECRYPT, false, null, firstSeen(event.createdAt())));
    }

    private Message decodePrivate(NostrEvent giftWrap) {
        CodecResult<Unwrapped> result = codec.unwrap(giftWrap);
        if (result instanceof CodecResult.Ok<Unwrapped> ok) {
            Unwrapped unwrapped = ok.value();
            NostrEvent inner = unwrapped.innerMessage().event();
            String id = inner.id() != null ? inner.id() : EventJson.computeId(inner);
            return new Message(id, Protocol.PRIVATE, inner.kind(), unwrapped.seal().sender(), inner.createdAt(),
                    inner.content(), inner.tags(), Attachment.fromTags(inner.tags()), unwrapped.conversationId(),
                    giftWrap.id(), giftWrap, null, false, null, firstSeen(inner.createdAt()));
        }
        DecryptFailure failure = ((CodecResult.Failed<Unwrapped>) result).failure();
        log.debug("Gift wrap {} kept as error placeholder: {}", giftWrap.id(), failure.describe());
        return new Message(giftWrap.id(), Protocol.PRIVATE, giftWrap.kind(), giftWrap.pubkey(),
                giftWrap.createdAt(), "", List.of(), List.of(), ConversationId.of(giftWrap.pubkey()),
                giftWrap.id(), giftWrap, UNABLE_TO_DECRYPT, false, null, null);
    }

    private Long firstSeen(long createdAt) {
        long nowMillis = clock.millis();
        return createdAt * 1000 >= nowMillis - recentThreshold.toMillis() ? nowMillis : null;
    }
}
