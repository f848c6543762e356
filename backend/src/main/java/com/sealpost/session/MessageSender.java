package com.sealpost.session;

import com.sealpost.conversation.Attachment;
import com.sealpost.conversation.ConversationId;
import com.sealpost.conversation.MergeEngine;
import com.sealpost.conversation.Message;
import com.sealpost.conversation.Protocol;
import com.sealpost.crypto.CryptoCodec;
import com.sealpost.crypto.PrivateWraps;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import com.sealpost.relay.Participant;
import com.sealpost.relay.PublishReport;
import com.sealpost.relay.RelayRouter;
import com.sealpost.relay.RelaySetResolver;
import com.sealpost.relay.RelayTransport;
import com.sealpost.relay.ResolverSnapshot;
import com.sealpost.sync.MessageDecoder;
import com.sealpost.sync.MessagingStateHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Sends direct messages with an optimistic placeholder.
 *
 * <p>The placeholder is merged before anything is published. Once the relays accept the
 * message, the sender's own copy is decoded and merged, which replaces the placeholder. When
 * publishing fails the placeholder stays and carries the error.
 *
 * <p>LEGACY messages go to the first recipient only and are published to the union of the
 * sender's and the recipient's inbox relays. PRIVATE messages produce one gift wrap per
 * participant, each published to that participant's inbox relays.
 */
public class MessageSender {

    private static final Logger log = LoggerFactory.getLogger(MessageSender.class);

    static final String PLACEHOLDER_PREFIX = "pending-";

    private final CryptoCodec codec;
    private final RelayTransport transport;
    private final RelaySetResolver resolver;
    private final MessageDecoder decoder;
    private final MessagingStateHolder holder;
    private final Clock clock;

    public MessageSender(CryptoCodec codec, RelayTransport transport, RelaySetResolver resolver,
                         MessageDecoder decoder, MessagingStateHolder holder, Clock clock) {
        this.codec = codec;
        this.transport = transport;
        this.resolver = resolver;
        this.decoder = decoder;
        this.holder = holder;
        this.clock = clock;
    }

    public Mono<SendReceipt> send(SendMessageRequest request) {
        return Mono.defer(() -> {
            String me = codec.localPubkey();
            List<String> recipients = request.resolveRecipients(me);
            if (request.protocol() == Protocol.LEGACY && recipients.size() > 1) {
                log.debug("Legacy message addressed to {} recipients, sending to the first only", recipients.size());
                recipients = List.of(recipients.get(0));
            }
            List<String> participants = new ArrayList<>(recipients);
            participants.add(me);
            String conversationId = ConversationId.of(participants);
            String content = Attachment.appendUrls(request.content(), request.attachments());
            int kind = innerKind(request);
            List<List<String>> extraTags = extraTags(request);

            Message placeholder = new Message(PLACEHOLDER_PREFIX + UUID.randomUUID(), request.protocol(), kind, me,
                    clock.instant().getEpochSecond(), content, extraTags, request.attachments(), conversationId,
                    null, null, null, true, null, clock.millis());
            holder.proposePending(placeholder);

            List<String> addressed = recipients;
            return routingSnapshot(addressed)
                    .flatMap(snapshot -> request.protocol() == Protocol.LEGACY
                            ? sendLegacy(addressed.get(0), content, extraTags, snapshot)
                            : sendPrivate(addressed, content, kind, extraTags, snapshot))
                    .map(eventIds -> new SendReceipt(placeholder.id(), conversationId, request.protocol(), eventIds))
                    .doOnError(error -> holder.update(state -> holder.mergeEngine()
                            .markSendFailed(state, conversationId, placeholder.id(), error.getMessage())));
        });
    }

    private Mono<List<String>> sendLegacy(String recipient, String content, List<List<String>> extraTags,
                                          ResolverSnapshot snapshot) {
        return Mono.fromCallable(() -> codec.encryptLegacy(recipient, content, extraTags))
                .flatMap(event -> {
                    List<String> relays = RelayRouter.routeEvent(event, snapshot);
                    return transport.publish(relays, event)
                            .flatMap(report -> {
                                if (!report.delivered()) {
                                    return Mono.error(new PublishFailedException("No relay accepted the message",
                                            Map.of(recipient, describe(report))));
                                }
                                log.info("Legacy message {} accepted by {}/{} relays", event.id(),
                                        report.accepted().size(), relays.size());
                                mergeOwnCopy(event);
                                return Mono.just(List.of(event.id()));
                            });
                });
    }

    private Mono<List<String>> sendPrivate(List<String> recipients, String content, int kind,
                                           List<List<String>> extraTags, ResolverSnapshot snapshot) {
        String me = codec.localPubkey();
        return Mono.fromCallable(() -> codec.wrapPrivate(recipients, content, kind, extraTags))
                .flatMap(wraps -> Flux.fromIterable(wraps.wraps())
                        .flatMap(wrap -> publishWrap(wrap, snapshot))
                        .collectList()
                        .flatMap(outcomes -> {
                            Map<String, String> failures = new LinkedHashMap<>();
                            List<String> delivered = new ArrayList<>();
                            for (WrapOutcome outcome : outcomes) {
                                if (outcome.error() == null) {
                                    delivered.add(outcome.wrap().giftWrap().id());
                                } else {
                                    failures.put(outcome.wrap().recipient(), outcome.error());
                                }
                            }
                            int total = wraps.wraps().size();
                            if (!failures.isEmpty()) {
                                log.warn("Failed to publish {}/{} gift wraps", failures.size(), total);
                            }
                            if (failures.size() == total) {
                                return Mono.error(new PublishFailedException("All gift wraps were rejected", failures));
                            }
                            int recipientCopies = total - 1;
                            boolean othersAddressed = recipients.stream().anyMatch(recipient -> !recipient.equals(me));
                            if (!failures.isEmpty() && failures.size() >= recipientCopies && othersAddressed) {
                                return Mono.error(new PublishPartialFailureException(failures));
                            }
                            log.info("Published {}/{} gift wraps", delivered.size(), total);
                            ownWrap(wraps, me).ifPresent(this::mergeOwnCopy);
                            return Mono.just(delivered);
                        }));
    }

    private Mono<WrapOutcome> publishWrap(PrivateWraps.AddressedWrap wrap, ResolverSnapshot snapshot) {
        List<String> relays = RelayRouter.routeEvent(wrap.giftWrap(), snapshot);
        return transport.publish(relays, wrap.giftWrap())
                .map(report -> new WrapOutcome(wrap, report.delivered() ? null : describe(report)))
                .onErrorResume(error -> Mono.just(new WrapOutcome(wrap, error.getMessage())));
    }

    /** Routing snapshot after resolving recipients whose relays are still unknown. */
    private Mono<ResolverSnapshot> routingSnapshot(List<String> recipients) {
        Map<String, Participant> known = holder.current().participants();
        List<String> unknown = recipients.stream()
                .filter(pubkey -> !known.containsKey(pubkey))
                .toList();
        Mono<Void> resolved = unknown.isEmpty()
                ? Mono.empty()
                : resolver.resolveParticipants(unknown)
                        .doOnNext(lookup -> holder.update(state ->
                                MergeEngine.mergeParticipants(state, lookup.participants())))
                        .then();
        return resolved.then(Mono.fromSupplier(() -> ResolverSnapshot.of(codec.localPubkey(),
                resolver.discoveryRelays(), List.of(), holder.current().participants())));
    }

    private void mergeOwnCopy(NostrEvent event) {
        decoder.decode(event).ifPresent(message -> holder.propose(List.of(message)));
    }

    private static Optional<NostrEvent> ownWrap(PrivateWraps wraps, String me) {
        return wraps.wraps().stream()
                .filter(wrap -> wrap.recipient().equals(me))
                .map(PrivateWraps.AddressedWrap::giftWrap)
                .findFirst();
    }

    private static int innerKind(SendMessageRequest request) {
        if (request.protocol() == Protocol.LEGACY) {
            return EventKinds.LEGACY_DIRECT_MESSAGE;
        }
        return request.attachments().isEmpty() ? EventKinds.PRIVATE_MESSAGE : EventKinds.PRIVATE_FILE_MESSAGE;
    }

    private static List<List<String>> extraTags(SendMessageRequest request) {
        List<List<String>> tags = new ArrayList<>();
        if (request.protocol() == Protocol.PRIVATE && request.subject() != null && !request.subject().isBlank()) {
            tags.add(List.of("subject", request.subject()));
        }
        request.attachments().forEach(attachment -> tags.add(attachment.toImetaTag()));
        return tags;
    }

    private static String describe(PublishReport report) {
        if (report.rejected().isEmpty()) {
            return "no relay accepted the event";
        }
        return String.join("; ", report.rejected().entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .toList());
    }

    private record WrapOutcome(PrivateWraps.AddressedWrap wrap, String error) {
    }
}
