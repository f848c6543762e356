package com.sealpost.session;

import com.sealpost.conversation.Attachment;
import com.sealpost.conversation.ConversationId;
import com.sealpost.conversation.MergeEngine;
import com.sealpost.conversation.Message;
import com.sealpost.conversation.MessagingState;
import com.sealpost.conversation.Protocol;
import com.sealpost.crypto.CryptoCodec;
import com.sealpost.crypto.LocalKeySigner;
import com.sealpost.event.EventKinds;
import com.sealpost.event.NostrEvent;
import com.sealpost.relay.FakeRelayTransport;
import com.sealpost.relay.RelayMode;
import com.sealpost.relay.RelaySetResolver;
import com.sealpost.sync.MessageDecoder;
import com.sealpost.sync.MessagingStateHolder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessageSenderTest {

    private static final long NOW = 1_700_000_000L;
    private static final String DISCOVERY = "wss://discovery.test";
    private static final String BOB_INBOX = "wss://bob-inbox.test";

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
    private final FakeRelayTransport transport = new FakeRelayTransport();

    private LocalKeySigner alice;
    private LocalKeySigner bob;
    private LocalKeySigner carol;
    private MessagingStateHolder holder;
    private MessageSender sender;

    @BeforeEach
    void setup() {
        alice = LocalKeySigner.generate();
        bob = LocalKeySigner.generate();
        carol = LocalKeySigner.generate();
        CryptoCodec codec = new CryptoCodec(alice, clock);
        holder = new MessagingStateHolder(new MergeEngine(alice.publicKey(), Duration.ofSeconds(60)),
                MessagingState.empty());
        RelaySetResolver resolver = new RelaySetResolver(transport, List.of(DISCOVERY), RelayMode.STRICT_OUTBOX,
                Duration.ofSeconds(5), 0.6, clock);
        sender = new MessageSender(codec, transport, resolver,
                new MessageDecoder(codec, clock, Duration.ofSeconds(5)), holder, clock);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private String withBob() {
        return ConversationId.of(alice.publicKey(), bob.publicKey());
    }

    private List<Message> messagesWithBob() {
        return holder.current().messagesOf(withBob());
    }

    private void giveBobAnInbox() {
        transport.store(DISCOVERY, bob.sign(NostrEvent.unsigned(bob.publicKey(), 1, EventKinds.DM_INBOX_RELAYS,
                List.of(List.of("relay", BOB_INBOX)), "")));
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void privateMessagePublishesOneWrapPerParticipantAndReplacesThePlaceholder() {
        giveBobAnInbox();

        SendReceipt receipt = sender.send(SendMessageRequest.to(List.of(bob.publicKey()), "hi bob", Protocol.PRIVATE))
                .block();

        assertEquals(withBob(), receipt.conversationId());
        assertEquals(2, receipt.eventIds().size());
        assertTrue(receipt.placeholderId().startsWith(MessageSender.PLACEHOLDER_PREFIX));
        assertEquals(2, transport.published.size());
        assertTrue(transport.published.stream().allMatch(call -> call.event().kind() == EventKinds.GIFT_WRAP));
        assertTrue(transport.published.stream().anyMatch(call -> call.relays().equals(List.of(BOB_INBOX))),
                "bob's copy goes to bob's inbox");

        List<Message> messages = messagesWithBob();
        assertEquals(1, messages.size(), "own copy replaced the placeholder");
        assertFalse(messages.get(0).pending());
        assertEquals("hi bob", messages.get(0).content());
        assertNotNull(messages.get(0).giftWrapId());
    }

    @Test
    void groupMessageWrapsForEveryone() {
        SendReceipt receipt = sender.send(SendMessageRequest.to(List.of(bob.publicKey(), carol.publicKey()), "hi all",
                Protocol.PRIVATE)).block();

        assertEquals(3, receipt.eventIds().size());
        assertEquals(ConversationId.of(alice.publicKey(), bob.publicKey(), carol.publicKey()), receipt.conversationId());
    }

    @Test
    void noteToSelfIsOneWrap() {
        SendReceipt receipt = sender.send(SendMessageRequest.to(List.of(alice.publicKey()), "remember", Protocol.PRIVATE))
                .block();

        assertEquals(1, receipt.eventIds().size());
        assertEquals(ConversationId.of(alice.publicKey()), receipt.conversationId());
    }

    @Test
    void legacyMessageGoesToTheFirstRecipientOnly() {
        SendReceipt receipt = sender.send(SendMessageRequest.to(List.of(bob.publicKey(), carol.publicKey()),
                "old school", Protocol.LEGACY)).block();

        assertEquals(withBob(), receipt.conversationId());
        assertEquals(1, transport.published.size());
        NostrEvent event = transport.published.get(0).event();
        assertEquals(EventKinds.LEGACY_DIRECT_MESSAGE, event.kind());
        assertEquals(List.of(bob.publicKey()), event.tagValues("p"));
        assertEquals("old school", messagesWithBob().get(0).content());
        assertFalse(messagesWithBob().get(0).pending());
    }

    @Test
    void subjectAndAttachmentsTravelInTheInnerMessage() {
        Attachment photo = new Attachment("https://files.test/cat.png", "image/png", 1234L, "cat", List.of());
        SendMessageRequest request = new SendMessageRequest(List.of(bob.publicKey()), null, "look", Protocol.PRIVATE,
                List.of(photo), "Pets");

        sender.send(request).block();

        Message sent = messagesWithBob().get(0);
        assertEquals(EventKinds.PRIVATE_FILE_MESSAGE, sent.kind());
        assertEquals("Pets", sent.subject().orElseThrow());
        assertEquals(List.of(photo), sent.attachments());
        assertEquals("look\n\nhttps://files.test/cat.png", sent.content());
    }

    @Test
    void everyRelayRejectingFailsTheSendAndMarksThePlaceholder() {
        transport.reject(DISCOVERY);

        StepVerifier.create(sender.send(SendMessageRequest.to(List.of(bob.publicKey()), "lost", Protocol.PRIVATE)))
                .expectError(PublishFailedException.class)
                .verify();

        Message placeholder = messagesWithBob().get(0);
        assertTrue(placeholder.pending());
        assertNotNull(placeholder.sendError());
    }

    @Test
    void onlyMyOwnCopyLandingIsAPartialFailure() {
        giveBobAnInbox();
        transport.reject(BOB_INBOX);

        StepVerifier.create(sender.send(SendMessageRequest.to(List.of(bob.publicKey()), "maybe", Protocol.PRIVATE)))
                .expectErrorSatisfies(error -> {
                    PublishPartialFailureException partial = assertInstanceOf(PublishPartialFailureException.class, error);
                    assertEquals(PublishPartialFailureException.MESSAGE, partial.getMessage());
                    assertTrue(partial.failures().containsKey(bob.publicKey()));
                })
                .verify();

        assertEquals(PublishPartialFailureException.MESSAGE, messagesWithBob().get(0).sendError());
    }

    @Test
    void invalidRecipientIsRejectedBeforeAnythingHappens() {
        StepVerifier.create(sender.send(SendMessageRequest.to(List.of("not-a-key"), "hi", Protocol.PRIVATE)))
                .expectError(IllegalArgumentException.class)
                .verify();

        assertTrue(transport.published.isEmpty());
        assertTrue(holder.current().conversations().isEmpty());
    }

    @Test
    void recipientsCanComeFromTheConversationId() {
        SendMessageRequest request = new SendMessageRequest(null, withBob(), "reply", Protocol.PRIVATE, List.of(), null);

        SendReceipt receipt = sender.send(request).block();

        assertEquals(withBob(), receipt.conversationId());
        assertEquals(2, receipt.eventIds().size());
    }
}
