package com.sealpost.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.sealpost.config.DirectMessageProperties;
import com.sealpost.conversation.Message;
import com.sealpost.conversation.MessagingState;
import com.sealpost.event.EventJson;
import com.sealpost.event.NostrEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable per-user cache of the messaging state.
 *
 * <p>Only encrypted envelopes, participants, sync bookkeeping and relay health are written. A
 * cache written under other relay settings, or under another format version, or one that fails
 * structure checks, reads as absent.
 */
@Service
public class MessageStore {

    private static final Logger log = LoggerFactory.getLogger(MessageStore.class);

    static final int FORMAT_VERSION = 1;

    private final SyncCacheRepository repository;
    private final DirectMessageProperties properties;
    private final Clock clock;

    public MessageStore(SyncCacheRepository repository, DirectMessageProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public Mono<CachePayload> readCache(String userId) {
        return repository.findById(userId)
                .flatMap(entity -> {
                    if (entity.formatVersion != FORMAT_VERSION) {
                        log.warn("Ignoring cache for {}: format version {} (expected {})", abbreviate(userId),
                                entity.formatVersion, FORMAT_VERSION);
                        return Mono.empty();
                    }
                    if (!properties.fingerprint().equals(entity.settingsFingerprint)) {
                        log.warn("Ignoring cache for {}: relay settings changed since it was written",
                                abbreviate(userId));
                        return Mono.empty();
                    }
                    return parse(userId, entity.payload);
                });
    }

    public Mono<Void> writeCache(String userId, MessagingState state) {
        return Mono.fromCallable(() -> {
                    SyncCacheEntity entity = new SyncCacheEntity();
                    entity.userPubkey = userId;
                    entity.payload = EventJson.mapper().writeValueAsString(toPayload(state));
                    entity.settingsFingerprint = properties.fingerprint();
                    entity.formatVersion = FORMAT_VERSION;
                    entity.updatedAt = clock.millis();
                    return entity;
                })
                .flatMap(repository::save)
                .doOnNext(saved -> log.debug("Cached {} messages for {}", state.messageCount(), abbreviate(userId)))
                .then();
    }

    public Mono<Void> deleteCache(String userId) {
        return repository.deleteById(userId)
                .doOnSuccess(unused -> log.info("Deleted message cache for {}", abbreviate(userId)));
    }

    CachePayload toPayload(MessagingState state) {
        Map<String, NostrEvent> envelopes = new LinkedHashMap<>();
        for (List<Message> messages : state.messages().values()) {
            for (Message message : messages) {
                if (!message.pending() && message.rawEnvelope() != null) {
                    envelopes.putIfAbsent(message.rawEnvelope().id(), message.rawEnvelope());
                }
            }
        }
        return new CachePayload(FORMAT_VERSION, properties.fingerprint(), state.participants(),
                new ArrayList<>(envelopes.values()), state.syncState(), state.relayHealth());
    }

    private Mono<CachePayload> parse(String userId, String json) {
        if (json == null || json.isBlank()) {
            log.warn("Ignoring cache for {}: empty payload", abbreviate(userId));
            return Mono.empty();
        }
        try {
            CachePayload payload = EventJson.mapper().readValue(json, CachePayload.class);
            if (!payload.isWellFormed()) {
                log.warn("Ignoring cache for {}: payload failed structure checks", abbreviate(userId));
                return Mono.empty();
            }
            return Mono.just(payload);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable cache for {}: {}", abbreviate(userId), e.getOriginalMessage());
            return Mono.empty();
        }
    }

    private static String abbreviate(String pubkey) {
        return pubkey.length() <= 12 ? pubkey : pubkey.substring(0, 12);
    }
}
