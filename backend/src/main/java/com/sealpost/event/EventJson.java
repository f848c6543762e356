package com.sealpost.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Compact JSON for events and the canonical serialization their ids are hashed from.
 */
public final class EventJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private EventJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON", e);
        }
    }

    public static NostrEvent parse(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, NostrEvent.class);
    }

    /** {@code [0, pubkey, created_at, kind, tags, content]}, no whitespace. */
    public static String canonical(NostrEvent event) {
        return toJson(List.of(0, event.pubkey(), event.createdAt(), event.kind(),
                event.tags(), event.content()));
    }

    public static byte[] idBytes(NostrEvent event) {
        byte[] input = canonical(event).getBytes(StandardCharsets.UTF_8);
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    public static String computeId(NostrEvent event) {
        return Hex.toHexString(idBytes(event));
    }
}
