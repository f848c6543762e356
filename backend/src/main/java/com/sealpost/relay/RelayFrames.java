package com.sealpost.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sealpost.event.EventFilter;
import com.sealpost.event.EventJson;
import com.sealpost.event.NostrEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON array frames of the relay protocol.
 */
public final class RelayFrames {

    private RelayFrames() {
    }

    public static String req(String subscriptionId, List<EventFilter> filters) {
        List<Object> frame = new ArrayList<>();
        frame.add("REQ");
        frame.add(subscriptionId);
        frame.addAll(filters);
        return EventJson.toJson(frame);
    }

    public static String close(String subscriptionId) {
        return EventJson.toJson(List.of("CLOSE", subscriptionId));
    }

    public static String event(NostrEvent event) {
        return EventJson.toJson(List.of("EVENT", event));
    }

    /** Parses an incoming frame; unknown or broken frames yield empty. */
    public static Optional<RelayFrame> parse(String text) {
        JsonNode node;
        try {
            node = EventJson.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (node == null || !node.isArray() || node.size() < 2) {
            return Optional.empty();
        }
        String type = node.get(0).asText();
        try {
            return switch (type) {
                case "EVENT" -> node.size() < 3
                        ? Optional.empty()
                        : Optional.of(new RelayFrame.Event(node.get(1).asText(),
                                EventJson.mapper().treeToValue(node.get(2), NostrEvent.class)));
                case "EOSE" -> Optional.of(new RelayFrame.EndOfStored(node.get(1).asText()));
                case "OK" -> node.size() < 3
                        ? Optional.empty()
                        : Optional.of(new RelayFrame.Ok(node.get(1).asText(), node.get(2).asBoolean(),
                                node.size() > 3 ? node.get(3).asText() : ""));
                case "CLOSED" -> Optional.of(new RelayFrame.Closed(node.get(1).asText(),
                        node.size() > 2 ? node.get(2).asText() : ""));
                case "NOTICE" -> Optional.of(new RelayFrame.Notice(node.get(1).asText()));
                default -> Optional.empty();
            };
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
