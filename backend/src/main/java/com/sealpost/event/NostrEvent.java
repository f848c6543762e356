package com.sealpost.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A relay event as it travels on the wire.
 *
 * <p>{@code id} and {@code sig} are null for unsigned templates and for inner messages,
 * which are never signed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NostrEvent(
        String id,
        String pubkey,
        @JsonProperty("created_at") long createdAt,
        int kind,
        List<List<String>> tags,
        String content,
        String sig
) {

    public NostrEvent {
        tags = tags == null ? List.of() : tags.stream().map(List::copyOf).toList();
        content = content == null ? "" : content;
    }

    public static NostrEvent unsigned(String pubkey, long createdAt, int kind,
                                      List<List<String>> tags, String content) {
        return new NostrEvent(null, pubkey, createdAt, kind, tags, content, null);
    }

    public NostrEvent withIdAndSig(String newId, String newSig) {
        return new NostrEvent(newId, pubkey, createdAt, kind, tags, content, newSig);
    }

    public NostrEvent withId(String newId) {
        return new NostrEvent(newId, pubkey, createdAt, kind, tags, content, sig);
    }

    /** Value at index 1 of the first tag named {@code name}. */
    public Optional<String> firstTagValue(String name) {
        return tags.stream()
                .filter(tag -> tag.size() > 1 && name.equals(tag.get(0)))
                .map(tag -> tag.get(1))
                .findFirst();
    }

    /** Values at index 1 of every tag named {@code name}, in tag order. */
    public List<String> tagValues(String name) {
        List<String> values = new ArrayList<>();
        for (List<String> tag : tags) {
            if (tag.size() > 1 && name.equals(tag.get(0)) && !tag.get(1).isBlank()) {
                values.add(tag.get(1));
            }
        }
        return values;
    }

    public List<List<String>> tagsNamed(String name) {
        return tags.stream()
                .filter(tag -> !tag.isEmpty() && name.equals(tag.get(0)))
                .toList();
    }

    @JsonIgnore
    public boolean isSigned() {
        return id != null && sig != null;
    }
}
