package com.sealpost.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Subscription/query filter. Null fields are omitted from the wire form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventFilter(
        List<Integer> kinds,
        List<String> authors,
        @JsonProperty("#p") List<String> recipients,
        Long since,
        Long until,
        Integer limit
) {

    public static EventFilter ofKinds(Integer... kinds) {
        return new EventFilter(List.of(kinds), null, null, null, null, null);
    }

    public EventFilter authors(List<String> value) {
        return new EventFilter(kinds, value, recipients, since, until, limit);
    }

    public EventFilter recipients(List<String> value) {
        return new EventFilter(kinds, authors, value, since, until, limit);
    }

    public EventFilter since(Long value) {
        return new EventFilter(kinds, authors, recipients, value, until, limit);
    }

    public EventFilter until(Long value) {
        return new EventFilter(kinds, authors, recipients, since, value, limit);
    }

    public EventFilter limit(Integer value) {
        return new EventFilter(kinds, authors, recipients, since, until, value);
    }

    public boolean matchesKind(int kind) {
        return kinds == null || kinds.contains(kind);
    }
}
