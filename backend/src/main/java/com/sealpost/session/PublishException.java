package com.sealpost.session;

import java.util.Map;

/**
 * A publish did not reach the relays it had to reach. {@code failures} maps each addressee
 * (or relay, for routing documents) to the reason it failed.
 */
public abstract class PublishException extends RuntimeException {

    private final Map<String, String> failures;

    protected PublishException(String message, Map<String, String> failures) {
        super(message);
        this.failures = Map.copyOf(failures);
    }

    public Map<String, String> failures() {
        return failures;
    }
}
