package com.sealpost.sync;

/**
 * Marks a sync phase as failed because its query pass ended with a {@link RelayError}.
 */
public class RelayQueryFailedException extends RuntimeException {

    private final RelayError relayError;

    public RelayQueryFailedException(RelayError relayError) {
        super(relayError.message());
        this.relayError = relayError;
    }

    public RelayError relayError() {
        return relayError;
    }
}
