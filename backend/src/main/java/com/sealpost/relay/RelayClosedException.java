package com.sealpost.relay;

/**
 * The relay refused or terminated a subscription with a {@code CLOSED} frame.
 */
public class RelayClosedException extends RuntimeException {

    public RelayClosedException(String relay, String reason) {
        super(relay + " closed the subscription: " + reason);
    }
}
