package com.sealpost.sync;

import com.sealpost.conversation.Protocol;

import java.util.List;

/**
 * Every relay of a query set failed for one batch. Events fetched before the failure are kept.
 */
public record RelayError(String message, Protocol protocol, List<String> failingEndpoints, int totalEndpoints) {

    public RelayError {
        failingEndpoints = List.copyOf(failingEndpoints);
    }
}
