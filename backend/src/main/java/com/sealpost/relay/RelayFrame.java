package com.sealpost.relay;

import com.sealpost.event.NostrEvent;

/**
 * A message received from a relay.
 */
public sealed interface RelayFrame
        permits RelayFrame.Event, RelayFrame.EndOfStored, RelayFrame.Ok, RelayFrame.Closed, RelayFrame.Notice {

    record Event(String subscriptionId, NostrEvent event) implements RelayFrame {
    }

    record EndOfStored(String subscriptionId) implements RelayFrame {
    }

    record Ok(String eventId, boolean accepted, String message) implements RelayFrame {
    }

    record Closed(String subscriptionId, String message) implements RelayFrame {
    }

    record Notice(String message) implements RelayFrame {
    }
}
