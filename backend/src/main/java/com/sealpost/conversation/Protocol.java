package com.sealpost.conversation;

public enum Protocol {
    /** Single-layer kind 4 messages. */
    LEGACY,
    /** Sealed and gift-wrapped kind 14/15 messages. */
    PRIVATE
}
