package com.sealpost.relay;

/**
 * How a participant's derived relay set is built from their routing documents.
 */
public enum RelayMode {
    /** Ignore published lists, use the discovery relays only. */
    DISCOVERY,
    /** Published lists plus the discovery relays. */
    HYBRID,
    /** Published lists only. May produce an empty set. */
    STRICT_OUTBOX
}
