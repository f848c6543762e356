package com.sealpost.event;

/**
 * Event kinds the engine reads or writes.
 */
public final class EventKinds {

    /** Legacy single-layer encrypted direct message. */
    public static final int LEGACY_DIRECT_MESSAGE = 4;

    /** Seal: signed by the true sender, wraps the inner message. */
    public static final int SEAL = 13;

    /** Inner private message, text only. */
    public static final int PRIVATE_MESSAGE = 14;

    /** Inner private message carrying file attachments. */
    public static final int PRIVATE_FILE_MESSAGE = 15;

    /** Gift wrap: outermost envelope signed by a throwaway key. */
    public static final int GIFT_WRAP = 1059;

    /** Relay list with read/write markers. */
    public static final int RELAY_LIST = 10002;

    /** Relays that should not be used to reach this user. */
    public static final int BLOCKED_RELAYS = 10006;

    /** Relays where this user wants to receive private messages. */
    public static final int DM_INBOX_RELAYS = 10050;

    private EventKinds() {
    }

    public static boolean isInnerMessage(int kind) {
        return kind == PRIVATE_MESSAGE || kind == PRIVATE_FILE_MESSAGE;
    }

    public static boolean isRoutingDocument(int kind) {
        return kind == RELAY_LIST || kind == DM_INBOX_RELAYS || kind == BLOCKED_RELAYS;
    }
}
