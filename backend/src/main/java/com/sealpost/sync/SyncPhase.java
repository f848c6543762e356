package com.sealpost.sync;

public enum SyncPhase {
    IDLE,
    CACHE,
    INITIAL_QUERY,
    GAP_FILL,
    SUBSCRIPTIONS,
    READY,
    ERROR
}
