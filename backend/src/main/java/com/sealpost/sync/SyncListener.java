package com.sealpost.sync;

/**
 * Receives progress signals from a sync pass. All methods default to no-ops.
 */
public interface SyncListener {

    default void onPhase(SyncPhase phase) {
    }

    default void onPhaseFailed(SyncPhase phase, Throwable error) {
    }

    default void onProgress(ScanProgress progress) {
    }

    default void onRelayError(RelayError error) {
    }

    default void onNotice(String notice) {
    }
}
