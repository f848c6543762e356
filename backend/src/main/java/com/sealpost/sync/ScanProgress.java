package com.sealpost.sync;

import com.sealpost.conversation.Protocol;

/**
 * Running count of events fetched for one protocol during a query pass.
 */
public record ScanProgress(Protocol protocol, int collected, String status) {
}
