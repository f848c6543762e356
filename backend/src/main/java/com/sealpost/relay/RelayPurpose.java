package com.sealpost.relay;

public enum RelayPurpose {
    READ_INBOX,
    WRITE,
    DISCOVERY
}
