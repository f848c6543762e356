package com.sealpost.session;

public record SessionResponse(String publicKey) {
}
