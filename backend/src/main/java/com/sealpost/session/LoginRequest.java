package com.sealpost.session;

/** Hex secret key of the user logging in. */
public record LoginRequest(String secretKey) {
}
