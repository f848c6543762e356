package com.sealpost.crypto;

/**
 * Plaintext of a legacy direct message, with the counterpart whose key opened it.
 */
public record LegacyDecrypted(String plaintext, String peerPubkey, String recipientPubkey, String conversationId) {
}
