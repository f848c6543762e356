package com.sealpost.crypto;

import com.sealpost.event.NostrEvent;

import java.security.GeneralSecurityException;

/**
 * The local user's identity: signs events and performs both encryption schemes with the
 * user's secret key. Implementations may delegate to an external key holder.
 */
public interface Signer {

    /** Hex x-only public key. */
    String publicKey();

    /** Returns the template with this signer's pubkey, its computed id and a signature. */
    NostrEvent sign(NostrEvent template);

    String encryptLegacy(String peerPubkey, String plaintext) throws GeneralSecurityException;

    String decryptLegacy(String peerPubkey, String payload) throws GeneralSecurityException;

    String encryptPrivate(String peerPubkey, String plaintext) throws GeneralSecurityException;

    String decryptPrivate(String peerPubkey, String payload) throws GeneralSecurityException;
}
