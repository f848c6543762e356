package com.sealpost.crypto;

import com.sealpost.event.EventJson;
import com.sealpost.event.NostrEvent;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.security.GeneralSecurityException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Signer} backed by a secp256k1 secret key held in memory.
 */
public final class LocalKeySigner implements Signer {

    private final byte[] secretKey;
    private final String publicKey;
    private final Map<String, byte[]> conversationKeys = new ConcurrentHashMap<>();

    private LocalKeySigner(byte[] secretKey) {
        if (!Secp256k1.isValidSecretKey(secretKey)) {
            throw new IllegalArgumentException("Invalid secret key");
        }
        this.secretKey = secretKey.clone();
        this.publicKey = Secp256k1.publicKeyHex(this.secretKey);
    }

    public static LocalKeySigner generate() {
        return new LocalKeySigner(Secp256k1.generateSecretKey());
    }

    public static LocalKeySigner fromHex(String secretKeyHex) {
        if (secretKeyHex == null || secretKeyHex.length() != 64) {
            throw new IllegalArgumentException("Secret key must be 64 hex characters");
        }
        try {
            return new LocalKeySigner(Hex.decode(secretKeyHex));
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Secret key is not hex", e);
        }
    }

    @Override
    public String publicKey() {
        return publicKey;
    }

    @Override
    public NostrEvent sign(NostrEvent template) {
        NostrEvent owned = NostrEvent.unsigned(publicKey, template.createdAt(), template.kind(),
                template.tags(), template.content());
        byte[] id = EventJson.idBytes(owned);
        byte[] sig = Secp256k1.sign(id, secretKey);
        return owned.withIdAndSig(Hex.toHexString(id), Hex.toHexString(sig));
    }

    @Override
    public String encryptLegacy(String peerPubkey, String plaintext) throws GeneralSecurityException {
        return Nip04Cipher.encrypt(plaintext, sharedX(peerPubkey));
    }

    @Override
    public String decryptLegacy(String peerPubkey, String payload) throws GeneralSecurityException {
        return Nip04Cipher.decrypt(payload, sharedX(peerPubkey));
    }

    @Override
    public String encryptPrivate(String peerPubkey, String plaintext) throws GeneralSecurityException {
        return Nip44Cipher.encrypt(plaintext, conversationKey(peerPubkey));
    }

    @Override
    public String decryptPrivate(String peerPubkey, String payload) throws GeneralSecurityException {
        return Nip44Cipher.decrypt(payload, conversationKey(peerPubkey));
    }

    private byte[] conversationKey(String peerPubkey) throws GeneralSecurityException {
        byte[] cached = conversationKeys.get(peerPubkey);
        if (cached != null) {
            return cached;
        }
        byte[] key = Nip44Cipher.conversationKey(sharedX(peerPubkey));
        conversationKeys.put(peerPubkey, key);
        return key;
    }

    private byte[] sharedX(String peerPubkey) throws GeneralSecurityException {
        try {
            return Secp256k1.sharedX(secretKey, peerPubkey);
        } catch (RuntimeException e) {
            throw new GeneralSecurityException("Invalid peer public key: " + peerPubkey, e);
        }
    }
}
