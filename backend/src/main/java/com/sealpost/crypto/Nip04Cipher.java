package com.sealpost.crypto;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Base64;

/**
 * Legacy direct-message encryption: AES-256-CBC keyed by the raw ECDH x-coordinate.
 * Payload format is {@code base64(ciphertext) + "?iv=" + base64(iv)}.
 */
public final class Nip04Cipher {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private static final String AES_ALGO = "AES/CBC/PKCS5Padding";
    private static final int IV_SIZE = 16;
    private static final String IV_SEPARATOR = "?iv=";
    private static final SecureRandom RANDOM = new SecureRandom();

    private Nip04Cipher() {
    }

    public static String encrypt(String plaintext, byte[] sharedX) throws GeneralSecurityException {
        byte[] iv = new byte[IV_SIZE];
        RANDOM.nextBytes(iv);

        Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
        cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(sharedX, "AES"), new IvParameterSpec(iv));
        byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

        return Base64.getEncoder().encodeToString(ciphertext)
                + IV_SEPARATOR
                + Base64.getEncoder().encodeToString(iv);
    }

    public static String decrypt(String payload, byte[] sharedX) throws GeneralSecurityException {
        int separator = payload.indexOf(IV_SEPARATOR);
        if (separator < 0) {
            throw new GeneralSecurityException("Legacy payload has no iv");
        }
        byte[] ciphertext;
        byte[] iv;
        try {
            ciphertext = Base64.getDecoder().decode(payload.substring(0, separator));
            iv = Base64.getDecoder().decode(payload.substring(separator + IV_SEPARATOR.length()));
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Legacy payload is not base64", e);
        }
        if (iv.length != IV_SIZE) {
            throw new GeneralSecurityException("Legacy payload iv must be 16 bytes");
        }

        Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
        cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(sharedX, "AES"), new IvParameterSpec(iv));
        return new String(cipher.doFinal(ciphertext), StandardCharsets.UTF_8);
    }
}
