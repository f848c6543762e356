package com.sealpost.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.ChaCha7539Engine;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.bouncycastle.util.Arrays;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * Versioned payload encryption used by seals and gift wraps (version 2).
 *
 * <p>Conversation key is {@code HMAC-SHA256("nip44-v2", sharedX)}; per-message keys come from
 * HKDF-expand over a random 32-byte nonce. The plaintext is length-prefixed and padded to a
 * bucket size before ChaCha20, and the ciphertext is authenticated with HMAC-SHA256 over
 * {@code nonce || ciphertext}.
 */
public final class Nip44Cipher {

    private static final byte VERSION = 2;
    private static final byte[] SALT = "nip44-v2".getBytes(StandardCharsets.US_ASCII);
    private static final int MIN_PLAINTEXT = 1;
    private static final int MAX_PLAINTEXT = 65535;
    private static final SecureRandom RANDOM = new SecureRandom();

    private Nip44Cipher() {
    }

    public static byte[] conversationKey(byte[] sharedX) {
        return hmac(SALT, sharedX);
    }

    public static String encrypt(String plaintext, byte[] conversationKey) throws GeneralSecurityException {
        byte[] nonce = new byte[32];
        RANDOM.nextBytes(nonce);
        return encrypt(plaintext, conversationKey, nonce);
    }

    static String encrypt(String plaintext, byte[] conversationKey, byte[] nonce) throws GeneralSecurityException {
        MessageKeys keys = messageKeys(conversationKey, nonce);
        byte[] padded = pad(plaintext);
        byte[] ciphertext = chacha(keys, padded);
        byte[] mac = hmac(keys.hmacKey(), Arrays.concatenate(nonce, ciphertext));
        byte[] payload = Arrays.concatenate(new byte[] {VERSION}, nonce, ciphertext, mac);
        return Base64.getEncoder().encodeToString(payload);
    }

    public static String decrypt(String payload, byte[] conversationKey) throws GeneralSecurityException {
        if (payload == null || payload.isEmpty() || payload.charAt(0) == '#') {
            throw new GeneralSecurityException("Unknown encryption version");
        }
        byte[] data;
        try {
            data = Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("Payload is not base64", e);
        }
        if (data.length < 99 || data.length > 65603) {
            throw new GeneralSecurityException("Invalid payload length: " + data.length);
        }
        if (data[0] != VERSION) {
            throw new GeneralSecurityException("Unknown encryption version: " + data[0]);
        }
        byte[] nonce = Arrays.copyOfRange(data, 1, 33);
        byte[] ciphertext = Arrays.copyOfRange(data, 33, data.length - 32);
        byte[] mac = Arrays.copyOfRange(data, data.length - 32, data.length);

        MessageKeys keys = messageKeys(conversationKey, nonce);
        byte[] expected = hmac(keys.hmacKey(), Arrays.concatenate(nonce, ciphertext));
        if (!Arrays.constantTimeAreEqual(expected, mac)) {
            throw new GeneralSecurityException("Invalid MAC");
        }
        return unpad(chacha(keys, ciphertext));
    }

    static int paddedLength(int unpaddedLength) {
        if (unpaddedLength <= 32) {
            return 32;
        }
        int nextPower = 1 << (32 - Integer.numberOfLeadingZeros(unpaddedLength - 1));
        int chunk = nextPower <= 256 ? 32 : nextPower / 8;
        return chunk * ((unpaddedLength - 1) / chunk + 1);
    }

    private static byte[] pad(String plaintext) throws GeneralSecurityException {
        byte[] unpadded = plaintext.getBytes(StandardCharsets.UTF_8);
        int length = unpadded.length;
        if (length < MIN_PLAINTEXT || length > MAX_PLAINTEXT) {
            throw new GeneralSecurityException("Plaintext length out of range: " + length);
        }
        byte[] padded = new byte[2 + paddedLength(length)];
        padded[0] = (byte) (length >>> 8);
        padded[1] = (byte) length;
        System.arraycopy(unpadded, 0, padded, 2, length);
        return padded;
    }

    private static String unpad(byte[] padded) throws GeneralSecurityException {
        int length = ((padded[0] & 0xff) << 8) | (padded[1] & 0xff);
        if (length < MIN_PLAINTEXT
                || length > padded.length - 2
                || padded.length != 2 + paddedLength(length)) {
            throw new GeneralSecurityException("Invalid padding");
        }
        return new String(padded, 2, length, StandardCharsets.UTF_8);
    }

    private static MessageKeys messageKeys(byte[] conversationKey, byte[] nonce) throws GeneralSecurityException {
        if (conversationKey.length != 32) {
            throw new GeneralSecurityException("Conversation key must be 32 bytes");
        }
        if (nonce.length != 32) {
            throw new GeneralSecurityException("Nonce must be 32 bytes");
        }
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(HKDFParameters.skipExtractParameters(conversationKey, nonce));
        byte[] okm = new byte[76];
        hkdf.generateBytes(okm, 0, okm.length);
        return new MessageKeys(
                Arrays.copyOfRange(okm, 0, 32),
                Arrays.copyOfRange(okm, 32, 44),
                Arrays.copyOfRange(okm, 44, 76));
    }

    private static byte[] chacha(MessageKeys keys, byte[] input) {
        ChaCha7539Engine engine = new ChaCha7539Engine();
        engine.init(true, new ParametersWithIV(new KeyParameter(keys.chachaKey()), keys.chachaNonce()));
        byte[] out = new byte[input.length];
        engine.processBytes(input, 0, input.length, out, 0);
        return out;
    }

    private static byte[] hmac(byte[] key, byte[] message) {
        HMac mac = new HMac(new SHA256Digest());
        mac.init(new KeyParameter(key));
        mac.update(message, 0, message.length);
        byte[] out = new byte[mac.getMacSize()];
        mac.doFinal(out, 0);
        return out;
    }

    private record MessageKeys(byte[] chachaKey, byte[] chachaNonce, byte[] hmacKey) {
    }
}
