package com.sealpost.crypto;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * secp256k1 primitives: x-only public keys, ECDH shared x-coordinate and BIP-340 Schnorr
 * signatures.
 */
public final class Secp256k1 {

    private static final X9ECParameters CURVE = CustomNamedCurves.getByName("secp256k1");
    private static final BigInteger N = CURVE.getN();
    private static final BigInteger P = CURVE.getCurve().getField().getCharacteristic();
    private static final SecureRandom RANDOM = new SecureRandom();

    private Secp256k1() {
    }

    public static byte[] generateSecretKey() {
        while (true) {
            byte[] candidate = new byte[32];
            RANDOM.nextBytes(candidate);
            BigInteger d = new BigInteger(1, candidate);
            if (d.signum() > 0 && d.compareTo(N) < 0) {
                return candidate;
            }
        }
    }

    public static boolean isValidSecretKey(byte[] secretKey) {
        if (secretKey == null || secretKey.length != 32) {
            return false;
        }
        BigInteger d = new BigInteger(1, secretKey);
        return d.signum() > 0 && d.compareTo(N) < 0;
    }

    /** 32-byte x-only public key for a secret key. */
    public static byte[] publicKey(byte[] secretKey) {
        ECPoint point = CURVE.getG().multiply(scalar(secretKey)).normalize();
        return point.getAffineXCoord().getEncoded();
    }

    public static String publicKeyHex(byte[] secretKey) {
        return Hex.toHexString(publicKey(secretKey));
    }

    public static boolean isValidPublicKey(String hex) {
        try {
            liftX(Hex.decode(hex));
            return true;
        } catch (RuntimeException e) {
            return false;
        }
    }

    /** x-coordinate of {@code secretKey * liftX(publicKey)}, the raw ECDH secret. */
    public static byte[] sharedX(byte[] secretKey, String publicKeyHex) {
        ECPoint point = liftX(Hex.decode(publicKeyHex)).multiply(scalar(secretKey)).normalize();
        return point.getAffineXCoord().getEncoded();
    }

    public static byte[] sign(byte[] message32, byte[] secretKey) {
        byte[] aux = new byte[32];
        RANDOM.nextBytes(aux);
        return sign(message32, secretKey, aux);
    }

    public static byte[] sign(byte[] message32, byte[] secretKey, byte[] aux32) {
        BigInteger d0 = scalar(secretKey);
        ECPoint pub = CURVE.getG().multiply(d0).normalize();
        BigInteger d = hasEvenY(pub) ? d0 : N.subtract(d0);
        byte[] px = pub.getAffineXCoord().getEncoded();

        byte[] t = xor(bytes32(d), taggedHash("BIP0340/aux", aux32));
        BigInteger k0 = new BigInteger(1, taggedHash("BIP0340/nonce", t, px, message32)).mod(N);
        if (k0.signum() == 0) {
            throw new IllegalStateException("Derived nonce is zero");
        }
        ECPoint r = CURVE.getG().multiply(k0).normalize();
        BigInteger k = hasEvenY(r) ? k0 : N.subtract(k0);
        byte[] rx = r.getAffineXCoord().getEncoded();
        BigInteger e = new BigInteger(1, taggedHash("BIP0340/challenge", rx, px, message32)).mod(N);

        return Arrays.concatenate(rx, bytes32(k.add(e.multiply(d)).mod(N)));
    }

    public static boolean verify(byte[] message32, byte[] publicKey32, byte[] signature64) {
        if (publicKey32.length != 32 || signature64.length != 64) {
            return false;
        }
        ECPoint pub;
        try {
            pub = liftX(publicKey32);
        } catch (RuntimeException e) {
            return false;
        }
        byte[] rBytes = Arrays.copyOfRange(signature64, 0, 32);
        BigInteger r = new BigInteger(1, rBytes);
        BigInteger s = new BigInteger(1, Arrays.copyOfRange(signature64, 32, 64));
        if (r.compareTo(P) >= 0 || s.compareTo(N) >= 0) {
            return false;
        }
        BigInteger e = new BigInteger(1, taggedHash("BIP0340/challenge", rBytes, publicKey32, message32)).mod(N);
        ECPoint point = CURVE.getG().multiply(s).subtract(pub.multiply(e)).normalize();
        return !point.isInfinity()
                && hasEvenY(point)
                && point.getAffineXCoord().toBigInteger().equals(r);
    }

    static ECPoint liftX(byte[] x32) {
        if (x32.length != 32) {
            throw new IllegalArgumentException("x-only key must be 32 bytes");
        }
        byte[] compressed = new byte[33];
        compressed[0] = 0x02;
        System.arraycopy(x32, 0, compressed, 1, 32);
        return CURVE.getCurve().decodePoint(compressed);
    }

    private static BigInteger scalar(byte[] secretKey) {
        if (!isValidSecretKey(secretKey)) {
            throw new IllegalArgumentException("Invalid secp256k1 secret key");
        }
        return new BigInteger(1, secretKey);
    }

    private static boolean hasEvenY(ECPoint point) {
        return !point.getAffineYCoord().toBigInteger().testBit(0);
    }

    private static byte[] bytes32(BigInteger value) {
        return BigIntegers.asUnsignedByteArray(32, value);
    }

    private static byte[] xor(byte[] a, byte[] b) {
        byte[] out = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = (byte) (a[i] ^ b[i]);
        }
        return out;
    }

    private static byte[] taggedHash(String tag, byte[]... parts) {
        byte[] tagHash = sha256(tag.getBytes(StandardCharsets.UTF_8));
        SHA256Digest digest = new SHA256Digest();
        digest.update(tagHash, 0, tagHash.length);
        digest.update(tagHash, 0, tagHash.length);
        for (byte[] part : parts) {
            digest.update(part, 0, part.length);
        }
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }

    private static byte[] sha256(byte[] input) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] out = new byte[32];
        digest.doFinal(out, 0);
        return out;
    }
}
