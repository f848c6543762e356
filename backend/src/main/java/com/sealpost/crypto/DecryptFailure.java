package com.sealpost.crypto;

/**
 * Why an envelope could not be turned into plaintext.
 */
public record DecryptFailure(Reason reason, String detail) {

    public enum Reason {
        DECRYPTION_FAILED,
        MALFORMED_ENVELOPE
    }

    public static DecryptFailure decryption(String detail) {
        return new DecryptFailure(Reason.DECRYPTION_FAILED, detail);
    }

    public static DecryptFailure malformed(String detail) {
        return new DecryptFailure(Reason.MALFORMED_ENVELOPE, detail);
    }

    public String describe() {
        return reason == Reason.MALFORMED_ENVELOPE
                ? "Malformed envelope: " + detail
                : "Decryption failed: " + detail;
    }
}
