package com.sealpost.crypto;

/**
 * An envelope layer did not have the expected shape.
 */
public class MalformedEnvelopeException extends Exception {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
