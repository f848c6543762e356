package com.sealpost.crypto;

/**
 * Outcome of a decode step: either a value or a {@link DecryptFailure}. Network and crypto
 * errors never escape the codec as exceptions.
 */
public sealed interface CodecResult<T> permits CodecResult.Ok, CodecResult.Failed {

    static <T> CodecResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> CodecResult<T> failed(DecryptFailure failure) {
        return new Failed<>(failure);
    }

    record Ok<T>(T value) implements CodecResult<T> {
    }

    record Failed<T>(DecryptFailure failure) implements CodecResult<T> {
    }
}
