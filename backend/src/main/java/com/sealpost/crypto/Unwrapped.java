package com.sealpost.crypto;

/**
 * A fully opened gift wrap.
 */
public record Unwrapped(
        Envelope.GiftWrap giftWrap,
        Envelope.Seal seal,
        Envelope.InnerMessage innerMessage,
        String conversationId
) {
}
