package com.sealpost.crypto;

import com.sealpost.event.EventJson;
import com.sealpost.event.NostrEvent;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.Arrays;

/**
 * Checks that an event's id matches its content and that the signature is valid for its pubkey.
 */
public final class EventVerifier {

    private EventVerifier() {
    }

    public static boolean verify(NostrEvent event) {
        if (!event.isSigned() || event.pubkey() == null) {
            return false;
        }
        try {
            byte[] id = EventJson.idBytes(event);
            if (!Arrays.equals(id, Hex.decode(event.id()))) {
                return false;
            }
            return Secp256k1.verify(id, Hex.decode(event.pubkey()), Hex.decode(event.sig()));
        } catch (DecoderException e) {
            return false;
        }
    }
}
