package com.sealpost.session;

import java.util.Map;

/** No relay accepted any copy of the event. */
public class PublishFailedException extends PublishException {

    public PublishFailedException(String message, Map<String, String> failures) {
        super(message, failures);
    }
}
