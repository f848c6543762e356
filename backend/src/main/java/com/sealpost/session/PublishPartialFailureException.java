package com.sealpost.session;

import java.util.Map;

/**
 * The sender's own copy went out but the copies addressed to recipients did not.
 */
public class PublishPartialFailureException extends PublishException {

    public static final String MESSAGE = "Message may not have been delivered to recipients";

    public PublishPartialFailureException(Map<String, String> failures) {
        super(MESSAGE, failures);
    }
}
