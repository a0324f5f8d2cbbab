package com.phillippitts.ellie.client.degradation;

import com.phillippitts.ellie.exception.EllieException;

/**
 * Request/response text chat with the assistant, used when voice is unavailable.
 */
public interface TextChannel {

    /**
     * @throws EllieException when the reply cannot be obtained
     */
    Reply send(String sessionId, String message);

    record Reply(String response, long processingTimeMs) {
    }
}
