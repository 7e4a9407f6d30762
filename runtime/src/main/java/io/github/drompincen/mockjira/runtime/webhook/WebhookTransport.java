package io.github.drompincen.mockjira.runtime.webhook;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Sends one signed delivery.
 */
public interface WebhookTransport {

    /**
     * @return the HTTP status code returned by the target
     */
    int send(String url, Map<String, String> headers, byte[] body, Duration timeout)
            throws IOException, InterruptedException;
}
