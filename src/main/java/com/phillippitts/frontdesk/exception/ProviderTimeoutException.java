package com.phillippitts.frontdesk.exception;

import java.time.Duration;

/**
 * Thrown when a provider call exceeds its bounded wait.
 */
public class ProviderTimeoutException extends ProviderException {

    private final Duration timeout;

    public ProviderTimeoutException(String provider, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + "ms", provider);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
