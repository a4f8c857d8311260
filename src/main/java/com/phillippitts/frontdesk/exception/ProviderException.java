package com.phillippitts.frontdesk.exception;

/**
 * Thrown when an external provider (speech-to-text, text-to-speech, reply generator)
 * fails to connect, rejects a request, or breaks its stream.
 */
public class ProviderException extends FrontDeskException {

    private final String provider;

    public ProviderException(String message, String provider) {
        super(message + " (provider: " + provider + ")");
        this.provider = provider;
    }

    public ProviderException(String message, String provider, Throwable cause) {
        super(message + " (provider: " + provider + ")", cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
