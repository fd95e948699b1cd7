package com.tributary.exception;

/**
 * Failure of a single attempt against one endpoint.
 * Internal to the streaming client; it drives retries and is never surfaced directly.
 */
public class TransportException extends RuntimeException {

    private final String endpoint;

    public TransportException(String endpoint, String message) {
        super(message);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
