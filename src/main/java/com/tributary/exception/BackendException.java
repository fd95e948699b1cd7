package com.tributary.exception;

/**
 * The Gemini backend rejected a request or reported an error inside the stream.
 */
public class BackendException extends RuntimeException {

    private final int status;

    public BackendException(int status, String message) {
        super(message);
        this.status = status;
    }

    /**
     * HTTP status, or -1 when the error arrived inside the event stream.
     */
    public int getStatus() {
        return status;
    }
}
