package com.tributary.exception;

/**
 * Raised when a stream exhausts its retry budget.
 * This is the only failure a caller of the streaming client sees.
 */
public class StreamException extends RuntimeException {

    private final int attempts;

    public StreamException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * Total attempts made before giving up.
     */
    public int getAttempts() {
        return attempts;
    }
}
