package com.tributary.model;

/**
 * Kinds of events flowing through a stream.
 *
 * Within one attempt at most one of COMPLETE or ERROR occurs and it is always the
 * last caller-visible event. END_OF_ATTEMPT closes the attempt's sequence and is
 * consumed internally by the orchestrator.
 */
public enum StreamEventType {
    /**
     * Incremental output fragment.
     */
    CHUNK,

    /**
     * Liveness signal emitted while an attempt is in progress. Carries no payload.
     */
    HEARTBEAT,

    /**
     * Attempt finished successfully. No more events follow.
     */
    COMPLETE,

    /**
     * Attempt failed. No more events follow.
     */
    ERROR,

    /**
     * Internal sentinel, never surfaced to the caller.
     */
    END_OF_ATTEMPT
}
