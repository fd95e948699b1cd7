package com.tributary.transport;

import com.tributary.model.StreamEvent;
import reactor.core.publisher.Flux;

/**
 * Produces the events of one attempt against one endpoint.
 *
 * Lifecycle: {@link #open()} acquires whatever the attempt needs and may fail,
 * {@link #events()} yields a finite sequence terminated by
 * {@link com.tributary.model.StreamEventType#END_OF_ATTEMPT}, and {@link #close()}
 * releases everything, even after a failed or partial {@code open()}.
 * A transport serves exactly one attempt and is never reused.
 */
public interface StreamingTransport extends AutoCloseable {

    /**
     * Acquire the resources for this attempt.
     *
     * @throws RuntimeException if the endpoint cannot be used
     */
    void open();

    /**
     * Events of this attempt, ending with {@code END_OF_ATTEMPT}.
     */
    Flux<StreamEvent> events();

    /**
     * Release resources. Idempotent and never throws.
     */
    @Override
    void close();
}
