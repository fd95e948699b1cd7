package com.tributary.transport;

import com.tributary.exception.TransportException;
import com.tributary.model.StreamEvent;
import reactor.core.publisher.Flux;

/**
 * Transport whose {@link #open()} always fails, modelling an endpoint that rejects the attempt.
 */
public class FailingTransport implements StreamingTransport {

    private final String endpoint;
    private final String message;
    private volatile boolean closed;

    public FailingTransport(String endpoint, String message) {
        this.endpoint = endpoint;
        this.message = message;
    }

    @Override
    public void open() {
        throw new TransportException(endpoint, message);
    }

    @Override
    public Flux<StreamEvent> events() {
        return Flux.error(new IllegalStateException("Transport not opened"));
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
