package com.tributary.transport;

import com.tributary.model.StreamEvent;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic transport that replays a fixed list of events.
 * An {@code END_OF_ATTEMPT} sentinel is appended unless the list already ends with one.
 */
public class ReplayTransport implements StreamingTransport {

    private final List<StreamEvent> events;
    private volatile boolean opened;
    private volatile boolean closed;

    public ReplayTransport(List<StreamEvent> events) {
        List<StreamEvent> replay = new ArrayList<>(events);
        if (replay.isEmpty() || !replay.get(replay.size() - 1).isEndOfAttempt()) {
            replay.add(StreamEvent.endOfAttempt());
        }
        this.events = List.copyOf(replay);
    }

    public static ReplayTransport of(StreamEvent... events) {
        return new ReplayTransport(List.of(events));
    }

    @Override
    public void open() {
        opened = true;
    }

    @Override
    public Flux<StreamEvent> events() {
        if (!opened) {
            return Flux.error(new IllegalStateException("Transport not opened"));
        }
        return Flux.fromIterable(events);
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isOpened() {
        return opened;
    }

    public boolean isClosed() {
        return closed;
    }
}
