package com.tributary.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.tributary.backend.ChunkStream;
import com.tributary.backend.GeminiResponseParser;
import com.tributary.backend.StreamingBackend;
import com.tributary.model.GenerateRequest;
import com.tributary.model.StreamConfig;
import com.tributary.model.StreamEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport that runs the blocking Gemini call on a dedicated thread and hands its
 * chunks over to a reactive consumer.
 *
 * The worker converts every backend chunk into a chunk event, then emits a final
 * complete or error event, and always finishes with {@code END_OF_ATTEMPT}. Events
 * travel through an unbounded unicast sink, so delivery order is emission order.
 * {@link #close()} waits at most {@code joinTimeout} for the worker, a worker stuck in
 * the blocking call after that is abandoned. On a non-blocking thread the wait moves to
 * the delivery scheduler.
 */
@Slf4j
public class GeminiTransport implements StreamingTransport {

    private static final AtomicInteger WORKER_IDS = new AtomicInteger();

    private final StreamingBackend backend;
    private final StreamConfig config;
    private final GenerateRequest request;
    private final Duration joinTimeout;
    private final Scheduler deliveryScheduler;

    private final Sinks.Many<StreamEvent> channel = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile Thread worker;
    private volatile ChunkStream activeStream;

    public GeminiTransport(StreamingBackend backend,
                           StreamConfig config,
                           GenerateRequest request,
                           Duration joinTimeout,
                           Scheduler deliveryScheduler) {
        this.backend = backend;
        this.config = config;
        this.request = request;
        this.joinTimeout = joinTimeout;
        this.deliveryScheduler = deliveryScheduler;
    }

    @Override
    public synchronized void open() {
        if (worker != null) {
            throw new IllegalStateException("Transport already opened");
        }
        if (closed.get()) {
            throw new IllegalStateException("Transport already closed");
        }
        Thread thread = new Thread(this::runStream, "gemini-stream-" + WORKER_IDS.incrementAndGet());
        thread.setDaemon(true);
        worker = thread;
        thread.start();
        log.debug("Started worker {} for endpoint {}", thread.getName(), config.getEndpoint());
    }

    @Override
    public Flux<StreamEvent> events() {
        if (worker == null) {
            return Flux.error(new IllegalStateException("Transport not opened"));
        }
        // consumers run on the delivery scheduler, never on the worker thread
        return channel.asFlux()
                .publishOn(deliveryScheduler)
                .takeUntil(StreamEvent::isEndOfAttempt);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stopRequested.set(true);

        ChunkStream stream = activeStream;
        if (stream != null) {
            stream.close();
        }

        Thread thread = worker;
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        thread.interrupt();
        if (Schedulers.isInNonBlockingThread()) {
            // event loops and timers must not wait on the worker
            deliveryScheduler.schedule(() -> awaitWorker(thread));
        } else {
            awaitWorker(thread);
        }
    }

    private void awaitWorker(Thread thread) {
        try {
            // join(0) would wait forever
            thread.join(Math.max(1L, joinTimeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (thread.isAlive()) {
            log.warn("Abandoning worker {} for endpoint {}: still blocked after {}",
                    thread.getName(), config.getEndpoint(), joinTimeout);
        }
    }

    /**
     * Worker body: runs the blocking backend call to completion or failure.
     */
    private void runStream() {
        try {
            ChunkStream chunks = backend.openStream(config, request);
            activeStream = chunks;
            try (chunks) {
                // close() may have run before activeStream was visible
                while (!stopRequested.get() && chunks.hasNext()) {
                    JsonNode chunk = chunks.next();
                    emit(StreamEvent.chunk(GeminiResponseParser.extractText(chunk), chunk));
                    String finishReason = GeminiResponseParser.extractFinishReason(chunk);
                    if (finishReason != null) {
                        log.debug("Gemini finished on {}: {}", config.getEndpoint(), finishReason);
                    }
                }
            }
            if (!stopRequested.get()) {
                emit(StreamEvent.complete());
            }
        } catch (RuntimeException | Error e) {
            if (stopRequested.get()) {
                log.debug("Worker for {} stopped: {}", config.getEndpoint(), e.getMessage());
            } else {
                log.error("Gemini transport error on {}", config.getEndpoint(), e);
                emit(StreamEvent.error(describe(e)));
            }
            if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
                throw (VirtualMachineError) e;
            }
        } finally {
            activeStream = null;
            emit(StreamEvent.endOfAttempt());
        }
    }

    private void emit(StreamEvent event) {
        Sinks.EmitResult result = channel.tryEmitNext(event);
        if (result.isFailure()) {
            // the consumer is gone once the attempt was cancelled
            log.debug("Dropped {} event for {}: {}", event.getType(), config.getEndpoint(), result);
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
