package com.tributary.service;

import com.tributary.exception.StreamException;
import com.tributary.exception.TransportException;
import com.tributary.model.GenerateRequest;
import com.tributary.model.StreamConfig;
import com.tributary.model.StreamEvent;
import com.tributary.model.StreamEventType;
import com.tributary.transport.StreamingTransport;
import com.tributary.transport.TransportFactory;
import org.slf4j.Logger;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Coordinates streaming sessions, retries, endpoint fail-over and heartbeats.
 *
 * <p>Each subscription to {@link #stream} is one logical call. Attempts run strictly one
 * after another: an attempt's transport events are merged with a heartbeat ticker, caller
 * visible events are forwarded as they arrive, and the attempt ends on its complete or
 * error event. On error the transport and ticker are cancelled, the client waits out the
 * backoff and tries the next endpoint, until the retry budget runs out and the stream
 * fails with {@link StreamException}.
 *
 * <p>Chunks delivered by a failed attempt stay delivered; only its error event is withheld.
 */
public class ResilientStreamClient {

    private final TransportFactory defaultTransportFactory;
    private final Supplier<StreamConfig> defaultConfig;
    private final Logger log;

    /**
     * @param defaultTransportFactory transport used when a call does not supply its own
     * @param defaultConfig           config for calls that do not supply their own
     * @param log                     structured logger for attempt lifecycle records
     */
    public ResilientStreamClient(TransportFactory defaultTransportFactory,
                                 Supplier<StreamConfig> defaultConfig,
                                 Logger log) {
        this.defaultTransportFactory = Objects.requireNonNull(defaultTransportFactory, "defaultTransportFactory");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
        this.log = Objects.requireNonNull(log, "log");
    }

    /**
     * Stream with the application's configured {@link StreamConfig}.
     */
    public Flux<StreamEvent> stream(GenerateRequest request) {
        return Flux.defer(() -> stream(request, defaultConfig.get(), null));
    }

    public Flux<StreamEvent> stream(GenerateRequest request, StreamConfig config) {
        return stream(request, config, null);
    }

    /**
     * Stream events with retry semantics.
     *
     * @param request          generation payload
     * @param config           streaming configuration, shared read-only by all attempts
     * @param transportFactory transport override, or null for the production transport
     * @return chunk, heartbeat and complete events; fails with {@link StreamException}
     *         once every attempt has failed
     * @throws IllegalArgumentException if the config violates its invariants
     */
    public Flux<StreamEvent> stream(GenerateRequest request,
                                    StreamConfig config,
                                    TransportFactory transportFactory) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(config, "config");
        StreamRetryPolicy policy = new StreamRetryPolicy(config);
        TransportFactory factory = transportFactory != null ? transportFactory : defaultTransportFactory;

        return Flux.defer(() -> {
            AtomicInteger nextAttempt = new AtomicInteger();
            return Flux.defer(() -> attempt(request, config, factory, policy, nextAttempt.getAndIncrement()))
                    .retryWhen(retry(policy))
                    .doOnComplete(() -> log.atDebug()
                            .addKeyValue("attempts", nextAttempt.get())
                            .log("Stream completed"));
        });
    }

    /**
     * One attempt: transport events merged with heartbeats, up to the attempt's terminal event.
     */
    private Flux<StreamEvent> attempt(GenerateRequest request,
                                      StreamConfig config,
                                      TransportFactory factory,
                                      StreamRetryPolicy policy,
                                      int attemptIndex) {
        String endpoint = policy.endpointFor(attemptIndex);
        StreamConfig attemptConfig = config.withEndpoint(endpoint);

        log.atInfo()
                .addKeyValue("attempt", attemptIndex)
                .addKeyValue("endpoint", endpoint)
                .log("Starting stream attempt");

        // entry failures and transport errors both become an error event
        Flux<StreamEvent> transportEvents = Flux.using(
                        () -> factory.create(attemptConfig, request),
                        (StreamingTransport transport) -> {
                            transport.open();
                            return transport.events();
                        },
                        StreamingTransport::close)
                // a transport that completes without its sentinel still ends the attempt
                .concatWith(Mono.just(StreamEvent.endOfAttempt()))
                .onErrorResume(error -> Flux.just(
                        StreamEvent.error(describe(error)),
                        StreamEvent.endOfAttempt()));

        Flux<StreamEvent> merged = config.heartbeatsEnabled()
                ? Flux.merge(transportEvents, heartbeats(config.getHeartbeatInterval()))
                : transportEvents;

        return merged
                .takeUntil(event -> event.getType() == StreamEventType.COMPLETE || event.isEndOfAttempt())
                .<StreamEvent>handle((event, sink) -> {
                    switch (event.getType()) {
                        case ERROR -> sink.error(new TransportException(endpoint, event.getText()));
                        case END_OF_ATTEMPT -> {
                            // consumed here, never forwarded
                        }
                        default -> sink.next(event);
                    }
                });
    }

    private Flux<StreamEvent> heartbeats(Duration interval) {
        return Flux.interval(interval).map(tick -> StreamEvent.heartbeat());
    }

    private Retry retry(StreamRetryPolicy policy) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            int failedAttempt = (int) signal.totalRetries();
            Throwable failure = signal.failure();

            if (!policy.canRetry(failedAttempt)) {
                int attempts = failedAttempt + 1;
                log.atError()
                        .addKeyValue("attempts", attempts)
                        .addKeyValue("error", failure.getMessage())
                        .log("Stream retries exhausted");
                return Mono.<Long>error(new StreamException(
                        "Stream failed after " + attempts + " attempts: " + failure.getMessage(),
                        attempts,
                        failure));
            }

            Duration delay = policy.backoffFor(failedAttempt);
            log.atWarn()
                    .addKeyValue("attempt", failedAttempt + 1)
                    .addKeyValue("endpoint", policy.endpointFor(failedAttempt + 1))
                    .addKeyValue("delay_ms", delay.toMillis())
                    .addKeyValue("error", failure.getMessage())
                    .log("Retrying stream");
            return Mono.delay(delay);
        }));
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }
}
