package com.tributary.controller;

import com.tributary.exception.StreamException;
import com.tributary.model.GenerateRequest;
import com.tributary.model.StreamEvent;
import com.tributary.model.StreamEventType;
import com.tributary.model.dto.ErrorResponse;
import com.tributary.model.dto.GenerateResponse;
import com.tributary.service.ResilientStreamClient;
import com.tributary.service.TextAccumulator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP surface of the streaming client.
 * Streams events as Server-Sent Events, or returns the accumulated text in one response.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class StreamController {

    private final ResilientStreamClient streamClient;

    public StreamController(ResilientStreamClient streamClient) {
        this.streamClient = streamClient;
    }

    /**
     * Stream generation events as SSE. The event name is the lower-case event type;
     * an exhausted retry budget ends the stream with a single {@code error} event.
     */
    @PostMapping(value = "/generate/stream",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> streamGeneration(@RequestBody GenerateRequest request) {
        validate(request);
        log.info("Received streaming request with {} contents", request.getContents().size());

        return streamClient.stream(request)
                .map(this::toServerSentEvent)
                .onErrorResume(StreamException.class, e -> {
                    log.warn("Stream failed after {} attempts: {}", e.getAttempts(), e.getMessage());
                    return Flux.just(ServerSentEvent.<Object>builder()
                            .event("error")
                            .data(new ErrorResponse("stream_failed", e.getMessage()))
                            .build());
                });
    }

    /**
     * Run the stream to completion and return the accumulated text.
     */
    @PostMapping(value = "/generate",
                 consumes = MediaType.APPLICATION_JSON_VALUE,
                 produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<GenerateResponse> generate(@RequestBody GenerateRequest request) {
        validate(request);
        log.info("Received generation request with {} contents", request.getContents().size());

        TextAccumulator accumulator = new TextAccumulator();
        AtomicInteger chunks = new AtomicInteger();
        AtomicInteger heartbeats = new AtomicInteger();

        return streamClient.stream(request)
                .doOnNext(event -> {
                    accumulator.push(event);
                    if (event.getType() == StreamEventType.CHUNK) {
                        chunks.incrementAndGet();
                    } else if (event.getType() == StreamEventType.HEARTBEAT) {
                        heartbeats.incrementAndGet();
                    }
                })
                .then(Mono.fromSupplier(() -> GenerateResponse.builder()
                        .text(accumulator.text())
                        .chunks(chunks.get())
                        .heartbeats(heartbeats.get())
                        .build()));
    }

    @ExceptionHandler(StreamException.class)
    public ResponseEntity<ErrorResponse> handleStreamFailure(StreamException e) {
        log.warn("Generation failed after {} attempts: {}", e.getAttempts(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("stream_failed", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("invalid_request", e.getMessage()));
    }

    private ServerSentEvent<Object> toServerSentEvent(StreamEvent event) {
        return ServerSentEvent.<Object>builder()
                .event(event.getType().name().toLowerCase(Locale.ROOT))
                .data(event)
                .build();
    }

    private void validate(GenerateRequest request) {
        if (request.getContents() == null || request.getContents().isEmpty()) {
            throw new IllegalArgumentException("Contents cannot be empty");
        }
    }
}
