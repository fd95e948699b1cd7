package com.tributary.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * Event emitted during streaming.
 * Instances are created through the static factories only.
 */
@Value
@AllArgsConstructor(staticName = "of")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamEvent {

    @JsonProperty("type")
    StreamEventType type;

    @JsonProperty("text")
    String text; // chunk text or error message

    @JsonProperty("raw")
    JsonNode raw;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static StreamEvent chunk(String text, JsonNode raw) {
        return of(StreamEventType.CHUNK, text == null ? "" : text, raw, Instant.now());
    }

    public static StreamEvent chunk(String text) {
        return chunk(text, null);
    }

    public static StreamEvent heartbeat() {
        return of(StreamEventType.HEARTBEAT, null, null, Instant.now());
    }

    public static StreamEvent complete() {
        return of(StreamEventType.COMPLETE, null, null, Instant.now());
    }

    public static StreamEvent error(String message) {
        return of(StreamEventType.ERROR, message, null, Instant.now());
    }

    public static StreamEvent endOfAttempt() {
        return of(StreamEventType.END_OF_ATTEMPT, null, null, Instant.now());
    }

    @JsonIgnore
    public boolean isChunk() {
        return type == StreamEventType.CHUNK;
    }

    @JsonIgnore
    public boolean isEndOfAttempt() {
        return type == StreamEventType.END_OF_ATTEMPT;
    }
}
