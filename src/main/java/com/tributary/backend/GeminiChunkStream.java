package com.tributary.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tributary.exception.BackendException;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;

/**
 * Lazily parses a Gemini {@code alt=sse} response body into JSON chunks.
 *
 * Consecutive {@code data:} lines are joined until a blank line ends the event.
 * Comment lines and other SSE fields are ignored, as is a {@code [DONE]} marker.
 * A payload carrying an {@code error} object fails the stream with {@link BackendException}.
 */
@Slf4j
public class GeminiChunkStream implements ChunkStream {

    private static final String DATA_FIELD = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final InputStream body;
    private final BufferedReader reader;
    private final Closeable response;
    private final ObjectMapper objectMapper;

    private JsonNode pending;
    private boolean exhausted;
    private volatile boolean closed;

    public GeminiChunkStream(InputStream body, Closeable response, ObjectMapper objectMapper) {
        this.body = body;
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
        this.response = response;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        pending = readNextChunk();
        if (pending == null) {
            exhausted = true;
        }
        return pending != null;
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Gemini stream has no more chunks");
        }
        JsonNode chunk = pending;
        pending = null;
        return chunk;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        // close the raw body rather than the reader: a blocked readLine holds the reader's lock
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Error closing Gemini response body: {}", e.getMessage());
        }
        if (response != null) {
            try {
                response.close();
            } catch (IOException e) {
                log.debug("Error closing Gemini response: {}", e.getMessage());
            }
        }
    }

    private JsonNode readNextChunk() {
        StringBuilder data = new StringBuilder();
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    JsonNode chunk = parse(data);
                    data.setLength(0);
                    if (chunk != null) {
                        return chunk;
                    }
                    continue;
                }
                if (line.startsWith(DATA_FIELD)) {
                    String value = line.substring(DATA_FIELD.length());
                    if (value.startsWith(" ")) {
                        value = value.substring(1);
                    }
                    if (data.length() > 0) {
                        data.append('\n');
                    }
                    data.append(value);
                }
                // comments, event:, id: and retry: lines carry nothing we need
            }
            // body may end without a trailing blank line
            return parse(data);
        } catch (IOException e) {
            if (closed) {
                return null;
            }
            throw new UncheckedIOException("Failed to read Gemini stream", e);
        }
    }

    private JsonNode parse(StringBuilder data) throws IOException {
        String payload = data.toString().trim();
        if (payload.isEmpty() || DONE_MARKER.equals(payload)) {
            return null;
        }
        JsonNode node = objectMapper.readTree(payload);
        JsonNode error = node.path("error");
        if (error.isObject()) {
            throw new BackendException(
                    error.path("code").asInt(-1),
                    error.path("message").asText("Gemini stream reported an error"));
        }
        return node;
    }
}
