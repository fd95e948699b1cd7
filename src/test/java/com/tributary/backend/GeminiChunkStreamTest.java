package com.tributary.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tributary.exception.BackendException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class GeminiChunkStreamTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private GeminiChunkStream stream(String body, Closeable response) {
        return new GeminiChunkStream(
                new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)), response, objectMapper);
    }

    private GeminiChunkStream stream(String body) {
        return stream(body, null);
    }

    private static List<String> texts(GeminiChunkStream stream) {
        List<String> texts = new ArrayList<>();
        while (stream.hasNext()) {
            texts.add(GeminiResponseParser.extractText(stream.next()));
        }
        return texts;
    }

    @Test
    void testParsesConsecutiveEvents() {
        String body = "data: {\"text\":\"Hello\"}\n\n"
                + "data: {\"text\":\" world\"}\n\n";

        assertEquals(List.of("Hello", " world"), texts(stream(body)));
    }

    @Test
    void testJoinsMultiLineData() {
        String body = "data: {\"text\":\n"
                + "data: \"joined\"}\n\n";

        assertEquals(List.of("joined"), texts(stream(body)));
    }

    @Test
    void testSkipsCommentsFieldsAndDoneMarker() {
        String body = ": keep-alive\n\n"
                + "event: message\n"
                + "id: 1\n"
                + "data: {\"text\":\"only\"}\n\n"
                + "data: [DONE]\n\n";

        assertEquals(List.of("only"), texts(stream(body)));
    }

    @Test
    void testLastEventWithoutTrailingBlankLine() {
        String body = "data: {\"text\":\"a\"}\n\n"
                + "data: {\"text\":\"b\"}";

        assertEquals(List.of("a", "b"), texts(stream(body)));
    }

    @Test
    void testEmptyBodyHasNoChunks() {
        GeminiChunkStream stream = stream("");

        assertFalse(stream.hasNext());
        assertThrows(NoSuchElementException.class, stream::next);
    }

    @Test
    void testHasNextIsIdempotent() {
        GeminiChunkStream stream = stream("data: {\"text\":\"x\"}\n\n");

        assertTrue(stream.hasNext());
        assertTrue(stream.hasNext());
        JsonNode chunk = stream.next();
        assertEquals("x", chunk.path("text").asText());
        assertFalse(stream.hasNext());
    }

    @Test
    void testErrorPayloadFailsWithBackendException() {
        String body = "data: {\"text\":\"before\"}\n\n"
                + "data: {\"error\":{\"code\":429,\"message\":\"Resource exhausted\"}}\n\n";
        GeminiChunkStream stream = stream(body);

        assertEquals("before", stream.next().path("text").asText());
        BackendException e = assertThrows(BackendException.class, stream::hasNext);
        assertEquals(429, e.getStatus());
        assertEquals("Resource exhausted", e.getMessage());
    }

    @Test
    void testMalformedPayloadFailsWithUncheckedIo() {
        GeminiChunkStream stream = stream("data: {not json\n\n");

        assertThrows(UncheckedIOException.class, stream::hasNext);
    }

    @Test
    void testCloseReleasesResponseOnce() {
        AtomicBoolean released = new AtomicBoolean();
        int[] closes = new int[1];
        GeminiChunkStream stream = stream("data: {\"text\":\"x\"}\n\n", () -> {
            released.set(true);
            closes[0]++;
        });

        stream.close();
        stream.close();

        assertTrue(released.get());
        assertEquals(1, closes[0]);
    }

    @Test
    void testReadAfterCloseEndsQuietly() {
        GeminiChunkStream stream = new GeminiChunkStream(new ClosedInputStream(), null, objectMapper);

        stream.close();

        assertFalse(stream.hasNext());
    }

    /**
     * Input stream that fails every read, like a socket closed from another thread.
     */
    private static class ClosedInputStream extends java.io.InputStream {

        @Override
        public int read() throws java.io.IOException {
            throw new java.io.IOException("Stream closed");
        }
    }
}
