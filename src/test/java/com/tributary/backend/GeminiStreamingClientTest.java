package com.tributary.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpServer;
import com.tributary.exception.BackendException;
import com.tributary.model.Content;
import com.tributary.model.GenerateRequest;
import com.tributary.model.StreamConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class GeminiStreamingClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private HttpServer server;
    private GeminiStreamingClient client;

    private final AtomicReference<String> receivedPath = new AtomicReference<>();
    private final AtomicReference<String> receivedKey = new AtomicReference<>();
    private final AtomicReference<String> receivedBody = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.start();
        client = new GeminiStreamingClient(
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), objectMapper);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private String baseUrl() {
        return "http://localhost:" + server.getAddress().getPort();
    }

    private void respond(int status, String contentType, String body) {
        server.createContext("/", exchange -> {
            receivedPath.set(exchange.getRequestURI().toString());
            receivedKey.set(exchange.getRequestHeaders().getFirst(GeminiStreamingClient.API_KEY_HEADER));
            receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));

            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", contentType);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
    }

    private StreamConfig config() {
        return StreamConfig.builder()
                .apiKey("secret-key")
                .model("gemini-test")
                .endpoint(baseUrl() + "/")
                .requestTimeout(Duration.ofSeconds(5))
                .build();
    }

    private GenerateRequest request() {
        return GenerateRequest.builder()
                .content(Content.user("Say hi"))
                .build();
    }

    @Test
    void testStreamsChunksFromServer() throws Exception {
        respond(200, "text/event-stream",
                "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Hi\"}]}}]}\n\n"
                        + "data: {\"candidates\":[{\"content\":{\"parts\":[{\"text\":\" there\"}]},\"finishReason\":\"STOP\"}]}\n\n");

        List<String> texts = new ArrayList<>();
        try (ChunkStream stream = client.openStream(config(), request())) {
            while (stream.hasNext()) {
                texts.add(GeminiResponseParser.extractText(stream.next()));
            }
        }

        assertEquals(List.of("Hi", " there"), texts);
        assertEquals("/v1beta/models/gemini-test:streamGenerateContent?alt=sse", receivedPath.get());
        assertEquals("secret-key", receivedKey.get());

        JsonNode sent = objectMapper.readTree(receivedBody.get());
        assertEquals("user", sent.path("contents").get(0).path("role").asText());
        assertEquals("Say hi", sent.path("contents").get(0).path("parts").get(0).path("text").asText());
    }

    @Test
    void testErrorStatusRaisesBackendException() {
        respond(503, "application/json", "{\"error\":{\"message\":\"overloaded\"}}");

        BackendException e = assertThrows(BackendException.class,
                () -> client.openStream(config(), request()));

        assertEquals(503, e.getStatus());
        assertTrue(e.getMessage().contains("HTTP 503"));
        assertTrue(e.getMessage().contains("overloaded"));
    }

    @Test
    void testStreamUri() {
        assertEquals(URI.create("https://g.example/v1beta/models/gemini-1.5-pro:streamGenerateContent?alt=sse"),
                GeminiStreamingClient.streamUri("https://g.example", "models/gemini-1.5-pro"));
        assertEquals(URI.create("https://g.example/v1beta/models/gemini-1.5-pro:streamGenerateContent?alt=sse"),
                GeminiStreamingClient.streamUri("https://g.example/", "gemini-1.5-pro"));
        assertThrows(IllegalArgumentException.class, () -> GeminiStreamingClient.streamUri(" ", "m"));
        assertThrows(IllegalArgumentException.class, () -> GeminiStreamingClient.streamUri("https://g.example", null));
    }

    @Test
    void testBuildPayloadMapsOptionalFields() {
        GenerateRequest request = GenerateRequest.builder()
                .content(Content.user("Plan a trip"))
                .systemInstruction("You are a planner")
                .tools(List.of(Map.of("functionDeclarations", List.of())))
                .toolConfig(Map.of("functionCallingConfig", Map.of("mode", "AUTO")))
                .generationConfig(Map.of("temperature", 0.2))
                .safetySettings(List.of(Map.of("category", "HARM_CATEGORY_HATE_SPEECH")))
                .build();

        ObjectNode payload = client.buildPayload(request);

        assertEquals("You are a planner",
                payload.path("systemInstruction").path("parts").get(0).path("text").asText());
        assertTrue(payload.path("tools").isArray());
        assertEquals("AUTO", payload.path("toolConfig").path("functionCallingConfig").path("mode").asText());
        assertEquals(0.2, payload.path("generationConfig").path("temperature").asDouble());
        assertEquals(1, payload.path("safetySettings").size());
    }

    @Test
    void testBuildPayloadOmitsAbsentFields() {
        ObjectNode payload = client.buildPayload(request());

        assertTrue(payload.has("contents"));
        assertFalse(payload.has("systemInstruction"));
        assertFalse(payload.has("tools"));
        assertFalse(payload.has("toolConfig"));
        assertFalse(payload.has("generationConfig"));
        assertFalse(payload.has("safetySettings"));
    }
}
