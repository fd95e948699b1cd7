package com.tributary.backend;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tributary.exception.BackendException;
import com.tributary.model.GenerateRequest;
import com.tributary.model.StreamConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Blocking client for Gemini's {@code streamGenerateContent} endpoint.
 *
 * The call returns as soon as response headers arrive; chunks are then pulled from the
 * returned {@link ChunkStream} one server-sent event at a time.
 */
@Slf4j
@Component
public class GeminiStreamingClient implements StreamingBackend {

    static final String API_KEY_HEADER = "x-goog-api-key";

    private static final int MAX_ERROR_BODY = 512;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GeminiStreamingClient(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ChunkStream openStream(StreamConfig config, GenerateRequest request) {
        Duration timeout = request.getTimeout().orElse(config.getRequestTimeout());
        URI uri = streamUri(config.getEndpoint(), config.getModel());

        log.info("Opening Gemini stream: endpoint={}, model={}, timeout={}",
                config.getEndpoint(), config.getModel(), timeout);

        return restClient(timeout).post()
                .uri(uri)
                .header(API_KEY_HEADER, config.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .body(buildPayload(request))
                .exchange((clientRequest, clientResponse) -> {
                    int status = clientResponse.getStatusCode().value();
                    if (clientResponse.getStatusCode().isError()) {
                        String body;
                        try (clientResponse) {
                            body = new String(clientResponse.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        }
                        throw new BackendException(status,
                                "Gemini returned HTTP " + status + ": " + abbreviate(body));
                    }
                    return new GeminiChunkStream(clientResponse.getBody(), clientResponse, objectMapper);
                }, false);
    }

    /**
     * Build the JSON payload for a streaming request.
     */
    ObjectNode buildPayload(GenerateRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.set("contents", objectMapper.valueToTree(request.getContents()));

        if (request.getSystemInstruction() != null && !request.getSystemInstruction().isBlank()) {
            ObjectNode instruction = payload.putObject("systemInstruction");
            instruction.putArray("parts").addObject().put("text", request.getSystemInstruction());
        }
        if (request.getTools() != null) {
            payload.set("tools", objectMapper.valueToTree(request.getTools()));
        }
        if (request.getToolConfig() != null) {
            payload.set("toolConfig", objectMapper.valueToTree(request.getToolConfig()));
        }
        if (request.getGenerationConfig() != null) {
            payload.set("generationConfig", objectMapper.valueToTree(request.getGenerationConfig()));
        }
        if (request.getSafetySettings() != null) {
            payload.set("safetySettings", objectMapper.valueToTree(request.getSafetySettings()));
        }
        return payload;
    }

    /**
     * Resolve the streaming URI for an endpoint base URL and model name.
     */
    static URI streamUri(String endpoint, String model) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Gemini endpoint must not be blank");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Gemini model must not be blank");
        }
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        String modelPath = model.startsWith("models/") ? model : "models/" + model;
        return URI.create(base + "/v1beta/" + modelPath + ":streamGenerateContent?alt=sse");
    }

    private RestClient restClient(Duration timeout) {
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            requestFactory.setReadTimeout(timeout);
        }
        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
