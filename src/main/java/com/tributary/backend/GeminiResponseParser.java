package com.tributary.backend;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Text extraction from Gemini response chunks.
 */
public final class GeminiResponseParser {

    private GeminiResponseParser() {
    }

    /**
     * Text carried by one chunk: the top-level {@code text} field if present,
     * otherwise every {@code candidates[*].content.parts[*].text} concatenated.
     */
    public static String extractText(JsonNode chunk) {
        if (chunk == null) {
            return "";
        }
        String direct = chunk.path("text").asText(null);
        if (direct != null && !direct.isEmpty()) {
            return direct;
        }
        JsonNode candidates = chunk.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode candidate : candidates) {
            JsonNode parts = candidate.path("content").path("parts");
            if (!parts.isArray()) {
                continue;
            }
            for (JsonNode part : parts) {
                String text = part.path("text").asText(null);
                if (text != null) {
                    sb.append(text);
                }
            }
        }
        return sb.toString();
    }

    /**
     * Finish reason of the first candidate, or null while the response is still running.
     */
    public static String extractFinishReason(JsonNode chunk) {
        if (chunk == null) {
            return null;
        }
        JsonNode candidates = chunk.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            return null;
        }
        return candidates.get(0).path("finishReason").asText(null);
    }
}
