package com.tributary.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Streaming generation request. Immutable, one per call.
 *
 * Tool declarations, generation parameters and safety settings are passed through
 * to the backend untouched.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerateRequest {

    @Singular
    @JsonProperty("contents")
    List<Content> contents;

    @JsonProperty("system_instruction")
    String systemInstruction;

    @JsonProperty("tools")
    List<Map<String, Object>> tools;

    @JsonProperty("tool_config")
    Map<String, Object> toolConfig;

    @JsonProperty("generation_config")
    Map<String, Object> generationConfig;

    @JsonProperty("safety_settings")
    List<Map<String, Object>> safetySettings;

    @JsonProperty("timeout_seconds")
    Double timeoutSeconds;

    /**
     * Per-request timeout override, if one was given.
     */
    @JsonIgnore
    public Optional<Duration> getTimeout() {
        if (timeoutSeconds == null || timeoutSeconds <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(Math.round(timeoutSeconds * 1000)));
    }
}
