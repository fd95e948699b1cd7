package com.tributary.config;

import com.tributary.model.StreamConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for Tributary.
 *
 * Defaults live in application.yml; the GEMINI_* environment variables override them.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tributary")
public class TributaryProperties {

    private GeminiConfig gemini = new GeminiConfig();
    private TransportConfig transport = new TransportConfig();

    @Data
    public static class GeminiConfig {
        private String apiKey;
        private String model = "models/gemini-1.5-pro";
        private String primaryEndpoint = "https://generativelanguage.googleapis.com";
        private List<String> fallbackEndpoints = new ArrayList<>();
        private double requestTimeoutSeconds = 45.0;
        private double heartbeatIntervalSeconds = 10.0;
        private int maxRetries = 4;
        private BackoffConfig backoff = new BackoffConfig();
    }

    @Data
    public static class BackoffConfig {
        private double factor = 1.5;
        private double maxDelaySeconds = 60.0;
    }

    @Data
    public static class TransportConfig {
        private Duration joinTimeout = Duration.ofMillis(100);
        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    /**
     * Materialise the immutable stream config from the bound properties.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    public StreamConfig toStreamConfig() {
        GeminiConfig g = gemini;
        if (g.getPrimaryEndpoint() == null || g.getPrimaryEndpoint().isBlank()) {
            throw new IllegalArgumentException("tributary.gemini.primary-endpoint must be set");
        }
        requireRange(g.getRequestTimeoutSeconds() > 0, "request-timeout-seconds must be > 0");
        requireRange(g.getHeartbeatIntervalSeconds() >= 0, "heartbeat-interval-seconds must be >= 0");
        requireRange(g.getMaxRetries() >= 0, "max-retries must be >= 0");
        requireRange(g.getBackoff().getFactor() > 0, "backoff.factor must be > 0");
        requireRange(g.getBackoff().getMaxDelaySeconds() > 0, "backoff.max-delay-seconds must be > 0");

        return StreamConfig.builder()
                .apiKey(g.getApiKey())
                .model(g.getModel())
                .endpoint(g.getPrimaryEndpoint().trim())
                .fallbackEndpoints(cleanEndpoints(g.getFallbackEndpoints()))
                .requestTimeout(seconds(g.getRequestTimeoutSeconds()))
                .heartbeatInterval(seconds(g.getHeartbeatIntervalSeconds()))
                .maxRetries(g.getMaxRetries())
                .backoffBase(seconds(g.getBackoff().getFactor()))
                .backoffMax(seconds(g.getBackoff().getMaxDelaySeconds()))
                .build();
    }

    /**
     * Fractional seconds to a millisecond-precision duration.
     */
    static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }

    /**
     * Trim entries and drop blanks, so "a, b," binds to [a, b].
     */
    static List<String> cleanEndpoints(List<String> endpoints) {
        if (endpoints == null) {
            return List.of();
        }
        return endpoints.stream()
                .filter(endpoint -> endpoint != null && !endpoint.isBlank())
                .map(String::trim)
                .toList();
    }

    private static void requireRange(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException("tributary.gemini." + message);
        }
    }
}
