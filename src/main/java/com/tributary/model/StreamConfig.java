package com.tributary.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration controlling streaming behaviour.
 * Read-only and shared across all attempts of a call.
 */
@Value
@Builder(toBuilder = true)
public class StreamConfig {

    String apiKey;

    String model;

    /**
     * Primary endpoint, always the first entry of {@link #endpoints()}.
     */
    String endpoint;

    @Singular
    List<String> fallbackEndpoints;

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Zero disables heartbeats.
     */
    @Builder.Default
    Duration heartbeatInterval = Duration.ofSeconds(20);

    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration backoffBase = Duration.ofSeconds(1);

    @Builder.Default
    Duration backoffMax = Duration.ofSeconds(30);

    /**
     * Ordered endpoint list: the primary followed by the fallbacks.
     */
    public List<String> endpoints() {
        List<String> endpoints = new ArrayList<>(1 + fallbackEndpoints.size());
        endpoints.add(endpoint);
        endpoints.addAll(fallbackEndpoints);
        return List.copyOf(endpoints);
    }

    /**
     * Copy of this config targeting a single selected endpoint.
     */
    public StreamConfig withEndpoint(String selected) {
        return toBuilder().endpoint(selected).build();
    }

    public boolean heartbeatsEnabled() {
        return heartbeatInterval != null && !heartbeatInterval.isZero() && !heartbeatInterval.isNegative();
    }

    /**
     * Check the invariants a stream relies on.
     *
     * @throws IllegalArgumentException if the config cannot drive a stream
     */
    public void validate() {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Stream config requires a primary endpoint");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        if (backoffBase == null || backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must be >= 0");
        }
        if (backoffMax == null || backoffMax.isNegative()) {
            throw new IllegalArgumentException("backoffMax must be >= 0");
        }
    }

    @Override
    public String toString() {
        // keep the api key out of logs
        return "StreamConfig(model=" + model
                + ", endpoints=" + endpoints()
                + ", requestTimeout=" + requestTimeout
                + ", heartbeatInterval=" + heartbeatInterval
                + ", maxRetries=" + maxRetries
                + ", backoffBase=" + backoffBase
                + ", backoffMax=" + backoffMax + ")";
    }
}
