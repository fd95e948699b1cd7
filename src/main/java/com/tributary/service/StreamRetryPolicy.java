package com.tributary.service;

import com.tributary.model.StreamConfig;

import java.time.Duration;
import java.util.List;

/**
 * Endpoint selection and backoff for one logical stream.
 *
 * Attempt {@code i} uses {@code endpoints[min(i, n - 1)]}: each retry walks forward through
 * the fallbacks and then stays on the last one. The delay after a failed attempt {@code i}
 * is {@code min(backoffBase * 2^i, backoffMax)}.
 */
public class StreamRetryPolicy {

    private final List<String> endpoints;
    private final int maxRetries;
    private final Duration backoffBase;
    private final Duration backoffMax;

    public StreamRetryPolicy(StreamConfig config) {
        config.validate();
        this.endpoints = config.endpoints();
        this.maxRetries = config.getMaxRetries();
        this.backoffBase = config.getBackoffBase();
        this.backoffMax = config.getBackoffMax();
    }

    /**
     * Endpoint for a 0-based attempt index.
     */
    public String endpointFor(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0, was " + attemptIndex);
        }
        return endpoints.get(Math.min(attemptIndex, endpoints.size() - 1));
    }

    /**
     * Delay to wait after attempt {@code attemptIndex} failed, before the next one starts.
     */
    public Duration backoffFor(int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0, was " + attemptIndex);
        }
        if (attemptIndex >= Long.SIZE - 2) {
            return backoffBase.isZero() ? Duration.ZERO : backoffMax;
        }
        try {
            Duration delay = backoffBase.multipliedBy(1L << attemptIndex);
            return delay.compareTo(backoffMax) > 0 ? backoffMax : delay;
        } catch (ArithmeticException overflow) {
            return backoffMax;
        }
    }

    /**
     * Whether another attempt may follow a failure of {@code attemptIndex}.
     */
    public boolean canRetry(int attemptIndex) {
        return attemptIndex < maxRetries;
    }
}
