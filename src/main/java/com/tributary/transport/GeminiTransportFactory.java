package com.tributary.transport;

import com.tributary.backend.StreamingBackend;
import com.tributary.config.TributaryProperties;
import com.tributary.model.GenerateRequest;
import com.tributary.model.StreamConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Production transport factory: one {@link GeminiTransport} per attempt.
 */
@Component
public class GeminiTransportFactory implements TransportFactory {

    private final StreamingBackend backend;
    private final TributaryProperties properties;
    private final Scheduler deliveryScheduler;

    @Autowired
    public GeminiTransportFactory(StreamingBackend backend, TributaryProperties properties) {
        this(backend, properties, Schedulers.boundedElastic());
    }

    public GeminiTransportFactory(StreamingBackend backend,
                                  TributaryProperties properties,
                                  Scheduler deliveryScheduler) {
        this.backend = backend;
        this.properties = properties;
        this.deliveryScheduler = deliveryScheduler;
    }

    @Override
    public StreamingTransport create(StreamConfig config, GenerateRequest request) {
        return new GeminiTransport(backend, config, request,
                properties.getTransport().getJoinTimeout(), deliveryScheduler);
    }
}
