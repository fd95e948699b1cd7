package com.tributary.transport;

import com.tributary.model.GenerateRequest;
import com.tributary.model.StreamConfig;

/**
 * Creates the transport for one attempt.
 * The config passed in already has the attempt's endpoint selected.
 */
@FunctionalInterface
public interface TransportFactory {

    StreamingTransport create(StreamConfig config, GenerateRequest request);
}
