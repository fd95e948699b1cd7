package com.tributary.backend;

import com.tributary.model.GenerateRequest;
import com.tributary.model.StreamConfig;

/**
 * Blocking streaming capability of a generative backend.
 */
@FunctionalInterface
public interface StreamingBackend {

    /**
     * Send the request to {@code config.getEndpoint()} and return its chunks as they arrive.
     *
     * @param config  config with the endpoint selected for this attempt
     * @param request generation request
     * @return open chunk stream, to be closed by the caller
     */
    ChunkStream openStream(StreamConfig config, GenerateRequest request);
}
