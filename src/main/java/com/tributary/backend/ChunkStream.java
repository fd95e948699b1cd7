package com.tributary.backend;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Closeable;
import java.util.Iterator;

/**
 * Blocking iterator over the raw chunks of one backend response.
 * {@link #hasNext()} blocks until the backend sends the next chunk or ends the response.
 */
public interface ChunkStream extends Iterator<JsonNode>, Closeable {

    /**
     * Release the underlying response. Safe to call from another thread to unblock a pending read.
     */
    @Override
    void close();
}
