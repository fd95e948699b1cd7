package com.tributary.service;

import com.tributary.model.StreamEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Stitches chunk events into the final text.
 * Every other event type is ignored, so heartbeats never change the result.
 * Not thread-safe; owned by one caller for the lifetime of one call.
 */
public class TextAccumulator {

    private final List<String> parts = new ArrayList<>();

    public void push(StreamEvent event) {
        if (event == null || !event.isChunk()) {
            return;
        }
        String text = event.getText();
        if (text != null && !text.isEmpty()) {
            parts.add(text);
        }
    }

    /**
     * Concatenation of all chunk texts pushed so far, in delivery order.
     */
    public String text() {
        return String.join("", parts);
    }
}
