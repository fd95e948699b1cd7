package com.tributary.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Accumulated result of a non-streaming generation call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateResponse {

    @JsonProperty("text")
    private String text;

    @JsonProperty("chunks")
    private int chunks;

    @JsonProperty("heartbeats")
    private int heartbeats;
}
