package com.tributary.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One conversation turn sent to the backend.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Content {

    @JsonProperty("role")
    String role; // user, model

    @Singular
    @JsonProperty("parts")
    List<Part> parts;

    public static Content user(String text) {
        return Content.builder().role("user").part(Part.text(text)).build();
    }
}
