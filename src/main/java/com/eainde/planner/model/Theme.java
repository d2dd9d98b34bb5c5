package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A named content category with its strategic intent.
 */
public record Theme(
        @JsonProperty("name")        String name,
        @JsonProperty("description") String description,
        @JsonProperty("alignment")   String alignment
) implements Serializable {}
