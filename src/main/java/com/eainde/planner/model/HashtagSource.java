package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Candidate pool a hashtag was drawn from.
 */
public enum HashtagSource {
    TRENDING,
    INDUSTRY,
    AUDIENCE,
    PLATFORM,
    BRANDED,
    CONTENT;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
