package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Hashtags after platform optimization.
 *
 * @param window      count range that was applied, content-type narrowed where possible
 * @param underFilled true when backfilling could not reach {@code window.min()}
 * @param notes       human readable record of the adjustments made
 */
public record OptimizedHashtagSet(
        @JsonProperty("platform")          Platform platform,
        @JsonProperty("content_type")      String contentType,
        @JsonProperty("hashtags")          List<String> hashtags,
        @JsonProperty("window")            HashtagWindow window,
        @JsonProperty("under_filled")      boolean underFilled,
        @JsonProperty("notes")             List<String> notes,
        @JsonProperty("compliance_report") ComplianceReport complianceReport
) implements Serializable {

    public OptimizedHashtagSet {
        hashtags = List.copyOf(hashtags);
        notes = List.copyOf(notes);
    }
}
