package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;

/**
 * @param postingSchedule posts per day name
 */
public record PlatformSummary(
        @JsonProperty("total_posts")      int totalPosts,
        @JsonProperty("content_types")    Map<String, Integer> contentTypes,
        @JsonProperty("themes")           Map<String, Integer> themes,
        @JsonProperty("posting_schedule") Map<String, Integer> postingSchedule
) implements Serializable {

    public PlatformSummary {
        contentTypes = Copies.ordered(contentTypes);
        themes = Copies.ordered(themes);
        postingSchedule = Copies.ordered(postingSchedule);
    }
}
