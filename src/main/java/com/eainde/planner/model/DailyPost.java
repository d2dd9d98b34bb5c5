package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * One post of the weekly calendar.
 */
public record DailyPost(
        @JsonProperty("day")                   int day,
        @JsonProperty("day_name")              String dayName,
        @JsonProperty("platform")              Platform platform,
        @JsonProperty("goal")                  String goal,
        @JsonProperty("post_type")             String postType,
        @JsonProperty("title")                 String title,
        @JsonProperty("caption")               String caption,
        @JsonProperty("content_theme")         String contentTheme,
        @JsonProperty("platform_optimization") PlatformOptimization platformOptimization,
        @JsonProperty("brand_alignment")       BrandAlignment brandAlignment,
        @JsonProperty("target_audience")       String targetAudience,
        @JsonProperty("timestamp")             Instant timestamp
) implements Serializable {

    public static final String PLACEHOLDER_THEME = "General Content";

    @JsonIgnore
    public boolean isPlaceholder() {
        return PLACEHOLDER_THEME.equals(contentTheme);
    }
}
