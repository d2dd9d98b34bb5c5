package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

public record CalendarOverview(
        @JsonProperty("total_posts")       int totalPosts,
        @JsonProperty("platforms_covered") List<Platform> platformsCovered,
        @JsonProperty("content_themes")    List<String> contentThemes,
        @JsonProperty("calendar_period")   String calendarPeriod,
        @JsonProperty("generation_date")   Instant generationDate
) implements Serializable {

    public CalendarOverview {
        platformsCovered = List.copyOf(platformsCovered);
        contentThemes = List.copyOf(contentThemes);
    }
}
