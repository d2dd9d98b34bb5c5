package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;

/**
 * Distributions over the seven posts of a calendar, keyed in first-seen order.
 */
public record CalendarStatistics(
        @JsonProperty("content_type_distribution") Map<String, Integer> contentTypeDistribution,
        @JsonProperty("platform_distribution")     Map<String, Integer> platformDistribution,
        @JsonProperty("theme_distribution")        Map<String, Integer> themeDistribution,
        @JsonProperty("goal_distribution")         Map<String, Integer> goalDistribution,
        @JsonProperty("total_posts")               int totalPosts,
        @JsonProperty("unique_platforms")          int uniquePlatforms,
        @JsonProperty("unique_themes")             int uniqueThemes,
        @JsonProperty("placeholder_posts")         int placeholderPosts
) implements Serializable {

    public CalendarStatistics {
        contentTypeDistribution = Copies.ordered(contentTypeDistribution);
        platformDistribution = Copies.ordered(platformDistribution);
        themeDistribution = Copies.ordered(themeDistribution);
        goalDistribution = Copies.ordered(goalDistribution);
    }
}
