package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Platform hints attached to a post. All fields null for placeholders.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlatformOptimization(
        @JsonProperty("best_posting_times")     String bestPostingTimes,
        @JsonProperty("optimal_length")         String optimalLength,
        @JsonProperty("engagement_tips")        String engagementTips,
        @JsonProperty("visual_recommendations") String visualRecommendations
) implements Serializable {

    public static final PlatformOptimization NONE = new PlatformOptimization(null, null, null, null);
}
