package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

import static com.eainde.planner.model.Validation.requireText;

/**
 * What the business does and wants. Created once per run, never mutated.
 */
public record BusinessProfile(
        @JsonProperty("industry")           String industry,
        @JsonProperty("target_audience")    String targetAudience,
        @JsonProperty("business_goals")     String businessGoals,
        @JsonProperty("current_challenges") String currentChallenges
) implements Serializable {

    /** Validates and trims every field. */
    public static BusinessProfile of(String industry, String targetAudience,
                                     String businessGoals, String currentChallenges) {
        return new BusinessProfile(
                requireText("industry", industry),
                requireText("target_audience", targetAudience),
                requireText("business_goals", businessGoals),
                requireText("current_challenges", currentChallenges));
    }
}
