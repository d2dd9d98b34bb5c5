package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The weekly strategy derived from the three input profiles.
 *
 * <p>{@code weeklyStructure} is keyed by English day name, Monday first. {@code contentMix}
 * holds percentages that sum to 100.</p>
 */
public record StrategyFramework(
        @JsonProperty("industry")             String industry,
        @JsonProperty("target_audience")      String targetAudience,
        @JsonProperty("goals_analysis")       GoalsAnalysis goalsAnalysis,
        @JsonProperty("challenges_analysis")  ChallengesAnalysis challengesAnalysis,
        @JsonProperty("brand_alignment")      BrandAlignment brandAlignment,
        @JsonProperty("platforms")            List<Platform> platforms,
        @JsonProperty("platform_priorities")  String platformPriorities,
        @JsonProperty("platform_guidance")    Map<Platform, PlatformGuidance> platformGuidance,
        @JsonProperty("themes")               List<Theme> themes,
        @JsonProperty("platform_post_types")  Map<Platform, List<String>> platformPostTypes,
        @JsonProperty("weekly_structure")     Map<String, DayPlan> weeklyStructure,
        @JsonProperty("content_mix")          Map<String, Integer> contentMix,
        @JsonProperty("success_metrics")      List<String> successMetrics
) implements Serializable {

    public StrategyFramework {
        platforms = List.copyOf(platforms);
        themes = List.copyOf(themes);
        successMetrics = List.copyOf(successMetrics);
        platformGuidance = Copies.ordered(platformGuidance);
        platformPostTypes = Copies.ordered(platformPostTypes);
        weeklyStructure = Copies.ordered(weeklyStructure);
        contentMix = Copies.ordered(contentMix);
    }

    @JsonIgnore
    public Optional<DayPlan> dayPlan(String dayName) {
        return Optional.ofNullable(weeklyStructure.get(dayName));
    }

    @JsonIgnore
    public List<String> postTypesFor(Platform platform) {
        return platformPostTypes.getOrDefault(platform, List.of());
    }

    @JsonIgnore
    public int contentMixTotal() {
        return contentMix.values().stream().mapToInt(Integer::intValue).sum();
    }
}
