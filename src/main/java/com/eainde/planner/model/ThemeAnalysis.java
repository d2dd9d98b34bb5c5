package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

public record ThemeAnalysis(
        @JsonProperty("theme_frequency")   Map<String, Integer> themeFrequency,
        @JsonProperty("theme_goals")       Map<String, List<String>> themeGoals,
        @JsonProperty("theme_platforms")   Map<String, List<Platform>> themePlatforms,
        @JsonProperty("theme_consistency") Map<String, ThemeConsistency> themeConsistency
) implements Serializable {

    public ThemeAnalysis {
        themeFrequency = Copies.ordered(themeFrequency);
        themeGoals = Copies.ordered(themeGoals);
        themePlatforms = Copies.ordered(themePlatforms);
        themeConsistency = Copies.ordered(themeConsistency);
    }
}
