package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * @param goalDiversity    distinct goals served by the theme
 * @param consistencyScore 1.0 for at most two distinct goals, 0.5 otherwise
 */
public record ThemeConsistency(
        @JsonProperty("goal_diversity")    int goalDiversity,
        @JsonProperty("consistency_score") double consistencyScore
) implements Serializable {

    public static ThemeConsistency forGoalDiversity(int goalDiversity) {
        return new ThemeConsistency(goalDiversity, goalDiversity <= 2 ? 1.0 : 0.5);
    }
}
