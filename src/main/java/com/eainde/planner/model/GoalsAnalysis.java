package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * @param primaryGoals      the goals text as given
 * @param contentPriorities matched goal tags, in table order
 * @param focusAreas        the first two priorities
 */
public record GoalsAnalysis(
        @JsonProperty("primary_goals")      String primaryGoals,
        @JsonProperty("content_priorities") List<String> contentPriorities,
        @JsonProperty("focus_areas")        List<String> focusAreas
) implements Serializable {

    public GoalsAnalysis {
        contentPriorities = List.copyOf(contentPriorities);
        focusAreas = List.copyOf(focusAreas);
    }
}
