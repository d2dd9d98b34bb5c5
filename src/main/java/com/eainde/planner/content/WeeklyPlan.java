package com.eainde.planner.content;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Outcome of generating the week.
 *
 * @param generatedDays days whose post was written, ascending
 * @param failures      error message per day that produced no post
 */
public record WeeklyPlan(
        @JsonProperty("generated_days") List<Integer> generatedDays,
        @JsonProperty("failures")       Map<Integer, String> failures
) implements Serializable {

    public WeeklyPlan {
        generatedDays = List.copyOf(generatedDays);
        failures = Map.copyOf(failures);
    }
}
