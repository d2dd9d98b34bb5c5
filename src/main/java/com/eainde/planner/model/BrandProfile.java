package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

import static com.eainde.planner.model.Validation.requireText;

/**
 * How the brand speaks. Created once per run, never mutated.
 */
public record BrandProfile(
        @JsonProperty("voice")                  String voice,
        @JsonProperty("tone")                   String tone,
        @JsonProperty("core_values")            String coreValues,
        @JsonProperty("personality_adjectives") String personalityAdjectives
) implements Serializable {

    public static BrandProfile of(String voice, String tone, String coreValues, String personalityAdjectives) {
        return new BrandProfile(
                requireText("voice", voice),
                requireText("tone", tone),
                requireText("core_values", coreValues),
                requireText("personality_adjectives", personalityAdjectives));
    }
}
