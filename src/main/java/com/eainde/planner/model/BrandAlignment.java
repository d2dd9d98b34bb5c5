package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Brand attributes a post or strategy is aligned to. All fields null for placeholders.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BrandAlignment(
        @JsonProperty("voice")              String voice,
        @JsonProperty("tone")               String tone,
        @JsonProperty("values")             String values,
        @JsonProperty("personality_traits") String personalityTraits
) implements Serializable {

    public static final BrandAlignment NONE = new BrandAlignment(null, null, null, null);

    public static BrandAlignment of(BrandProfile brand) {
        return new BrandAlignment(brand.voice(), brand.tone(), brand.coreValues(), brand.personalityAdjectives());
    }
}
