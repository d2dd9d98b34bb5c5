package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record BusinessContext(
        @JsonProperty("industry")        String industry,
        @JsonProperty("target_audience") String targetAudience,
        @JsonProperty("business_goals")  String businessGoals,
        @JsonProperty("brand_voice")     String brandVoice,
        @JsonProperty("brand_tone")      String brandTone
) implements Serializable {

    public static BusinessContext of(BusinessProfile business, BrandProfile brand) {
        return new BusinessContext(business.industry(), business.targetAudience(),
                business.businessGoals(), brand.voice(), brand.tone());
    }
}
