package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * @param confidenceScore number of candidate pools that listed the content type
 */
public record ContentTypeRecommendation(
        @JsonProperty("content_type")         String contentType,
        @JsonProperty("confidence_score")     int confidenceScore,
        @JsonProperty("rationale")            String rationale,
        @JsonProperty("optimal_timing")       String optimalTiming,
        @JsonProperty("engagement_potential") String engagementPotential
) implements Serializable {}
