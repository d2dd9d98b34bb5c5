package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Ranked content types for one day, best first, at most five.
 */
public record ContentTypeRanking(
        @JsonProperty("day")             int day,
        @JsonProperty("platform")        Platform platform,
        @JsonProperty("recommendations") List<ContentTypeRecommendation> recommendations
) implements Serializable {

    public ContentTypeRanking {
        recommendations = List.copyOf(recommendations);
    }

    public List<String> contentTypes() {
        return recommendations.stream().map(ContentTypeRecommendation::contentType).toList();
    }
}
