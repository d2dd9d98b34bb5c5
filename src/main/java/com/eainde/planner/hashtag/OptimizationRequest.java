package com.eainde.planner.hashtag;

import com.eainde.planner.model.Platform;

import java.io.Serializable;
import java.util.List;

/**
 * @param hashtags    tags to optimize, in preference order
 * @param contentType post type used to narrow the count window, may be null
 * @param industry    business industry, drives relevance ranking and backfill
 */
public record OptimizationRequest(
        List<String> hashtags,
        Platform platform,
        String contentType,
        String industry
) implements Serializable {

    public OptimizationRequest {
        hashtags = hashtags == null ? List.of() : List.copyOf(hashtags);
        industry = industry == null ? "" : industry;
    }
}
