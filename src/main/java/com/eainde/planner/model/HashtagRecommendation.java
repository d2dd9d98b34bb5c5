package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Hashtags recommended for one day's post.
 *
 * @param finalSet            duplicate-free, ranked by relevance, size inside the platform window
 * @param breakdownByCategory quota picks per category (popular, niche, branded, content_specific)
 * @param candidates          every scored candidate that is not on the platform's avoid list, in pool order
 * @param complianceReport    platform compliance of {@code finalSet}
 * @param optimized           the platform optimizer's rendition of {@code finalSet}
 */
public record HashtagRecommendation(
        @JsonProperty("day")                   int day,
        @JsonProperty("platform")              Platform platform,
        @JsonProperty("content_keywords")      List<String> contentKeywords,
        @JsonProperty("final_set")             List<String> finalSet,
        @JsonProperty("breakdown_by_category") Map<String, List<String>> breakdownByCategory,
        @JsonProperty("candidates")            List<HashtagCandidate> candidates,
        @JsonProperty("compliance_report")     ComplianceReport complianceReport,
        @JsonProperty("optimized")             OptimizedHashtagSet optimized
) implements Serializable {

    public HashtagRecommendation {
        contentKeywords = List.copyOf(contentKeywords);
        finalSet = List.copyOf(finalSet);
        breakdownByCategory = Copies.ordered(breakdownByCategory);
        candidates = List.copyOf(candidates);
    }

    public HashtagRecommendation withOptimized(OptimizedHashtagSet optimizedSet) {
        return new HashtagRecommendation(day, platform, contentKeywords, finalSet,
                breakdownByCategory, candidates, complianceReport, optimizedSet);
    }
}
