package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * @param relevanceScore number of content keywords the tag overlaps with
 */
public record HashtagCandidate(
        @JsonProperty("tag")             String tag,
        @JsonProperty("source")          HashtagSource source,
        @JsonProperty("relevance_score") int relevanceScore
) implements Serializable {}
