package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

public record ChallengesAnalysis(
        @JsonProperty("current_challenges") String currentChallenges,
        @JsonProperty("content_solutions")  List<String> contentSolutions
) implements Serializable {

    public ChallengesAnalysis {
        contentSolutions = List.copyOf(contentSolutions);
    }
}
