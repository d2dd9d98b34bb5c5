package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;

public record PostingSchedule(
        @JsonProperty("frequency")             String frequency,
        @JsonProperty("optimal_times")         Map<Platform, String> optimalTimes,
        @JsonProperty("content_preparation")   String contentPreparation,
        @JsonProperty("engagement_monitoring") String engagementMonitoring
) implements Serializable {

    public PostingSchedule {
        optimalTimes = Copies.ordered(optimalTimes);
    }
}
