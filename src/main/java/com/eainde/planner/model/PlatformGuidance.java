package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Per-platform posting guidance of the strategy.
 */
public record PlatformGuidance(
        @JsonProperty("focus")            String focus,
        @JsonProperty("content_style")    String contentStyle,
        @JsonProperty("optimal_times")    String optimalTimes
) implements Serializable {}
