package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One line of the printable calendar table. Title and goal may be truncated.
 */
public record CalendarRow(
        @JsonProperty("Day")      String day,
        @JsonProperty("Platform") String platform,
        @JsonProperty("Type")     String type,
        @JsonProperty("Title")    String title,
        @JsonProperty("Goal")     String goal,
        @JsonProperty("Theme")    String theme
) implements Serializable {}
