package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One weekday of the weekly structure.
 *
 * @param theme            primary theme name
 * @param themeDescription description of that theme
 * @param focusArea        engagement, education or brand_awareness
 */
public record DayPlan(
        @JsonProperty("primary_theme")     String theme,
        @JsonProperty("theme_description") String themeDescription,
        @JsonProperty("focus_area")        String focusArea
) implements Serializable {}
