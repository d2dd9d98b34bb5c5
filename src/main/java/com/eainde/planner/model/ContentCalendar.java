package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * The assembled week. {@code dailyPosts} always holds seven posts ordered by day;
 * days without a generated post carry a placeholder.
 */
public record ContentCalendar(
        @JsonProperty("calendar_overview")      CalendarOverview overview,
        @JsonProperty("business_context")       BusinessContext businessContext,
        @JsonProperty("daily_posts")            List<DailyPost> dailyPosts,
        @JsonProperty("calendar_statistics")    CalendarStatistics statistics,
        @JsonProperty("platform_distribution")  Map<Platform, PlatformSummary> platformSummaries,
        @JsonProperty("theme_analysis")         ThemeAnalysis themeAnalysis,
        @JsonProperty("implementation_guide")   ImplementationGuide implementationGuide,
        @JsonProperty("content_calendar_table") List<CalendarRow> calendarTable
) implements Serializable {

    public ContentCalendar {
        dailyPosts = List.copyOf(dailyPosts);
        platformSummaries = Copies.ordered(platformSummaries);
        calendarTable = List.copyOf(calendarTable);
    }

    /** Post of a day, 1-based. */
    @JsonIgnore
    public DailyPost post(int day) {
        return dailyPosts.get(day - 1);
    }
}
