package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Executive rollup of a completed run. Pure reshaping of the other artifacts.
 */
public record StrategySummary(
        @JsonProperty("executive_summary")         ExecutiveSummary executiveSummary,
        @JsonProperty("content_strategy_overview") StrategyOverview strategyOverview,
        @JsonProperty("content_calendar_summary")  CalendarSummary calendarSummary,
        @JsonProperty("implementation_guidance")   ImplementationGuidance implementationGuidance,
        @JsonProperty("hashtag_overview")          HashtagOverview hashtagOverview,
        @JsonProperty("visual_overview")           VisualOverview visualOverview,
        @JsonProperty("next_steps")                NextSteps nextSteps
) implements Serializable {

    public record ExecutiveSummary(
            @JsonProperty("business_overview") BusinessProfile businessOverview,
            @JsonProperty("brand_identity")    BrandProfile brandIdentity,
            @JsonProperty("platform_strategy") PlatformSelection platformStrategy
    ) implements Serializable {}

    public record StrategyOverview(
            @JsonProperty("primary_themes")   List<String> primaryThemes,
            @JsonProperty("content_mix")      Map<String, Integer> contentMix,
            @JsonProperty("weekly_structure") Map<String, DayPlan> weeklyStructure
    ) implements Serializable {

        public StrategyOverview {
            primaryThemes = List.copyOf(primaryThemes);
            contentMix = Copies.ordered(contentMix);
            weeklyStructure = Copies.ordered(weeklyStructure);
        }
    }

    public record ScheduledPost(
            @JsonProperty("day")      int day,
            @JsonProperty("day_name") String dayName,
            @JsonProperty("platform") Platform platform,
            @JsonProperty("title")    String title,
            @JsonProperty("type")     String type,
            @JsonProperty("goal")     String goal
    ) implements Serializable {}

    public record CalendarSummary(
            @JsonProperty("total_posts")               int totalPosts,
            @JsonProperty("placeholder_posts")         int placeholderPosts,
            @JsonProperty("platform_distribution")     Map<String, Integer> platformDistribution,
            @JsonProperty("content_type_distribution") Map<String, Integer> contentTypeDistribution,
            @JsonProperty("posting_schedule")          List<ScheduledPost> postingSchedule
    ) implements Serializable {

        public CalendarSummary {
            platformDistribution = Copies.ordered(platformDistribution);
            contentTypeDistribution = Copies.ordered(contentTypeDistribution);
            postingSchedule = List.copyOf(postingSchedule);
        }
    }

    public record PerformanceTracking(
            @JsonProperty("key_metrics")        List<String> keyMetrics,
            @JsonProperty("tracking_frequency") String trackingFrequency,
            @JsonProperty("tools_recommended")  List<String> toolsRecommended,
            @JsonProperty("success_benchmarks") Map<String, String> successBenchmarks
    ) implements Serializable {

        public PerformanceTracking {
            keyMetrics = List.copyOf(keyMetrics);
            toolsRecommended = List.copyOf(toolsRecommended);
            successBenchmarks = Copies.ordered(successBenchmarks);
        }
    }

    public record ImplementationGuidance(
            @JsonProperty("key_success_factors")   List<String> keySuccessFactors,
            @JsonProperty("content_creation_tips") List<String> contentCreationTips,
            @JsonProperty("engagement_strategies") Map<Platform, List<String>> engagementStrategies,
            @JsonProperty("performance_tracking")  PerformanceTracking performanceTracking
    ) implements Serializable {

        public ImplementationGuidance {
            keySuccessFactors = List.copyOf(keySuccessFactors);
            contentCreationTips = List.copyOf(contentCreationTips);
            engagementStrategies = Copies.ordered(engagementStrategies);
        }
    }

    /**
     * @param daysWithRecommendations days that carry a hashtag recommendation
     * @param averageSetSize          mean final set size over those days, 0 when none
     */
    public record HashtagOverview(
            @JsonProperty("days_with_recommendations") List<Integer> daysWithRecommendations,
            @JsonProperty("average_set_size")          double averageSetSize,
            @JsonProperty("under_filled_days")         List<Integer> underFilledDays
    ) implements Serializable {

        public HashtagOverview {
            daysWithRecommendations = List.copyOf(daysWithRecommendations);
            underFilledDays = List.copyOf(underFilledDays);
        }
    }

    /**
     * @param visualPersonalityType null when no brand visual guidelines were derived
     * @param recommendedColors     voice-driven colours of the guidelines, empty without them
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record VisualOverview(
            @JsonProperty("days_with_concepts")      List<Integer> daysWithConcepts,
            @JsonProperty("visual_personality_type") String visualPersonalityType,
            @JsonProperty("style_direction")         String styleDirection,
            @JsonProperty("recommended_colors")      List<String> recommendedColors
    ) implements Serializable {

        public VisualOverview {
            daysWithConcepts = List.copyOf(daysWithConcepts);
            recommendedColors = List.copyOf(recommendedColors);
        }
    }

    public record NextSteps(
            @JsonProperty("immediate_actions")  List<String> immediateActions,
            @JsonProperty("ongoing_activities") List<String> ongoingActivities
    ) implements Serializable {

        public NextSteps {
            immediateActions = List.copyOf(immediateActions);
            ongoingActivities = List.copyOf(ongoingActivities);
        }
    }
}
