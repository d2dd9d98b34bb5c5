package com.eainde.planner.summary;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BrandVisualGuidelines;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.ContentCalendar;
import com.eainde.planner.model.DailyPost;
import com.eainde.planner.model.HashtagRecommendation;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.PlatformSelection;
import com.eainde.planner.model.StrategyFramework;
import com.eainde.planner.model.StrategySummary;
import com.eainde.planner.model.StrategySummary.CalendarSummary;
import com.eainde.planner.model.StrategySummary.ExecutiveSummary;
import com.eainde.planner.model.StrategySummary.HashtagOverview;
import com.eainde.planner.model.StrategySummary.ImplementationGuidance;
import com.eainde.planner.model.StrategySummary.NextSteps;
import com.eainde.planner.model.StrategySummary.PerformanceTracking;
import com.eainde.planner.model.StrategySummary.ScheduledPost;
import com.eainde.planner.model.StrategySummary.StrategyOverview;
import com.eainde.planner.model.StrategySummary.VisualOverview;
import com.eainde.planner.model.Theme;
import com.eainde.planner.model.VisualConcept;
import com.eainde.planner.rules.KeywordRuleTable;
import com.eainde.planner.stage.AbstractPlanningStage;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.StageOutput;
import com.eainde.planner.stage.ValidationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executive rollup of a finished week. Only reshapes artifacts that already exist;
 * hashtag recommendations and visual concepts are optional.
 */
@Log4j2
@Component
public class SummaryAssembler extends AbstractPlanningStage<Void, StrategySummary> {

    private static final List<ArtifactKey<?>> REQUIRED = List.of(
            ArtifactKeys.BUSINESS_PROFILE,
            ArtifactKeys.BRAND_PROFILE,
            ArtifactKeys.PLATFORM_SELECTION,
            ArtifactKeys.STRATEGY_FRAMEWORK,
            ArtifactKeys.CONTENT_CALENDAR);

    static final KeywordRuleTable<String> INDUSTRY_SUCCESS_FACTORS = KeywordRuleTable.<String>builder()
            .rule("Thought leadership content", "technology")
            .rule("Trust-building educational content", "healthcare")
            .rule("Product showcase and social proof", "e-commerce")
            .build();

    static final KeywordRuleTable<String> INDUSTRY_TIPS = KeywordRuleTable.<String>builder()
            .rule("Include relevant tech trends and innovations", "technology")
            .rule("Focus on patient education and wellness tips", "healthcare")
            .rule("Showcase products in real-life scenarios", "e-commerce")
            .build();

    private static final Map<Platform, List<String>> ENGAGEMENT_STRATEGIES = Map.of(
            Platform.FACEBOOK, List.of(
                    "Respond to comments within 2 hours",
                    "Ask questions in posts to encourage discussion",
                    "Share user-generated content",
                    "Use Facebook Groups for community building"),
            Platform.INSTAGRAM, List.of(
                    "Use Instagram Stories for behind-the-scenes content",
                    "Engage with stories and posts from target audience",
                    "Use relevant hashtags and location tags",
                    "Post user-generated content and testimonials"),
            Platform.LINKEDIN, List.of(
                    "Share industry insights and thought leadership",
                    "Comment thoughtfully on others' posts",
                    "Use LinkedIn Polls for engagement",
                    "Share company updates and achievements"));

    @Override
    public String name() {
        return StageNames.SUMMARY_ASSEMBLER;
    }

    @Override
    protected List<ArtifactKey<?>> requiredKeys(Void input) {
        return REQUIRED;
    }

    @Override
    protected StageOutput<StrategySummary> process(ContextStore store, Void input) {
        ContentCalendar calendar = store.require(ArtifactKeys.CONTENT_CALENDAR);
        if (calendar.dailyPosts().size() != ArtifactKeys.DAYS_PER_WEEK) {
            throw new ValidationException("Content calendar must hold " + ArtifactKeys.DAYS_PER_WEEK
                    + " posts, found " + calendar.dailyPosts().size());
        }

        List<HashtagRecommendation> hashtags = new ArrayList<>();
        for (int day = 1; day <= ArtifactKeys.DAYS_PER_WEEK; day++) {
            store.get(ArtifactKeys.hashtags(day)).ifPresent(hashtags::add);
        }
        List<VisualConcept> concepts = new ArrayList<>();
        for (int day = 1; day <= ArtifactKeys.DAYS_PER_WEEK; day++) {
            store.get(ArtifactKeys.visualConcept(day)).ifPresent(concepts::add);
        }

        StrategySummary summary = summarize(
                store.require(ArtifactKeys.BUSINESS_PROFILE),
                store.require(ArtifactKeys.BRAND_PROFILE),
                store.require(ArtifactKeys.PLATFORM_SELECTION),
                store.require(ArtifactKeys.STRATEGY_FRAMEWORK),
                calendar,
                hashtags,
                store.get(ArtifactKeys.BRAND_VISUAL_GUIDELINES).orElse(null),
                concepts);
        return StageOutput.writing(ArtifactKeys.STRATEGY_SUMMARY, summary, "Strategy summary generated");
    }

    public StrategySummary summarize(BusinessProfile business, BrandProfile brand, PlatformSelection selection,
                                     StrategyFramework framework, ContentCalendar calendar,
                                     List<HashtagRecommendation> hashtags,
                                     BrandVisualGuidelines guidelines, List<VisualConcept> concepts) {
        return new StrategySummary(
                new ExecutiveSummary(business, brand, selection),
                new StrategyOverview(
                        framework.themes().stream().map(Theme::name).toList(),
                        framework.contentMix(),
                        framework.weeklyStructure()),
                calendarSummary(calendar),
                new ImplementationGuidance(
                        successFactors(business.industry()),
                        creationTips(brand, business.industry()),
                        engagementStrategies(selection.platforms()),
                        performanceTracking(framework.successMetrics())),
                hashtagOverview(hashtags),
                visualOverview(guidelines, concepts),
                new NextSteps(
                        List.of(
                                "Review and approve content plan",
                                "Prepare visual assets according to design suggestions",
                                "Schedule posts using recommended timing",
                                "Set up performance tracking tools"),
                        List.of(
                                "Monitor engagement and adjust content based on performance",
                                "Engage with audience comments and messages",
                                "Analyze weekly performance reports",
                                "Iterate and optimize content strategy")));
    }

    CalendarSummary calendarSummary(ContentCalendar calendar) {
        List<ScheduledPost> schedule = calendar.dailyPosts().stream()
                .map(post -> new ScheduledPost(post.day(), post.dayName(), post.platform(),
                        post.title(), post.postType(), post.goal()))
                .toList();
        return new CalendarSummary(
                calendar.dailyPosts().size(),
                (int) calendar.dailyPosts().stream().filter(DailyPost::isPlaceholder).count(),
                calendar.statistics().platformDistribution(),
                calendar.statistics().contentTypeDistribution(),
                schedule);
    }

    List<String> successFactors(String industry) {
        List<String> factors = new ArrayList<>(List.of(
                "Consistent posting schedule",
                "High-quality visual content",
                "Engaging captions that reflect brand voice",
                "Strategic hashtag usage"));
        INDUSTRY_SUCCESS_FACTORS.firstMatch(industry).ifPresent(factors::add);
        return factors;
    }

    List<String> creationTips(BrandProfile brand, String industry) {
        List<String> tips = new ArrayList<>(List.of(
                "Maintain " + brand.voice() + " voice consistently",
                "Incorporate " + brand.coreValues() + " values in messaging",
                "Use high-quality visuals that align with brand aesthetic",
                "Write captions that encourage engagement and conversation"));
        INDUSTRY_TIPS.firstMatch(industry).ifPresent(tips::add);
        return tips;
    }

    private Map<Platform, List<String>> engagementStrategies(List<Platform> platforms) {
        Map<Platform, List<String>> strategies = new LinkedHashMap<>();
        platforms.forEach(platform -> strategies.put(platform, ENGAGEMENT_STRATEGIES.get(platform)));
        return strategies;
    }

    private PerformanceTracking performanceTracking(List<String> metrics) {
        Map<String, String> benchmarks = new LinkedHashMap<>();
        benchmarks.put("engagement_rate", "Above industry average (3-6%)");
        benchmarks.put("reach", "Steady month-over-month growth");
        benchmarks.put("lead_generation", "Track conversion from social to leads");
        benchmarks.put("brand_awareness", "Monitor brand mentions and sentiment");
        return new PerformanceTracking(
                metrics,
                "Weekly analysis, monthly comprehensive review",
                List.of(
                        "Platform native analytics",
                        "Social media management tools",
                        "Google Analytics for website traffic",
                        "Custom tracking for lead generation"),
                benchmarks);
    }

    HashtagOverview hashtagOverview(List<HashtagRecommendation> hashtags) {
        List<Integer> days = hashtags.stream().map(HashtagRecommendation::day).toList();
        double average = hashtags.stream().mapToInt(rec -> rec.finalSet().size()).average().orElse(0);
        List<Integer> underFilled = hashtags.stream()
                .filter(rec -> Optional.ofNullable(rec.optimized()).map(opt -> opt.underFilled()).orElse(false))
                .map(HashtagRecommendation::day)
                .toList();
        return new HashtagOverview(days, average, underFilled);
    }

    /** {@code guidelines} may be null. */
    VisualOverview visualOverview(BrandVisualGuidelines guidelines, List<VisualConcept> concepts) {
        List<Integer> days = concepts.stream().map(VisualConcept::day).toList();
        if (guidelines == null) {
            return new VisualOverview(days, null, null, List.of());
        }
        return new VisualOverview(days, guidelines.personalityType(), guidelines.styleDirection(),
                guidelines.colorPsychology().recommendedColors());
    }
}
