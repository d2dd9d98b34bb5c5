package com.eainde.planner.calendar;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BrandAlignment;
import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BusinessContext;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.CalendarOverview;
import com.eainde.planner.model.CalendarRow;
import com.eainde.planner.model.CalendarStatistics;
import com.eainde.planner.model.ContentCalendar;
import com.eainde.planner.model.DailyPost;
import com.eainde.planner.model.ImplementationGuide;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.PlatformOptimization;
import com.eainde.planner.model.PlatformSelection;
import com.eainde.planner.model.PlatformSummary;
import com.eainde.planner.model.PostingSchedule;
import com.eainde.planner.model.ThemeAnalysis;
import com.eainde.planner.model.ThemeConsistency;
import com.eainde.planner.model.Weekdays;
import com.eainde.planner.stage.AbstractPlanningStage;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.StageOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Assembles the seven daily posts into a {@link ContentCalendar}.
 *
 * <p>A day without a post is filled with a placeholder instead of failing, so the
 * calendar always holds exactly seven posts. Placeholders are recognisable by their
 * "General Content" theme. Missing profiles or strategy still close the gate.</p>
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class CalendarAssembler extends AbstractPlanningStage<Void, ContentCalendar> {

    static final String PLACEHOLDER_GOAL = "Increase audience engagement";
    static final String PLACEHOLDER_POST_TYPE = "Image Post";
    static final String PLACEHOLDER_CAPTION = "Content placeholder - please generate specific content for this day.";
    static final String PLACEHOLDER_AUDIENCE = "General audience";
    static final Platform PLACEHOLDER_PLATFORM = Platform.INSTAGRAM;

    static final int TITLE_WIDTH = 50;
    static final int GOAL_WIDTH = 30;

    private static final List<ArtifactKey<?>> REQUIRED = List.of(
            ArtifactKeys.BUSINESS_PROFILE,
            ArtifactKeys.BRAND_PROFILE,
            ArtifactKeys.PLATFORM_SELECTION,
            ArtifactKeys.STRATEGY_FRAMEWORK);

    private static final Map<Platform, String> OPTIMAL_TIMES = Map.of(
            Platform.FACEBOOK, "9 AM - 3 PM, Tuesday-Thursday",
            Platform.INSTAGRAM, "11 AM - 1 PM, 5 PM - 7 PM, Monday-Friday",
            Platform.LINKEDIN, "8 AM - 10 AM, 12 PM - 2 PM, Tuesday-Thursday");

    private final Clock clock;

    @Override
    public String name() {
        return StageNames.CALENDAR_ASSEMBLER;
    }

    @Override
    protected List<ArtifactKey<?>> requiredKeys(Void input) {
        return REQUIRED;
    }

    @Override
    protected StageOutput<ContentCalendar> process(ContextStore store, Void input) {
        List<DailyPost> posts = new ArrayList<>(ArtifactKeys.DAYS_PER_WEEK);
        for (int day = 1; day <= ArtifactKeys.DAYS_PER_WEEK; day++) {
            Optional<DailyPost> post = store.get(ArtifactKeys.dailyPost(day));
            if (post.isEmpty()) {
                log.info("Day {} has no post, inserting placeholder", day);
            }
            int currentDay = day;
            posts.add(post.orElseGet(() -> placeholder(currentDay)));
        }

        ContentCalendar calendar = assemble(posts,
                store.require(ArtifactKeys.BUSINESS_PROFILE),
                store.require(ArtifactKeys.BRAND_PROFILE),
                store.require(ArtifactKeys.PLATFORM_SELECTION));

        return StageOutput.writing(ArtifactKeys.CONTENT_CALENDAR, calendar,
                "Content calendar built, " + calendar.statistics().placeholderPosts() + " placeholder(s)");
    }

    public DailyPost placeholder(int day) {
        return new DailyPost(
                day,
                Weekdays.nameOf(day),
                PLACEHOLDER_PLATFORM,
                PLACEHOLDER_GOAL,
                PLACEHOLDER_POST_TYPE,
                "Day " + day + " Content",
                PLACEHOLDER_CAPTION,
                DailyPost.PLACEHOLDER_THEME,
                PlatformOptimization.NONE,
                BrandAlignment.NONE,
                PLACEHOLDER_AUDIENCE,
                Instant.now(clock));
    }

    /** Aggregates seven posts, ordered by day, into the calendar. */
    ContentCalendar assemble(List<DailyPost> posts, BusinessProfile business, BrandProfile brand,
                             PlatformSelection selection) {
        CalendarOverview overview = new CalendarOverview(
                posts.size(),
                selection.platforms(),
                posts.stream().map(DailyPost::contentTheme).toList(),
                "1 week",
                Instant.now(clock));

        return new ContentCalendar(
                overview,
                BusinessContext.of(business, brand),
                posts,
                statistics(posts),
                platformSummaries(posts),
                themeAnalysis(posts),
                implementationGuide(selection),
                posts.stream().map(CalendarAssembler::row).toList());
    }

    // ==================================================================================
    // Aggregates
    // ==================================================================================

    CalendarStatistics statistics(List<DailyPost> posts) {
        Map<String, Integer> types = new LinkedHashMap<>();
        Map<String, Integer> platforms = new LinkedHashMap<>();
        Map<String, Integer> themes = new LinkedHashMap<>();
        Map<String, Integer> goals = new LinkedHashMap<>();
        int placeholders = 0;
        for (DailyPost post : posts) {
            types.merge(post.postType(), 1, Integer::sum);
            platforms.merge(post.platform().getLabel(), 1, Integer::sum);
            themes.merge(post.contentTheme(), 1, Integer::sum);
            goals.merge(post.goal(), 1, Integer::sum);
            if (post.isPlaceholder()) {
                placeholders++;
            }
        }
        return new CalendarStatistics(types, platforms, themes, goals,
                posts.size(), platforms.size(), themes.size(), placeholders);
    }

    Map<Platform, PlatformSummary> platformSummaries(List<DailyPost> posts) {
        Map<Platform, List<DailyPost>> byPlatform = new LinkedHashMap<>();
        posts.forEach(post -> byPlatform.computeIfAbsent(post.platform(), p -> new ArrayList<>()).add(post));

        Map<Platform, PlatformSummary> summaries = new LinkedHashMap<>();
        byPlatform.forEach((platform, platformPosts) -> {
            Map<String, Integer> types = new LinkedHashMap<>();
            Map<String, Integer> themes = new LinkedHashMap<>();
            Map<String, Integer> schedule = new LinkedHashMap<>();
            for (DailyPost post : platformPosts) {
                types.merge(post.postType(), 1, Integer::sum);
                themes.merge(post.contentTheme(), 1, Integer::sum);
                schedule.merge(post.dayName(), 1, Integer::sum);
            }
            summaries.put(platform, new PlatformSummary(platformPosts.size(), types, themes, schedule));
        });
        return summaries;
    }

    ThemeAnalysis themeAnalysis(List<DailyPost> posts) {
        Map<String, Integer> frequency = new LinkedHashMap<>();
        Map<String, List<String>> goals = new LinkedHashMap<>();
        Map<String, List<Platform>> platforms = new LinkedHashMap<>();
        for (DailyPost post : posts) {
            String theme = post.contentTheme();
            frequency.merge(theme, 1, Integer::sum);
            goals.computeIfAbsent(theme, t -> new ArrayList<>()).add(post.goal());
            platforms.computeIfAbsent(theme, t -> new ArrayList<>()).add(post.platform());
        }

        // Binary heuristic: at most two distinct goals per theme counts as consistent.
        Map<String, ThemeConsistency> consistency = new LinkedHashMap<>();
        goals.forEach((theme, themeGoals) ->
                consistency.put(theme, ThemeConsistency.forGoalDiversity(new LinkedHashSet<>(themeGoals).size())));

        Map<String, List<String>> goalsCopy = new LinkedHashMap<>();
        goals.forEach((theme, list) -> goalsCopy.put(theme, List.copyOf(list)));
        Map<String, List<Platform>> platformsCopy = new LinkedHashMap<>();
        platforms.forEach((theme, list) -> platformsCopy.put(theme, List.copyOf(list)));

        return new ThemeAnalysis(frequency, goalsCopy, platformsCopy, consistency);
    }

    ImplementationGuide implementationGuide(PlatformSelection selection) {
        Map<Platform, String> optimalTimes = new LinkedHashMap<>();
        selection.platforms().forEach(platform -> optimalTimes.put(platform, OPTIMAL_TIMES.get(platform)));

        return new ImplementationGuide(
                List.of(
                        "Review all content for brand voice alignment",
                        "Prepare visual assets according to design suggestions",
                        "Set up scheduling tools for each platform",
                        "Prepare hashtag lists for easy copy-paste",
                        "Create content approval workflow"),
                new PostingSchedule(
                        "Daily posting across selected platforms",
                        optimalTimes,
                        "Prepare content 2-3 days in advance",
                        "Monitor comments and engagement for 2 hours after posting"),
                List.of(
                        "Ensure all content aligns with brand voice and tone",
                        "Verify hashtags are relevant and not overused",
                        "Check visual quality and brand consistency",
                        "Test links and call-to-actions",
                        "Review for grammar and spelling"),
                List.of(
                        "Track engagement rates for each post",
                        "Monitor reach and impressions",
                        "Analyze which content types perform best",
                        "Track hashtag performance",
                        "Measure goal achievement (awareness, leads, etc.)"));
    }

    static CalendarRow row(DailyPost post) {
        return new CalendarRow(
                post.dayName(),
                post.platform().getLabel(),
                post.postType(),
                truncate(post.title(), TITLE_WIDTH),
                truncate(post.goal(), GOAL_WIDTH),
                post.contentTheme());
    }

    static String truncate(String text, int width) {
        return text.length() > width ? text.substring(0, width) + "..." : text;
    }
}
