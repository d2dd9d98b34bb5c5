package com.eainde.planner.strategy;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BrandAlignment;
import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.ChallengesAnalysis;
import com.eainde.planner.model.DayPlan;
import com.eainde.planner.model.GoalsAnalysis;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.PlatformGuidance;
import com.eainde.planner.model.PlatformSelection;
import com.eainde.planner.model.StrategyFramework;
import com.eainde.planner.model.Theme;
import com.eainde.planner.model.Weekdays;
import com.eainde.planner.rules.KeywordRuleTable;
import com.eainde.planner.stage.AbstractPlanningStage;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.StageOutput;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Derives the weekly {@link StrategyFramework} from the three input profiles.
 *
 * <h3>Derivation:</h3>
 * <ol>
 *   <li>Goals and challenges text are classified through ordered keyword tables;
 *       several categories may match.</li>
 *   <li>Three universal themes, plus one industry theme when the industry names a known
 *       sector, capped at four.</li>
 *   <li>Post types per selected platform; Story, Reel and Live are dropped for a
 *       professional or formal voice.</li>
 *   <li>Themes and focus areas are assigned to Monday..Sunday cyclically.</li>
 *   <li>Content mix is a fixed table; success metrics grow with the goals text.</li>
 * </ol>
 */
@Log4j2
@Component
public class StrategyBuilder extends AbstractPlanningStage<Void, StrategyFramework> {

    public static final int MAX_THEMES = 4;

    static final KeywordRuleTable<String> GOAL_RULES = KeywordRuleTable.<String>builder()
            .rule("brand_awareness", "awareness", "visibility", "brand")
            .rule("lead_generation", "lead", "generate", "prospect")
            .rule("engagement", "engagement", "community", "interaction")
            .rule("conversion", "sales", "conversion", "revenue")
            .build();

    static final KeywordRuleTable<String> CHALLENGE_RULES = KeywordRuleTable.<String>builder()
            .rule("interactive_content", "engagement", "interaction", "response")
            .rule("audience_focused_content", "audience", "reach", "visibility")
            .rule("diverse_content_types", "content", "ideas", "creativity")
            .build();

    static final KeywordRuleTable<Theme> INDUSTRY_THEMES = KeywordRuleTable.<Theme>builder()
            .rule(new Theme("Innovation & Trends",
                    "Share latest tech trends and innovations",
                    "Establishes thought leadership"), "technology")
            .rule(new Theme("Health & Wellness",
                    "Educational health content and wellness tips",
                    "Builds trust and authority"), "healthcare")
            .rule(new Theme("Product Showcase",
                    "Highlight products and customer success stories",
                    "Drives sales and engagement"), "e-commerce")
            .build();

    static final KeywordRuleTable<String> METRIC_RULES = KeywordRuleTable.<String>builder()
            .rule("lead_generation", "lead")
            .rule("conversion_rate", "sales", "conversion")
            .rule("brand_mention_increase", "awareness")
            .build();

    static final List<Theme> UNIVERSAL_THEMES = List.of(
            new Theme("Educational Content",
                    "Share industry insights, tips, and knowledge to establish authority",
                    "Works for all industries and goals"),
            new Theme("Behind-the-Scenes",
                    "Show company culture, processes, and team to build trust",
                    "Great for brand awareness and engagement"),
            new Theme("Problem-Solution",
                    "Address customer pain points and showcase solutions",
                    "Perfect for lead generation and conversion"));

    static final List<String> FOCUS_ROTATION = List.of("engagement", "education", "brand_awareness");

    static final List<String> BASE_METRICS = List.of("engagement_rate", "reach", "impressions");

    private static final Set<String> CASUAL_POST_TYPES = Set.of("Story", "Reel", "Live");

    private static final Map<Platform, List<String>> BASE_POST_TYPES = Map.of(
            Platform.FACEBOOK, List.of("Image Post", "Video", "Link Share", "Text Post", "Carousel"),
            Platform.INSTAGRAM, List.of("Feed Post", "Story", "Reel", "IGTV", "Carousel", "Live"),
            Platform.LINKEDIN, List.of("Article", "Image Post", "Video", "Text Post", "Poll", "Document Share"));

    private static final Map<Platform, PlatformGuidance> GUIDANCE = Map.of(
            Platform.FACEBOOK, new PlatformGuidance(
                    "Community building, longer-form content and video",
                    "Conversational, question-led posts",
                    "9 AM - 3 PM"),
            Platform.INSTAGRAM, new PlatformGuidance(
                    "Visual storytelling, stories, reels and high-quality imagery",
                    "Short captions carried by strong visuals",
                    "11 AM - 1 PM, 5 PM - 7 PM"),
            Platform.LINKEDIN, new PlatformGuidance(
                    "Professional content, thought leadership, industry insights and B2B networking",
                    "Insight-driven, professional tone",
                    "8 AM - 10 AM, 12 PM - 2 PM"));

    @Override
    public String name() {
        return StageNames.STRATEGY_BUILDER;
    }

    @Override
    protected List<ArtifactKey<?>> requiredKeys(Void input) {
        return ArtifactKeys.inputs();
    }

    @Override
    protected StageOutput<StrategyFramework> process(ContextStore store, Void input) {
        StrategyFramework framework = build(
                store.require(ArtifactKeys.BUSINESS_PROFILE),
                store.require(ArtifactKeys.BRAND_PROFILE),
                store.require(ArtifactKeys.PLATFORM_SELECTION));
        return StageOutput.writing(ArtifactKeys.STRATEGY_FRAMEWORK, framework,
                "Strategy framework with " + framework.themes().size() + " themes");
    }

    /** Pure derivation, no store access. */
    public StrategyFramework build(BusinessProfile business, BrandProfile brand, PlatformSelection selection) {
        GoalsAnalysis goals = analyzeGoals(business.businessGoals());
        ChallengesAnalysis challenges = new ChallengesAnalysis(
                business.currentChallenges(), CHALLENGE_RULES.matchAll(business.currentChallenges()));
        List<Theme> themes = selectThemes(business.industry());

        log.debug("Goal tags {} / challenge tags {} / {} themes",
                goals.contentPriorities(), challenges.contentSolutions(), themes.size());

        return new StrategyFramework(
                business.industry(),
                business.targetAudience(),
                goals,
                challenges,
                BrandAlignment.of(brand),
                selection.platforms(),
                selection.priorities(),
                guidanceFor(selection.platforms()),
                themes,
                postTypesFor(selection.platforms(), brand.voice()),
                weeklyStructure(themes),
                contentMix(),
                successMetrics(business.businessGoals()));
    }

    GoalsAnalysis analyzeGoals(String goalsText) {
        List<String> priorities = GOAL_RULES.matchAll(goalsText);
        List<String> focus = priorities.size() > 2 ? priorities.subList(0, 2) : priorities;
        return new GoalsAnalysis(goalsText, priorities, focus);
    }

    List<Theme> selectThemes(String industry) {
        List<Theme> themes = new ArrayList<>(UNIVERSAL_THEMES);
        INDUSTRY_THEMES.firstMatch(industry).ifPresent(themes::add);
        return themes.size() > MAX_THEMES ? themes.subList(0, MAX_THEMES) : themes;
    }

    Map<Platform, List<String>> postTypesFor(List<Platform> platforms, String voice) {
        String lowered = voice.toLowerCase(Locale.ROOT);
        boolean formal = lowered.contains("professional") || lowered.contains("formal");
        Map<Platform, List<String>> result = new LinkedHashMap<>();
        for (Platform platform : platforms) {
            List<String> types = BASE_POST_TYPES.get(platform);
            result.put(platform, formal
                    ? types.stream().filter(type -> !CASUAL_POST_TYPES.contains(type)).toList()
                    : types);
        }
        return result;
    }

    Map<String, DayPlan> weeklyStructure(List<Theme> themes) {
        Map<String, DayPlan> structure = new LinkedHashMap<>();
        List<String> days = Weekdays.names();
        for (int i = 0; i < days.size(); i++) {
            Theme theme = themes.get(i % themes.size());
            structure.put(days.get(i), new DayPlan(theme.name(), theme.description(),
                    FOCUS_ROTATION.get(i % FOCUS_ROTATION.size())));
        }
        return structure;
    }

    // Fixed table, not industry-sensitive.
    Map<String, Integer> contentMix() {
        Map<String, Integer> mix = new LinkedHashMap<>();
        mix.put("educational", 40);
        mix.put("promotional", 20);
        mix.put("behind_scenes", 20);
        mix.put("user_generated", 10);
        mix.put("trending", 10);
        return mix;
    }

    List<String> successMetrics(String goalsText) {
        List<String> metrics = new ArrayList<>(BASE_METRICS);
        metrics.addAll(METRIC_RULES.matchAll(goalsText));
        return metrics;
    }

    private Map<Platform, PlatformGuidance> guidanceFor(List<Platform> platforms) {
        Map<Platform, PlatformGuidance> guidance = new LinkedHashMap<>();
        platforms.forEach(platform -> guidance.put(platform, GUIDANCE.get(platform)));
        return guidance;
    }
}
