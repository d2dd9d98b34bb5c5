package com.eainde.planner.hashtag;

import com.eainde.planner.model.HashtagWindow;
import com.eainde.planner.model.Platform;
import com.eainde.planner.rules.KeywordRuleTable;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Hashtag guidelines of one platform.
 *
 * @param window              allowed hashtag count
 * @param avoidKeywords       a tag containing any of these is dropped
 * @param appropriateKeywords at least one tag should contain one of these
 * @param rankingCriteria     platform relevance keywords for the final ordering
 * @param contentTypeWindows  "N-M" guidance per content type
 * @param bestPractices       guideline texts, evaluated by {@link #checkFor(String)}
 */
public record PlatformHashtagRules(
        Platform platform,
        HashtagWindow window,
        List<String> avoidKeywords,
        List<String> appropriateKeywords,
        List<String> rankingCriteria,
        Map<String, String> contentTypeWindows,
        List<String> bestPractices
) {

    /** What a best-practice text can be checked against. */
    public enum PracticeCheck {
        RELEVANT,
        SPARING,
        PROFESSIONAL,
        COMMUNITY,
        ALWAYS
    }

    // Precedence matters: a text naming several aspects is checked for the first.
    private static final KeywordRuleTable<PracticeCheck> PRACTICE_CHECKS = KeywordRuleTable.<PracticeCheck>builder()
            .rule(PracticeCheck.RELEVANT, "relevant")
            .rule(PracticeCheck.SPARING, "sparingly")
            .rule(PracticeCheck.PROFESSIONAL, "professional")
            .rule(PracticeCheck.COMMUNITY, "community")
            .build();

    private static final Map<Platform, PlatformHashtagRules> RULES = Map.of(
            Platform.FACEBOOK, new PlatformHashtagRules(
                    Platform.FACEBOOK,
                    new HashtagWindow(1, 3),
                    List.of("casual", "personal", "trending", "viral"),
                    List.of("business", "community", "local", "professional", "industry"),
                    List.of("community", "local", "discussion", "engagement"),
                    Map.of(
                            "Image Post", "Use 1-2 relevant hashtags",
                            "Video", "Use 2-3 hashtags including #video",
                            "Link Share", "Use 1-2 hashtags related to the link content"),
                    List.of(
                            "Use sparingly to avoid appearing spammy",
                            "Focus on community and local hashtags",
                            "Place hashtags at the end of posts",
                            "Use hashtags that encourage discussion")),
            Platform.INSTAGRAM, new PlatformHashtagRules(
                    Platform.INSTAGRAM,
                    new HashtagWindow(5, 15),
                    List.of("spam", "fake", "irrelevant"),
                    List.of("business", "entrepreneur", "marketing", "industry", "lifestyle", "creative"),
                    List.of("visual", "trending", "lifestyle", "creative"),
                    Map.of(
                            "Feed Post", "Use 10-15 hashtags for maximum reach",
                            "Story", "Use 1-3 hashtags with stickers",
                            "Reel", "Use 8-12 hashtags including trending ones",
                            "IGTV", "Use 5-10 hashtags in description"),
                    List.of(
                            "Mix popular and niche hashtags",
                            "Include branded hashtags",
                            "Use hashtags in first comment or caption",
                            "Research hashtag performance before using")),
            Platform.LINKEDIN, new PlatformHashtagRules(
                    Platform.LINKEDIN,
                    new HashtagWindow(3, 5),
                    List.of("casual", "personal", "fun", "entertainment", "lifestyle"),
                    List.of("business", "professional", "career", "industry", "leadership", "networking"),
                    List.of("professional", "career", "industry", "networking"),
                    Map.of(
                            "Article", "Use 3-5 professional hashtags",
                            "Image Post", "Use 3-4 relevant industry hashtags",
                            "Video", "Use 4-5 hashtags including #video",
                            "Text Post", "Use 3-5 professional hashtags"),
                    List.of(
                            "Focus on professional and industry hashtags",
                            "Use hashtags that relate to your expertise",
                            "Include location-based hashtags if relevant",
                            "Place hashtags at the end of posts")));

    public static PlatformHashtagRules forPlatform(Platform platform) {
        return RULES.get(platform);
    }

    public static HashtagWindow windowFor(Platform platform) {
        return forPlatform(platform).window();
    }

    /** Count range suggested for a content type, when the platform has one. */
    public Optional<HashtagWindow> contentTypeWindow(String contentType) {
        if (contentType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(contentTypeWindows.get(contentType)).flatMap(HashtagWindow::parse);
    }

    public boolean isAvoided(String tag) {
        return containsAny(tag, avoidKeywords);
    }

    public boolean isAppropriate(String tag) {
        return containsAny(tag, appropriateKeywords);
    }

    public int platformRelevance(String tag) {
        String clean = clean(tag);
        return (int) rankingCriteria.stream().filter(clean::contains).count();
    }

    public static PracticeCheck checkFor(String practice) {
        return PRACTICE_CHECKS.firstMatchOrDefault(practice, PracticeCheck.ALWAYS);
    }

    static String clean(String tag) {
        return tag.replace("#", "").toLowerCase(Locale.ROOT);
    }

    static boolean containsAny(String tag, List<String> keywords) {
        String clean = clean(tag);
        return keywords.stream().anyMatch(clean::contains);
    }
}
