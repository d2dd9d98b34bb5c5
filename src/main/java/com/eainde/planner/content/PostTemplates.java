package com.eainde.planner.content;

import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.PlatformOptimization;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed template families for titles, hooks, bodies and calls to action.
 */
final class PostTemplates {

    static final String EDUCATIONAL = "Educational Content";
    static final String BEHIND_THE_SCENES = "Behind-the-Scenes";
    static final String PROBLEM_SOLUTION = "Problem-Solution";

    static final String DEFAULT_GOAL = "Increase audience engagement and interaction";

    private static final Map<String, String> GOALS_BY_FOCUS = Map.of(
            "engagement", "Increase audience engagement and interaction",
            "education", "Educate audience about industry topics and solutions",
            "brand_awareness", "Build brand visibility and recognition",
            "lead_generation", "Generate qualified leads and prospects",
            "conversion", "Drive sales and conversions");

    private static final Map<String, List<String>> HOOKS = Map.of(
            EDUCATIONAL, List.of(
                    "Did you know that...",
                    "Here's something most people don't realize...",
                    "Quick question for you..."),
            BEHIND_THE_SCENES, List.of(
                    "Ever wondered what goes on behind the scenes?",
                    "Today we're pulling back the curtain...",
                    "Here's what a typical day looks like..."),
            PROBLEM_SOLUTION, List.of(
                    "Struggling with [problem]? You're not alone.",
                    "We hear this challenge all the time...",
                    "If you're dealing with [problem], this is for you."));

    private static final Map<Platform, List<String>> CALLS_TO_ACTION = Map.of(
            Platform.LINKEDIN, List.of(
                    "What are your thoughts on this? Share your experience in the comments below.",
                    "Have you faced similar challenges? Let's discuss in the comments.",
                    "I'd love to hear your perspective on this topic."),
            Platform.INSTAGRAM, List.of(
                    "Double tap if you agree!",
                    "What's your take on this? Let us know below!",
                    "Tag someone who needs to see this!"),
            Platform.FACEBOOK, List.of(
                    "What do you think? Share your thoughts below!",
                    "Have you experienced this? Tell us your story!",
                    "We'd love to hear from you - comment below!"));

    private static final Map<Platform, PlatformOptimization> OPTIMIZATIONS = Map.of(
            Platform.FACEBOOK, new PlatformOptimization(
                    "9 AM - 3 PM",
                    "40-80 characters for titles",
                    "Ask questions, share relatable content",
                    "High-quality images, 1200x630px for link previews"),
            Platform.INSTAGRAM, new PlatformOptimization(
                    "11 AM - 1 PM, 5 PM - 7 PM",
                    "125 characters for captions",
                    "Use Stories, engage with comments quickly",
                    "Square images 1080x1080px, high contrast"),
            Platform.LINKEDIN, new PlatformOptimization(
                    "8 AM - 10 AM, 12 PM - 2 PM",
                    "150-300 characters for optimal engagement",
                    "Share professional insights, comment thoughtfully",
                    "Professional images, 1200x627px for articles"));

    private PostTemplates() {}

    /** Theme override first, then the weekday focus, then the default goal. */
    static String goalFor(String theme, String dayFocus) {
        if (theme.contains("Educational")) {
            return "Educate audience about industry topics and establish thought leadership";
        }
        if (theme.contains(BEHIND_THE_SCENES)) {
            return "Build trust and humanize the brand through authentic content";
        }
        if (theme.contains(PROBLEM_SOLUTION)) {
            return "Address customer pain points and showcase solution value";
        }
        return dayFocus == null ? DEFAULT_GOAL : GOALS_BY_FOCUS.getOrDefault(dayFocus, DEFAULT_GOAL);
    }

    static List<String> titles(Platform platform, String theme, String audience, String voice) {
        String adjective = adjectiveFor(voice);
        String leadAudience = audience.split(",")[0].trim();
        return switch (platform) {
            case LINKEDIN -> List.of(
                    "How Your Industry Professionals Can " + actionFor(theme),
                    "The " + adjective + " Guide to " + theme,
                    "Why " + leadAudience + " Need to Know About " + theme);
            case INSTAGRAM -> List.of(
                    "✨ " + theme + ": What You Need to Know",
                    "Behind the Scenes: " + theme + " Edition",
                    "The " + adjective + " Way to " + theme);
            case FACEBOOK -> List.of(
                    "Let's Talk About " + theme,
                    "Your " + theme + " Questions Answered",
                    "The Truth About " + theme + " for " + leadAudience);
        };
    }

    static List<String> hooks(String theme) {
        return HOOKS.getOrDefault(theme, HOOKS.get(EDUCATIONAL));
    }

    static String body(String theme, BusinessProfile business, BrandProfile brand) {
        return switch (theme) {
            case EDUCATIONAL -> "As " + business.industry() + " professionals, it's crucial to stay informed about "
                    + "industry trends and best practices. Here are three key insights that can help "
                    + business.targetAudience() + " stay ahead of the curve.";
            case BEHIND_THE_SCENES -> "At our company, we believe in " + brand.coreValues()
                    + ". Today, we're sharing a glimpse into our process and the people who make it all possible.";
            case PROBLEM_SOLUTION -> "We understand that " + business.currentChallenges()
                    + " can be challenging. That's why we've developed solutions specifically designed for "
                    + business.targetAudience() + ".";
            default -> "Our approach is rooted in " + brand.coreValues() + ", ensuring we deliver value to "
                    + business.targetAudience() + ".";
        };
    }

    static List<String> callsToAction(Platform platform) {
        return CALLS_TO_ACTION.get(platform);
    }

    /** Instagram gets one sentence per paragraph; other platforms keep the caption verbatim. */
    static String formatCaption(String caption, Platform platform) {
        return platform == Platform.INSTAGRAM ? caption.replace(". ", ".\n\n") : caption;
    }

    static PlatformOptimization optimizationFor(Platform platform) {
        return OPTIMIZATIONS.get(platform);
    }

    static String actionFor(String theme) {
        return switch (theme) {
            case EDUCATIONAL -> "Stay Informed";
            case BEHIND_THE_SCENES -> "See the Process";
            case PROBLEM_SOLUTION -> "Solve Problems";
            default -> "Stay Ahead";
        };
    }

    static String adjectiveFor(String voice) {
        String lowered = voice.toLowerCase(Locale.ROOT);
        if (lowered.contains("professional")) {
            return "Professional";
        }
        if (lowered.contains("casual")) {
            return "Casual";
        }
        if (lowered.contains("playful")) {
            return "Playful";
        }
        return "Effective";
    }
}
