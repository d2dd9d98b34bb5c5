package com.eainde.planner.visual;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BrandVisualGuidelines;
import com.eainde.planner.model.ContentCalendar;
import com.eainde.planner.model.DailyPost;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.VisualConcept;
import com.eainde.planner.model.VisualConcept.ColorPalette;
import com.eainde.planner.model.VisualConcept.DesignConcept;
import com.eainde.planner.model.VisualConcept.Layout;
import com.eainde.planner.model.VisualConcept.PlatformSpecs;
import com.eainde.planner.model.VisualConcept.TypographyPlan;
import com.eainde.planner.model.VisualConcept.VisualElement;
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
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one calendar post into a {@link VisualConcept}: platform specifications, design
 * approach for the post's theme and goal, colour palette, layout and typography.
 *
 * <p>Builds on the week's {@link BrandVisualGuidelines} for industry avoid-list,
 * typography and colour strategy. Placeholder posts get a concept too, with generic
 * visual elements.</p>
 */
@Log4j2
@Component
public class VisualConceptGenerator extends AbstractPlanningStage<VisualConceptRequest, VisualConcept> {

    static final String BALANCED = "balanced";
    static final String NEUTRAL = "neutral";

    static final String DEFAULT_PRIMARY = "#1E40AF";
    static final String DEFAULT_SECONDARY = "#F59E0B";
    static final String DEFAULT_ACCENT = "#10B981";
    static final String UNKNOWN_COLOR_MEANING = "Professional and trustworthy";

    private static final Pattern HEX_COLOR = Pattern.compile("#([A-Fa-f0-9]{6})");

    private static final List<ArtifactKey<?>> REQUIRED = List.of(
            ArtifactKeys.CONTENT_CALENDAR,
            ArtifactKeys.BRAND_PROFILE,
            ArtifactKeys.BRAND_VISUAL_GUIDELINES);

    static final KeywordRuleTable<String> VISUAL_PERSONALITIES = KeywordRuleTable.<String>builder()
            .rule("professional", "professional", "formal")
            .rule("approachable", "casual", "friendly")
            .rule("dynamic", "playful", "energetic")
            .build();

    static final KeywordRuleTable<String> MOODS = KeywordRuleTable.<String>builder()
            .rule("warm", "warm", "supportive")
            .rule("confident", "confident", "bold")
            .rule("uplifting", "encouraging")
            .build();

    private static final Map<String, Map<String, List<String>>> STYLE_CHARACTERISTICS = Map.of(
            "professional", Map.of(
                    "warm", List.of("Clean layouts", "Professional typography", "Warm color accents"),
                    "confident", List.of("Bold typography", "Strong compositions", "High contrast"),
                    "uplifting", List.of("Positive imagery", "Bright accents", "Encouraging visuals"),
                    NEUTRAL, List.of("Balanced compositions", "Professional imagery", "Clean design")),
            "approachable", Map.of(
                    "warm", List.of("Friendly imagery", "Rounded elements", "Inviting colors"),
                    "confident", List.of("Strong but friendly", "Approachable authority", "Warm professionalism"),
                    "uplifting", List.of("Positive messaging", "Bright and cheerful", "Community-focused"),
                    NEUTRAL, List.of("Friendly professional", "Approachable design", "Welcoming aesthetic")),
            "dynamic", Map.of(
                    "warm", List.of("Energetic but warm", "Vibrant colors", "Active imagery"),
                    "confident", List.of("Bold and energetic", "Strong visual impact", "Dynamic compositions"),
                    "uplifting", List.of("High energy", "Motivational visuals", "Vibrant and positive"),
                    NEUTRAL, List.of("Dynamic but balanced", "Energetic design", "Active visual style")));

    private static final List<String> BALANCED_STYLE = List.of("Balanced design", "Professional approach");

    /**
     * @param dimensions by content-type key; the first entry is the fallback
     */
    record PlatformVisuals(Map<String, String> dimensions, List<String> considerations, List<String> formats,
                           String textGuidelines, String spacing, List<String> typography) {}

    private static final Map<Platform, PlatformVisuals> PLATFORM_VISUALS = Map.of(
            Platform.FACEBOOK, new PlatformVisuals(
                    orderedOf("feed_post", "1200x630px", "story", "1080x1920px", "cover_photo", "1200x315px"),
                    List.of(
                            "Text overlay should be readable on mobile",
                            "Use high contrast for better visibility",
                            "Consider how content appears in news feed",
                            "Include clear call-to-action elements"),
                    List.of("JPEG", "PNG"),
                    "Keep text minimal, use large fonts for mobile viewing",
                    "Use generous padding, especially for mobile viewing",
                    List.of(
                            "Keep text overlay minimal and readable",
                            "Use larger fonts for mobile viewing",
                            "Ensure text doesn't compete with image")),
            Platform.INSTAGRAM, new PlatformVisuals(
                    orderedOf("feed_post", "1080x1080px (square) or 1080x1350px (portrait)",
                            "story", "1080x1920px", "reel", "1080x1920px"),
                    List.of(
                            "High visual impact is crucial",
                            "Use vibrant colors and high contrast",
                            "Ensure mobile-first design",
                            "Consider Instagram's visual aesthetic"),
                    List.of("JPEG", "PNG", "MP4"),
                    "Minimal text overlay, let visuals speak",
                    "Tighter spacing acceptable, focus on visual impact",
                    List.of(
                            "Minimize text overlay on images",
                            "Use bold, readable fonts for Stories",
                            "Consider text in captions rather than on image")),
            Platform.LINKEDIN, new PlatformVisuals(
                    orderedOf("feed_post", "1200x627px", "article_cover", "1200x627px", "company_logo", "300x300px"),
                    List.of(
                            "Professional and clean aesthetic",
                            "Business-appropriate imagery",
                            "Clear, readable text",
                            "Professional color schemes"),
                    List.of("JPEG", "PNG"),
                    "Professional typography, clear messaging",
                    "Professional spacing, clean and organized layout",
                    List.of(
                            "Use professional, clean typography",
                            "Maintain business-appropriate font choices",
                            "Ensure readability in professional context")));

    static final String IMAGE_POST = "image_post";

    private static final Map<String, List<String>> CONTENT_TYPE_TIPS = Map.of(
            IMAGE_POST, List.of(
                    "Use high-quality, eye-catching imagery",
                    "Ensure proper composition and focal point",
                    "Consider rule of thirds for layout"),
            "video", List.of(
                    "Create engaging thumbnail image",
                    "Use captions for accessibility",
                    "Keep opening 3 seconds compelling"),
            "story", List.of(
                    "Design for vertical viewing",
                    "Use bold, readable text",
                    "Create immersive, full-screen experience"),
            "reel", List.of(
                    "Design for vertical, mobile-first viewing",
                    "Create hook in first 3 seconds",
                    "Use trending audio and effects"),
            "carousel", List.of(
                    "Design cohesive visual story across slides",
                    "Use consistent branding elements",
                    "Create clear progression and narrative"));

    private static final Map<String, String> LAYOUT_STRUCTURES = Map.of(
            IMAGE_POST, "Single focal point with supporting text overlay",
            "video", "Thumbnail with engaging opening frame and clear title",
            "story", "Full-screen vertical layout with clear messaging hierarchy",
            "carousel", "Cohesive story progression across multiple slides");

    static final String DEFAULT_LAYOUT = "Balanced composition with clear focal point";

    static final String EDUCATIONAL = "Educational Content";

    private static final Map<String, DesignConcept> THEME_DESIGNS = Map.of(
            EDUCATIONAL, new DesignConcept(
                    "Clean, informative layout with clear hierarchy",
                    List.of("Infographic elements", "Step-by-step visuals", "Data visualization"),
                    "Use grids and structured layouts for easy reading", ""),
            "Behind-the-Scenes", new DesignConcept(
                    "Authentic, candid photography with natural lighting",
                    List.of("Team photos", "Process shots", "Workspace imagery"),
                    "Use documentary-style photography with natural compositions", ""),
            "Problem-Solution", new DesignConcept(
                    "Before/after comparisons or solution-focused imagery",
                    List.of("Comparison visuals", "Solution highlights", "Benefit demonstrations"),
                    "Use split-screen or sequential layouts", ""));

    static final KeywordRuleTable<String> GOAL_ADJUSTMENTS = KeywordRuleTable.<String>builder()
            .rule("Include interactive elements, questions, or polls in visual", "engagement")
            .rule("Focus on clear, readable information hierarchy", "education")
            .rule("Use bold, memorable visuals with strong brand presence", "awareness")
            .rule("Include clear call-to-action elements and benefit highlights", "conversion")
            .build();

    private static final Map<String, List<VisualElement>> THEME_ELEMENTS = Map.of(
            EDUCATIONAL, List.of(
                    new VisualElement("Infographic icons", "Visual data representation"),
                    new VisualElement("Step indicators", "Process clarity"),
                    new VisualElement("Chart/graph elements", "Data visualization")),
            "Behind-the-Scenes", List.of(
                    new VisualElement("Candid photography", "Authentic storytelling"),
                    new VisualElement("Team member photos", "Human connection"),
                    new VisualElement("Workspace imagery", "Company culture")),
            "Problem-Solution", List.of(
                    new VisualElement("Before/after visuals", "Clear comparison"),
                    new VisualElement("Solution highlights", "Benefit demonstration"),
                    new VisualElement("Success indicators", "Proof of effectiveness")));

    static final List<VisualElement> GENERIC_ELEMENTS = List.of(
            new VisualElement("Brand elements", "Consistent branding"),
            new VisualElement("High-quality imagery", "Professional appearance"));

    private static final Map<String, String> COLOR_MEANINGS = Map.of(
            "#1E40AF", "Blue - Trust, professionalism, stability",
            "#F59E0B", "Orange - Energy, enthusiasm, creativity",
            "#10B981", "Green - Growth, harmony, success",
            "#EF4444", "Red - Urgency, passion, excitement",
            "#8B5CF6", "Purple - Luxury, creativity, wisdom");

    private static final Map<String, String> MOOD_COLOR_ADJUSTMENTS = Map.of(
            "warm", "Use warmer tones and softer color transitions",
            "confident", "Use high contrast and bold color combinations",
            "uplifting", "Incorporate bright, energetic accent colors",
            NEUTRAL, "Maintain balanced color distribution");

    @Override
    public String name() {
        return StageNames.VISUAL_CONCEPT_GENERATOR;
    }

    @Override
    protected List<ArtifactKey<?>> requiredKeys(VisualConceptRequest request) {
        if (request == null) {
            throw new ValidationException("Visual concept request is required");
        }
        ArtifactKeys.checkDay(request.day());
        return REQUIRED;
    }

    @Override
    protected StageOutput<VisualConcept> process(ContextStore store, VisualConceptRequest request) {
        ContentCalendar calendar = store.require(ArtifactKeys.CONTENT_CALENDAR);
        DailyPost post = calendar.post(request.day());

        VisualConcept concept = generate(post,
                store.require(ArtifactKeys.BRAND_PROFILE),
                store.require(ArtifactKeys.BRAND_VISUAL_GUIDELINES),
                request.brandColors());
        return StageOutput.writing(ArtifactKeys.visualConcept(request.day()), concept,
                "Visual concept for day " + request.day() + " on " + post.platform());
    }

    public VisualConcept generate(DailyPost post, BrandProfile brand, BrandVisualGuidelines guidelines,
                                  String brandColors) {
        String personality = VISUAL_PERSONALITIES.firstMatchOrDefault(brand.voice(), BALANCED);
        String mood = MOODS.firstMatchOrDefault(brand.tone(), NEUTRAL);
        String typeKey = contentTypeKey(post.postType());
        PlatformVisuals platform = PLATFORM_VISUALS.get(post.platform());

        if (post.isPlaceholder()) {
            log.debug("Day {} is a placeholder, using generic visual elements", post.day());
        }

        return new VisualConcept(
                post.day(),
                post.platform(),
                post.postType(),
                post.title(),
                post.contentTheme(),
                personality,
                mood,
                styleCharacteristics(personality, mood),
                guidelines.industryStandards().avoid(),
                new PlatformSpecs(
                        platform.dimensions().getOrDefault(typeKey, platform.dimensions().values().iterator().next()),
                        platform.considerations(),
                        CONTENT_TYPE_TIPS.getOrDefault(typeKey, CONTENT_TYPE_TIPS.get(IMAGE_POST)),
                        platform.formats(),
                        platform.textGuidelines()),
                designConcept(post),
                palette(brandColors, mood, guidelines.colorPsychology().combinationStrategy()),
                new Layout(LAYOUT_STRUCTURES.getOrDefault(typeKey, DEFAULT_LAYOUT), platform.spacing()),
                new TypographyPlan(
                        guidelines.typography().personality(),
                        guidelines.typography().fontCharacteristics(),
                        platform.typography()),
                THEME_ELEMENTS.getOrDefault(post.contentTheme(), GENERIC_ELEMENTS),
                implementationNotes(post.platform()));
    }

    // ==================================================================================
    // Helpers
    // ==================================================================================

    /** "Image Post" → "image_post". */
    static String contentTypeKey(String postType) {
        return postType == null ? IMAGE_POST : postType.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    static List<String> styleCharacteristics(String personality, String mood) {
        Map<String, List<String>> byMood = STYLE_CHARACTERISTICS.get(personality);
        if (byMood == null || !byMood.containsKey(mood)) {
            return BALANCED_STYLE;
        }
        return byMood.get(mood);
    }

    /** Theme design, Educational Content when the theme has none; goal adjustment is the first goal word matched. */
    static DesignConcept designConcept(DailyPost post) {
        DesignConcept theme = THEME_DESIGNS.getOrDefault(post.contentTheme(), THEME_DESIGNS.get(EDUCATIONAL));
        return new DesignConcept(theme.overallApproach(), theme.keyElements(), theme.composition(),
                GOAL_ADJUSTMENTS.firstMatchOrDefault(post.goal(), ""));
    }

    /**
     * The first three hex colours found become primary, secondary and accent. Without any,
     * the default palette is used.
     */
    static ColorPalette palette(String brandColors, String mood, String combinationStrategy) {
        List<String> colors = new ArrayList<>();
        if (brandColors != null) {
            Matcher matcher = HEX_COLOR.matcher(brandColors);
            while (matcher.find() && colors.size() < 3) {
                colors.add("#" + matcher.group(1).toUpperCase(Locale.ROOT));
            }
        }
        if (colors.isEmpty()) {
            colors = List.of(DEFAULT_PRIMARY, DEFAULT_SECONDARY, DEFAULT_ACCENT);
        }

        Map<String, String> psychology = new LinkedHashMap<>();
        String[] roles = {"primary", "secondary", "accent"};
        for (int i = 0; i < colors.size(); i++) {
            psychology.put(roles[i], COLOR_MEANINGS.getOrDefault(colors.get(i), UNKNOWN_COLOR_MEANING));
        }

        return new ColorPalette(
                colors.get(0),
                colors.size() > 1 ? colors.get(1) : null,
                colors.size() > 2 ? colors.get(2) : null,
                psychology,
                MOOD_COLOR_ADJUSTMENTS.getOrDefault(mood, "Maintain brand color consistency"),
                combinationStrategy);
    }

    private static List<String> implementationNotes(Platform platform) {
        return List.of(
                "Ensure all text is readable at small sizes for mobile viewing",
                "Test design in actual platform context before finalizing",
                "Maintain brand consistency across all visual elements",
                "Consider accessibility guidelines for color contrast and text size",
                "Optimize for " + platform.getLabel() + " best practices and user expectations",
                "Prepare multiple format variations if needed for different placements");
    }

    private static Map<String, String> orderedOf(String... keysAndValues) {
        Map<String, String> ordered = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            ordered.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return ordered;
    }
}
