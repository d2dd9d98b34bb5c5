package com.eainde.planner.visual;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BrandVisualGuidelines;
import com.eainde.planner.model.BrandVisualGuidelines.AudienceVisuals;
import com.eainde.planner.model.BrandVisualGuidelines.ColorPsychology;
import com.eainde.planner.model.BrandVisualGuidelines.EmotionalTone;
import com.eainde.planner.model.BrandVisualGuidelines.IndustryStandards;
import com.eainde.planner.model.BrandVisualGuidelines.Typography;
import com.eainde.planner.model.BrandVisualGuidelines.ValueVisuals;
import com.eainde.planner.model.BusinessProfile;
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

/**
 * Translates the brand into visual guidelines shared by every post of the week.
 *
 * <h3>Derivation:</h3>
 * <ol>
 *   <li>Visual personality from the voice, emotional tone from the tone, both first match.</li>
 *   <li>Every core value with a known visual translation; {@code general} when none is known.</li>
 *   <li>Industry standards, professional services when the industry names no known sector.</li>
 *   <li>Audience age group and type, each first match with a catch-all default.</li>
 *   <li>Colour psychology and typography from the voice, industry colours when the sector has any.</li>
 * </ol>
 */
@Log4j2
@Component
public class BrandVisualAnalyzer extends AbstractPlanningStage<Void, BrandVisualGuidelines> {

    public static final int MAX_PERSONALITY_KEYWORDS = 10;

    static final String BALANCED_VERSATILE = "balanced_versatile";
    static final String GENERAL_VALUES = "general";
    static final String MIXED_AGE = "Mixed";
    static final String GENERAL_AUDIENCE = "General";

    static final String COMBINATION_STRATEGY = "Use 60-30-10 rule: 60% primary brand color, 30% secondary color, "
            + "10% accent color. Maintain consistent color hierarchy across all materials.";

    private static final List<ArtifactKey<?>> REQUIRED = List.of(
            ArtifactKeys.BUSINESS_PROFILE,
            ArtifactKeys.BRAND_PROFILE);

    static final KeywordRuleTable<String> PERSONALITY_TYPES = KeywordRuleTable.<String>builder()
            .rule("professional_authority", "professional", "authoritative", "expert", "formal")
            .rule("friendly_approachable", "friendly", "approachable", "casual", "welcoming")
            .rule("innovative_modern", "innovative", "cutting-edge", "modern", "forward-thinking")
            .rule("playful_energetic", "playful", "energetic", "fun", "dynamic")
            .rule("trustworthy_reliable", "trustworthy", "reliable", "consistent", "stable")
            .build();

    private static final Map<String, List<String>> PERSONALITY_PRINCIPLES = Map.of(
            "professional_authority", List.of(
                    "Use clean, organized layouts with clear hierarchy",
                    "Maintain consistent, professional typography",
                    "Employ high-quality, business-appropriate imagery",
                    "Use conservative color palettes with strategic accent colors"),
            "friendly_approachable", List.of(
                    "Use rounded, soft design elements",
                    "Incorporate warm, inviting color schemes",
                    "Include people-focused imagery and testimonials",
                    "Maintain open, welcoming layouts with generous white space"),
            "innovative_modern", List.of(
                    "Embrace cutting-edge design trends and modern aesthetics",
                    "Use bold, contemporary typography and layouts",
                    "Incorporate dynamic visual elements and creative compositions",
                    "Employ fresh, vibrant color palettes"),
            "playful_energetic", List.of(
                    "Use dynamic, movement-oriented design elements",
                    "Incorporate bright, energetic color schemes",
                    "Include fun, engaging imagery and interactive elements",
                    "Maintain lively, energetic layouts with visual interest"),
            "trustworthy_reliable", List.of(
                    "Use stable, balanced compositions",
                    "Employ consistent, reliable design patterns",
                    "Incorporate authentic, credible imagery",
                    "Maintain conservative, dependable color choices"),
            BALANCED_VERSATILE, List.of(
                    "Create adaptable designs that work across contexts",
                    "Use flexible, versatile design elements",
                    "Maintain professional appearance with personality touches",
                    "Employ balanced color palettes with strategic accents"));

    static final KeywordRuleTable<String> VALUE_RULES = KeywordRuleTable.<String>builder()
            .rule("innovation", "innovation")
            .rule("quality", "quality")
            .rule("trust", "trust")
            .rule("customer-first", "customer-first", "customer first")
            .rule("transparency", "transparency")
            .rule("sustainability", "sustainability")
            .build();

    private static final Map<String, ValueVisuals> VALUE_VISUALS = Map.of(
            "innovation", new ValueVisuals(
                    List.of("Modern design elements", "Forward-thinking layouts", "Creative compositions"),
                    List.of("Blue (trust)", "Purple (creativity)", "Silver (innovation)"),
                    List.of("Modern sans-serif", "Clean lines", "Contemporary feel")),
            "quality", new ValueVisuals(
                    List.of("High-resolution imagery", "Premium feel", "Attention to detail"),
                    List.of("Gold (premium)", "Deep blue (reliability)", "White (purity)"),
                    List.of("Refined fonts", "Elegant spacing", "Professional appearance")),
            "trust", new ValueVisuals(
                    List.of("Professional photography", "Consistent branding", "Authentic imagery"),
                    List.of("Blue (trust)", "Green (stability)", "Neutral tones"),
                    List.of("Readable fonts", "Consistent hierarchy", "Professional styling")),
            "customer-first", new ValueVisuals(
                    List.of("People-focused imagery", "Customer testimonials", "Service-oriented visuals"),
                    List.of("Warm colors", "Approachable tones", "Inviting palette"),
                    List.of("Friendly fonts", "Approachable styling", "Readable design")),
            "transparency", new ValueVisuals(
                    List.of("Clean layouts", "Honest imagery", "Straightforward design"),
                    List.of("Clear whites", "Honest blues", "Transparent elements"),
                    List.of("Clear fonts", "Open spacing", "Honest presentation")),
            "sustainability", new ValueVisuals(
                    List.of("Natural imagery", "Eco-friendly elements", "Organic shapes"),
                    List.of("Green tones", "Natural colors", "Earth tones"),
                    List.of("Organic fonts", "Natural feel", "Eco-conscious design")));

    private static final ValueVisuals GENERAL_VALUE_VISUALS = new ValueVisuals(
            List.of("Professional appearance", "Consistent branding", "Quality imagery"),
            List.of("Brand colors", "Professional palette", "Consistent tones"),
            List.of("Readable fonts", "Professional styling", "Consistent hierarchy"));

    static final KeywordRuleTable<EmotionalTone> EMOTIONAL_TONES = KeywordRuleTable.<EmotionalTone>builder()
            .rule(new EmotionalTone("Uplifting and motivating",
                    List.of("Bright colors", "Positive imagery", "Inspiring compositions"),
                    "Optimistic and forward-looking"), "encouraging")
            .rule(new EmotionalTone("Warm and caring",
                    List.of("Warm colors", "Approachable imagery", "Comforting layouts"),
                    "Welcoming and supportive"), "supportive")
            .rule(new EmotionalTone("Strong and assured",
                    List.of("Bold colors", "Strong compositions", "Assertive imagery"),
                    "Self-assured and powerful"), "confident")
            .rule(new EmotionalTone("Competent and reliable",
                    List.of("Clean design", "Professional imagery", "Organized layouts"),
                    "Trustworthy and capable"), "professional")
            .rule(new EmotionalTone("Approachable and warm",
                    List.of("Inviting colors", "Friendly imagery", "Welcoming layouts"),
                    "Open and accessible"), "friendly")
            .build();

    static final EmotionalTone BALANCED_TONE = new EmotionalTone("Balanced and versatile",
            List.of("Neutral colors", "Professional imagery", "Clean layouts"),
            "Professional and approachable");

    private static final Map<String, List<String>> VISUAL_SYNONYMS = Map.of(
            "trustworthy", List.of("reliable", "dependable"),
            "innovative", List.of("creative", "forward-thinking"),
            "friendly", List.of("approachable", "welcoming"),
            "professional", List.of("polished", "refined"),
            "energetic", List.of("dynamic", "vibrant"));

    static final IndustryStandards PROFESSIONAL_SERVICES = new IndustryStandards(
            "Professional, authoritative, trustworthy",
            List.of("Blue", "Gray", "Professional tones"),
            "Professional, readable fonts",
            "Professional, business-appropriate",
            List.of("Clean layouts", "Professional imagery", "Trust-building elements"),
            List.of("Casual design elements", "Unprofessional imagery"));

    static final KeywordRuleTable<IndustryStandards> INDUSTRY_STANDARDS = KeywordRuleTable.<IndustryStandards>builder()
            .rule(new IndustryStandards(
                    "Modern, clean, tech-forward",
                    List.of("Blue", "White", "Gray", "Accent colors"),
                    "Clean sans-serif, modern fonts",
                    "High-tech, innovative, professional",
                    List.of("Minimalism", "Flat design", "Clean layouts"),
                    List.of("Outdated design patterns", "Overly decorative elements")), "technology")
            .rule(new IndustryStandards(
                    "Clean, trustworthy, professional",
                    List.of("Blue", "White", "Green", "Soft tones"),
                    "Readable, professional fonts",
                    "Professional, caring, trustworthy",
                    List.of("Clean layouts", "Professional photography", "Trust-building design"),
                    List.of("Overly flashy designs", "Unprofessional imagery")), "healthcare")
            .rule(new IndustryStandards(
                    "Product-focused, conversion-optimized",
                    List.of("Brand colors", "High contrast", "Call-to-action colors"),
                    "Clear, readable, conversion-focused",
                    "High-quality product photos, lifestyle imagery",
                    List.of("Product showcases", "Social proof", "Clear CTAs"),
                    List.of("Cluttered layouts", "Poor product photography")), "e-commerce")
            .build();

    // "young" precedes "young professional", so young professionals read as Gen Z
    static final KeywordRuleTable<String> AGE_GROUPS = KeywordRuleTable.<String>builder()
            .rule("Gen Z", "18-25", "gen z", "young", "student")
            .rule("Millennial", "25-40", "millennial", "young professional")
            .rule("Gen X", "40-60", "gen x", "mature", "established")
            .rule("Baby Boomer", "60+", "baby boomer", "senior")
            .build();

    static final KeywordRuleTable<String> AUDIENCE_TYPES = KeywordRuleTable.<String>builder()
            .rule("Business Professional", "business", "professional", "executive", "corporate")
            .rule("Consumer", "consumer", "customer", "shopper", "buyer")
            .rule("Student/Educational", "student", "learner", "education", "academic")
            .rule("Entrepreneur", "entrepreneur", "startup", "small business")
            .build();

    private static final Map<String, List<String>> AGE_VISUAL_STYLE = Map.of(
            "Gen Z", List.of("Bold", "Vibrant", "Authentic", "Social media native"),
            "Millennial", List.of("Modern", "Clean", "Balanced", "Mobile-optimized"),
            "Gen X", List.of("Professional", "Trustworthy", "Clear", "Detailed"),
            "Baby Boomer", List.of("Traditional", "Clear", "Readable", "Professional"),
            MIXED_AGE, List.of("Versatile", "Accessible", "Professional", "Inclusive"));

    private static final Map<String, List<String>> TYPE_VISUAL_APPROACH = Map.of(
            "Business Professional", List.of("Professional imagery", "Clean layouts", "Business-appropriate design"),
            "Consumer", List.of("Lifestyle imagery", "Product showcases", "Relatable content"),
            "Student/Educational", List.of("Clear, educational layouts", "Step-by-step visuals", "Informative design"),
            "Entrepreneur", List.of("Motivational imagery", "Success-focused design", "Professional presentation"),
            GENERAL_AUDIENCE, List.of("Versatile design", "Inclusive imagery", "Accessible layouts"));

    private static final List<String> READABILITY_CONSIDERATIONS = List.of(
            "Prioritize readability and clarity",
            "Use larger fonts and clear layouts",
            "Maintain professional appearance",
            "Ensure accessibility and usability");

    private static final Map<String, List<String>> AGE_CONSIDERATIONS = Map.of(
            "Gen Z", List.of(
                    "Design for mobile-first experience",
                    "Use bold, attention-grabbing visuals",
                    "Incorporate social media native elements",
                    "Ensure fast loading and snappy interactions"),
            "Millennial", List.of(
                    "Balance professional and approachable design",
                    "Optimize for mobile and desktop viewing",
                    "Use modern, clean aesthetic",
                    "Ensure easy sharing and engagement"),
            "Gen X", READABILITY_CONSIDERATIONS,
            "Baby Boomer", READABILITY_CONSIDERATIONS);

    private static final Map<String, List<String>> TYPE_CONSIDERATIONS = Map.of(
            "Business Professional", List.of(
                    "Maintain professional credibility",
                    "Use business-appropriate imagery",
                    "Ensure information hierarchy is clear",
                    "Focus on thought leadership presentation"),
            "Consumer", List.of(
                    "Create emotional connection",
                    "Use lifestyle and aspirational imagery",
                    "Focus on benefits and outcomes",
                    "Ensure easy decision-making support"));

    /** Voice-driven colours; the order of the rules is the precedence. */
    static final KeywordRuleTable<VoicePalette> VOICE_PALETTES = KeywordRuleTable.<VoicePalette>builder()
            .rule(new VoicePalette("Trust, reliability, professionalism",
                    List.of("Blue", "Gray", "White")), "professional", "formal")
            .rule(new VoicePalette("Approachability, warmth, friendliness",
                    List.of("Orange", "Yellow", "Green")), "friendly", "casual")
            .rule(new VoicePalette("Innovation, creativity, forward-thinking",
                    List.of("Purple", "Blue", "Silver")), "innovative", "modern")
            .build();

    static final VoicePalette BALANCED_PALETTE = new VoicePalette("Balance, versatility, professionalism",
            List.of("Blue", "Gray", "Accent colors"));

    static final KeywordRuleTable<List<String>> INDUSTRY_COLORS = KeywordRuleTable.<List<String>>builder()
            .rule(List.of("Blue (trust)", "Green (health)", "White (cleanliness)"), "healthcare")
            .rule(List.of("Blue (trust)", "Gray (professional)", "Accent colors (innovation)"), "technology")
            .rule(List.of("Blue (trust)", "Green (money)", "Gray (stability)"), "finance")
            .rule(List.of("Brand colors", "High contrast", "CTA colors"), "e-commerce")
            .build();

    static final KeywordRuleTable<Typography> TYPOGRAPHY = KeywordRuleTable.<Typography>builder()
            .rule(new Typography("Professional and authoritative",
                    List.of("Clean sans-serif fonts", "High readability", "Conservative styling")),
                    "professional", "formal")
            .rule(new Typography("Approachable and friendly",
                    List.of("Rounded fonts", "Warm feel", "Inviting typography")),
                    "friendly", "casual")
            .rule(new Typography("Modern and innovative",
                    List.of("Contemporary fonts", "Bold styling", "Forward-thinking design")),
                    "innovative", "modern")
            .build();

    static final Typography BALANCED_TYPOGRAPHY = new Typography("Balanced and versatile",
            List.of("Readable fonts", "Professional with personality", "Flexible styling"));

    /** Psychology and colours chosen from the brand voice. */
    record VoicePalette(String psychology, List<String> colors) {}

    @Override
    public String name() {
        return StageNames.BRAND_VISUAL_ANALYZER;
    }

    @Override
    protected List<ArtifactKey<?>> requiredKeys(Void input) {
        return REQUIRED;
    }

    @Override
    protected StageOutput<BrandVisualGuidelines> process(ContextStore store, Void input) {
        BrandVisualGuidelines guidelines = analyze(
                store.require(ArtifactKeys.BRAND_PROFILE),
                store.require(ArtifactKeys.BUSINESS_PROFILE));
        return StageOutput.writing(ArtifactKeys.BRAND_VISUAL_GUIDELINES, guidelines,
                "Brand visual guidelines derived, personality " + guidelines.personalityType());
    }

    public BrandVisualGuidelines analyze(BrandProfile brand, BusinessProfile business) {
        String voice = brand.voice();
        String personalityType = PERSONALITY_TYPES.firstMatchOrDefault(voice, BALANCED_VERSATILE);
        EmotionalTone tone = EMOTIONAL_TONES.firstMatchOrDefault(brand.tone(), BALANCED_TONE);
        IndustryStandards industry = INDUSTRY_STANDARDS.firstMatchOrDefault(business.industry(), PROFESSIONAL_SERVICES);
        AudienceVisuals audience = audienceVisuals(business.targetAudience());

        log.debug("Visual personality {} for voice '{}', audience {} / {}",
                personalityType, voice, audience.ageGroup(), audience.audienceType());

        VoicePalette palette = VOICE_PALETTES.firstMatchOrDefault(voice, BALANCED_PALETTE);
        return new BrandVisualGuidelines(
                personalityType,
                tone,
                valuesTranslation(brand.coreValues()),
                designPrinciples(personalityType, tone),
                personalityKeywords(brand.personalityAdjectives()),
                industry,
                audience,
                styleDirection(personalityType, industry, audience),
                new ColorPsychology(
                        palette.psychology(),
                        palette.colors(),
                        INDUSTRY_COLORS.firstMatchOrDefault(business.industry(), List.of()),
                        COMBINATION_STRATEGY),
                TYPOGRAPHY.firstMatchOrDefault(voice, BALANCED_TYPOGRAPHY));
    }

    // ==================================================================================
    // Helpers
    // ==================================================================================

    static Map<String, ValueVisuals> valuesTranslation(String coreValues) {
        Map<String, ValueVisuals> translation = new LinkedHashMap<>();
        for (String value : VALUE_RULES.matchAll(coreValues)) {
            translation.put(value, VALUE_VISUALS.get(value));
        }
        if (translation.isEmpty()) {
            translation.put(GENERAL_VALUES, GENERAL_VALUE_VISUALS);
        }
        return translation;
    }

    static List<String> designPrinciples(String personalityType, EmotionalTone tone) {
        List<String> principles = new ArrayList<>(
                PERSONALITY_PRINCIPLES.getOrDefault(personalityType, PERSONALITY_PRINCIPLES.get(BALANCED_VERSATILE)));
        principles.add("Incorporate " + tone.visualCharacteristics().get(0).toLowerCase(Locale.ROOT));
        principles.add("Maintain " + tone.mood().toLowerCase(Locale.ROOT) + " visual mood");
        principles.add("Use " + tone.emotionalQuality().toLowerCase(Locale.ROOT) + " design approach");
        return principles;
    }

    /** Comma separated adjectives, each followed by its visual synonyms. */
    static List<String> personalityKeywords(String adjectives) {
        List<String> words = adjectives == null ? List.of() : List.of(adjectives.toLowerCase(Locale.ROOT).split(","));
        List<String> keywords = new ArrayList<>();
        for (String word : words) {
            String adjective = word.trim();
            if (adjective.isEmpty()) {
                continue;
            }
            keywords.add(adjective);
            keywords.addAll(VISUAL_SYNONYMS.getOrDefault(adjective, List.of()));
        }
        if (keywords.isEmpty()) {
            return List.of("professional", "reliable");
        }
        return keywords.size() > MAX_PERSONALITY_KEYWORDS ? keywords.subList(0, MAX_PERSONALITY_KEYWORDS) : keywords;
    }

    static AudienceVisuals audienceVisuals(String targetAudience) {
        String ageGroup = AGE_GROUPS.firstMatchOrDefault(targetAudience, MIXED_AGE);
        String audienceType = AUDIENCE_TYPES.firstMatchOrDefault(targetAudience, GENERAL_AUDIENCE);

        List<String> considerations = new ArrayList<>(AGE_CONSIDERATIONS.getOrDefault(ageGroup, List.of()));
        considerations.addAll(TYPE_CONSIDERATIONS.getOrDefault(audienceType, List.of()));

        return new AudienceVisuals(
                ageGroup,
                audienceType,
                AGE_VISUAL_STYLE.get(ageGroup),
                TYPE_VISUAL_APPROACH.get(audienceType),
                considerations);
    }

    static String styleDirection(String personalityType, IndustryStandards industry, AudienceVisuals audience) {
        return "Balancing " + industry.visualStyle() + " industry standards with " + personalityType
                + " brand personality with Audience-optimized: age-appropriate "
                + audience.visualStyle().get(0).toLowerCase(Locale.ROOT) + " styling, "
                + audience.visualApproach().get(0).toLowerCase(Locale.ROOT) + " approach";
    }
}
