package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Brand-wide visual direction, derived once per run from the brand and business profiles.
 * Every per-post {@link VisualConcept} builds on it.
 *
 * @param personalityType     visual personality, e.g. {@code professional_authority}
 * @param valuesTranslation   visuals per matched core value, {@code general} when none matched
 * @param designPrinciples    personality principles followed by three emotional-tone principles
 * @param personalityKeywords adjectives plus up to two visual synonyms each, at most ten
 * @param styleDirection      one-line blend of personality, industry and audience
 */
public record BrandVisualGuidelines(
        @JsonProperty("visual_personality_type")     String personalityType,
        @JsonProperty("emotional_tone")              EmotionalTone emotionalTone,
        @JsonProperty("values_visual_translation")   Map<String, ValueVisuals> valuesTranslation,
        @JsonProperty("design_principles")           List<String> designPrinciples,
        @JsonProperty("personality_keywords")        List<String> personalityKeywords,
        @JsonProperty("industry_visual_standards")   IndustryStandards industryStandards,
        @JsonProperty("audience_visual_preferences") AudienceVisuals audience,
        @JsonProperty("style_direction")             String styleDirection,
        @JsonProperty("color_psychology")            ColorPsychology colorPsychology,
        @JsonProperty("typography_guidelines")       Typography typography
) implements Serializable {

    public BrandVisualGuidelines {
        valuesTranslation = Copies.ordered(valuesTranslation);
        designPrinciples = List.copyOf(designPrinciples);
        personalityKeywords = List.copyOf(personalityKeywords);
    }

    public record EmotionalTone(
            @JsonProperty("emotional_quality")      String emotionalQuality,
            @JsonProperty("visual_characteristics") List<String> visualCharacteristics,
            @JsonProperty("mood")                   String mood
    ) implements Serializable {

        public EmotionalTone {
            visualCharacteristics = List.copyOf(visualCharacteristics);
        }
    }

    public record ValueVisuals(
            @JsonProperty("visual_characteristics") List<String> visualCharacteristics,
            @JsonProperty("color_associations")     List<String> colorAssociations,
            @JsonProperty("typography_style")       List<String> typographyStyle
    ) implements Serializable {

        public ValueVisuals {
            visualCharacteristics = List.copyOf(visualCharacteristics);
            colorAssociations = List.copyOf(colorAssociations);
            typographyStyle = List.copyOf(typographyStyle);
        }
    }

    public record IndustryStandards(
            @JsonProperty("visual_style")      String visualStyle,
            @JsonProperty("color_preferences") List<String> colorPreferences,
            @JsonProperty("typography_style")  String typographyStyle,
            @JsonProperty("imagery_style")     String imageryStyle,
            @JsonProperty("design_trends")     List<String> designTrends,
            @JsonProperty("avoid")             List<String> avoid
    ) implements Serializable {

        public IndustryStandards {
            colorPreferences = List.copyOf(colorPreferences);
            designTrends = List.copyOf(designTrends);
            avoid = List.copyOf(avoid);
        }
    }

    public record AudienceVisuals(
            @JsonProperty("age_group")             String ageGroup,
            @JsonProperty("audience_type")         String audienceType,
            @JsonProperty("visual_style")          List<String> visualStyle,
            @JsonProperty("visual_approach")       List<String> visualApproach,
            @JsonProperty("design_considerations") List<String> designConsiderations
    ) implements Serializable {

        public AudienceVisuals {
            visualStyle = List.copyOf(visualStyle);
            visualApproach = List.copyOf(visualApproach);
            designConsiderations = List.copyOf(designConsiderations);
        }
    }

    /**
     * @param industryColors empty when the industry has no colour convention of its own
     */
    public record ColorPsychology(
            @JsonProperty("primary_color_psychology")      String primaryPsychology,
            @JsonProperty("recommended_colors")            List<String> recommendedColors,
            @JsonProperty("industry_color_considerations") List<String> industryColors,
            @JsonProperty("color_combination_strategy")    String combinationStrategy
    ) implements Serializable {

        public ColorPsychology {
            recommendedColors = List.copyOf(recommendedColors);
            industryColors = List.copyOf(industryColors);
        }
    }

    public record Typography(
            @JsonProperty("typography_personality") String personality,
            @JsonProperty("font_characteristics")   List<String> fontCharacteristics
    ) implements Serializable {

        public Typography {
            fontCharacteristics = List.copyOf(fontCharacteristics);
        }
    }
}
