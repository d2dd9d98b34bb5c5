package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Design suggestions for one calendar post.
 *
 * @param visualPersonality    professional, approachable, dynamic or balanced, from the brand voice
 * @param mood                 warm, confident, uplifting or neutral, from the brand tone
 * @param styleCharacteristics personality and mood combined
 * @param avoid                industry design patterns to stay away from
 */
public record VisualConcept(
        @JsonProperty("day")                     int day,
        @JsonProperty("platform")                Platform platform,
        @JsonProperty("content_type")            String contentType,
        @JsonProperty("title")                   String title,
        @JsonProperty("content_theme")           String contentTheme,
        @JsonProperty("visual_personality")      String visualPersonality,
        @JsonProperty("mood")                    String mood,
        @JsonProperty("style_characteristics")   List<String> styleCharacteristics,
        @JsonProperty("avoid")                   List<String> avoid,
        @JsonProperty("platform_specifications") PlatformSpecs platformSpecs,
        @JsonProperty("design_concept")          DesignConcept design,
        @JsonProperty("color_palette")           ColorPalette colorPalette,
        @JsonProperty("layout_composition")      Layout layout,
        @JsonProperty("typography")              TypographyPlan typography,
        @JsonProperty("visual_elements")         List<VisualElement> visualElements,
        @JsonProperty("implementation_notes")    List<String> implementationNotes
) implements Serializable {

    public VisualConcept {
        styleCharacteristics = List.copyOf(styleCharacteristics);
        avoid = List.copyOf(avoid);
        visualElements = List.copyOf(visualElements);
        implementationNotes = List.copyOf(implementationNotes);
    }

    public record PlatformSpecs(
            @JsonProperty("dimensions")            String dimensions,
            @JsonProperty("design_considerations") List<String> designConsiderations,
            @JsonProperty("content_type_specific") List<String> contentTypeSpecific,
            @JsonProperty("optimal_formats")       List<String> optimalFormats,
            @JsonProperty("text_guidelines")       String textGuidelines
    ) implements Serializable {

        public PlatformSpecs {
            designConsiderations = List.copyOf(designConsiderations);
            contentTypeSpecific = List.copyOf(contentTypeSpecific);
            optimalFormats = List.copyOf(optimalFormats);
        }
    }

    /**
     * @param goalAdjustment empty when the goal names none of engagement, education, awareness, conversion
     */
    public record DesignConcept(
            @JsonProperty("overall_approach")          String overallApproach,
            @JsonProperty("key_visual_elements")       List<String> keyElements,
            @JsonProperty("composition_guidelines")    String composition,
            @JsonProperty("goal_specific_adjustments") String goalAdjustment
    ) implements Serializable {

        public DesignConcept {
            keyElements = List.copyOf(keyElements);
        }
    }

    /**
     * @param secondary  null when the brand gave a single colour
     * @param accent     null when the brand gave fewer than three colours
     * @param psychology meaning of each palette colour, keyed like the palette
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ColorPalette(
            @JsonProperty("primary")                String primary,
            @JsonProperty("secondary")              String secondary,
            @JsonProperty("accent")                 String accent,
            @JsonProperty("color_psychology")       Map<String, String> psychology,
            @JsonProperty("mood_based_adjustments") String moodAdjustment,
            @JsonProperty("combination_strategy")   String combinationStrategy
    ) implements Serializable {

        public ColorPalette {
            psychology = Copies.ordered(psychology);
        }
    }

    public record Layout(
            @JsonProperty("layout_structure") String structure,
            @JsonProperty("spacing")          String spacing
    ) implements Serializable {}

    public record TypographyPlan(
            @JsonProperty("typography_personality")  String personality,
            @JsonProperty("font_characteristics")    List<String> fontCharacteristics,
            @JsonProperty("platform_considerations") List<String> platformConsiderations
    ) implements Serializable {

        public TypographyPlan {
            fontCharacteristics = List.copyOf(fontCharacteristics);
            platformConsiderations = List.copyOf(platformConsiderations);
        }
    }

    public record VisualElement(
            @JsonProperty("element") String element,
            @JsonProperty("purpose") String purpose
    ) implements Serializable {}
}
