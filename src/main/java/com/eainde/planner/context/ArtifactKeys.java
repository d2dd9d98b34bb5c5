package com.eainde.planner.context;

import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BrandVisualGuidelines;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.ContentCalendar;
import com.eainde.planner.model.ContentTypeRanking;
import com.eainde.planner.model.DailyPost;
import com.eainde.planner.model.HashtagRecommendation;
import com.eainde.planner.model.PlatformSelection;
import com.eainde.planner.model.StrategyFramework;
import com.eainde.planner.model.StrategySummary;
import com.eainde.planner.model.VisualConcept;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The closed key set of one planning run.
 *
 * <p>Day-scoped keys exist for days 1 to 7 only; asking for any other day is a
 * validation error, so no stage can invent a key outside this set.</p>
 */
public final class ArtifactKeys {

    public static final int DAYS_PER_WEEK = 7;

    public static final ArtifactKey<BusinessProfile> BUSINESS_PROFILE =
            new ArtifactKey<>("business_profile", BusinessProfile.class, StageNames.INTAKE);

    public static final ArtifactKey<BrandProfile> BRAND_PROFILE =
            new ArtifactKey<>("brand_profile", BrandProfile.class, StageNames.INTAKE);

    public static final ArtifactKey<PlatformSelection> PLATFORM_SELECTION =
            new ArtifactKey<>("platform_selection", PlatformSelection.class, StageNames.INTAKE);

    public static final ArtifactKey<StrategyFramework> STRATEGY_FRAMEWORK =
            new ArtifactKey<>("strategy_framework", StrategyFramework.class, StageNames.STRATEGY_BUILDER);

    public static final ArtifactKey<ContentCalendar> CONTENT_CALENDAR =
            new ArtifactKey<>("content_calendar", ContentCalendar.class, StageNames.CALENDAR_ASSEMBLER);

    public static final ArtifactKey<BrandVisualGuidelines> BRAND_VISUAL_GUIDELINES =
            new ArtifactKey<>("brand_visual_guidelines", BrandVisualGuidelines.class, StageNames.BRAND_VISUAL_ANALYZER);

    public static final ArtifactKey<StrategySummary> STRATEGY_SUMMARY =
            new ArtifactKey<>("strategy_summary", StrategySummary.class, StageNames.SUMMARY_ASSEMBLER);

    private static final List<ArtifactKey<ContentTypeRanking>> CONTENT_TYPES = new ArrayList<>();
    private static final List<ArtifactKey<DailyPost>> DAILY_POSTS = new ArrayList<>();
    private static final List<ArtifactKey<HashtagRecommendation>> HASHTAGS = new ArrayList<>();
    private static final List<ArtifactKey<VisualConcept>> VISUAL_CONCEPTS = new ArrayList<>();
    private static final Map<String, ArtifactKey<?>> BY_NAME;

    static {
        for (int day = 1; day <= DAYS_PER_WEEK; day++) {
            CONTENT_TYPES.add(new ArtifactKey<>("content_types_day_" + day,
                    ContentTypeRanking.class, StageNames.CONTENT_TYPE_RECOMMENDER));
            DAILY_POSTS.add(new ArtifactKey<>("day_" + day + "_post",
                    DailyPost.class, StageNames.DAILY_POST_ASSEMBLER));
            HASHTAGS.add(new ArtifactKey<>("hashtags_day_" + day,
                    HashtagRecommendation.class, StageNames.HASHTAG_RECOMMENDER));
            VISUAL_CONCEPTS.add(new ArtifactKey<>("visual_concept_day_" + day,
                    VisualConcept.class, StageNames.VISUAL_CONCEPT_GENERATOR));
        }

        Map<String, ArtifactKey<?>> byName = new LinkedHashMap<>();
        register(byName, BUSINESS_PROFILE);
        register(byName, BRAND_PROFILE);
        register(byName, PLATFORM_SELECTION);
        register(byName, STRATEGY_FRAMEWORK);
        CONTENT_TYPES.forEach(key -> register(byName, key));
        DAILY_POSTS.forEach(key -> register(byName, key));
        register(byName, CONTENT_CALENDAR);
        HASHTAGS.forEach(key -> register(byName, key));
        register(byName, BRAND_VISUAL_GUIDELINES);
        VISUAL_CONCEPTS.forEach(key -> register(byName, key));
        register(byName, STRATEGY_SUMMARY);
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private ArtifactKeys() {}

    public static ArtifactKey<ContentTypeRanking> contentTypes(int day) {
        return CONTENT_TYPES.get(checkDay(day) - 1);
    }

    public static ArtifactKey<DailyPost> dailyPost(int day) {
        return DAILY_POSTS.get(checkDay(day) - 1);
    }

    public static ArtifactKey<HashtagRecommendation> hashtags(int day) {
        return HASHTAGS.get(checkDay(day) - 1);
    }

    public static ArtifactKey<VisualConcept> visualConcept(int day) {
        return VISUAL_CONCEPTS.get(checkDay(day) - 1);
    }

    /** All keys of a run, in pipeline order. */
    public static List<ArtifactKey<?>> all() {
        return List.copyOf(BY_NAME.values());
    }

    public static Optional<ArtifactKey<?>> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    /** The three input artifacts every downstream stage depends on. */
    public static List<ArtifactKey<?>> inputs() {
        return List.of(BUSINESS_PROFILE, BRAND_PROFILE, PLATFORM_SELECTION);
    }

    public static int checkDay(int day) {
        if (day < 1 || day > DAYS_PER_WEEK) {
            throw new ValidationException("day out of range: " + day + " (expected 1-" + DAYS_PER_WEEK + ")");
        }
        return day;
    }

    private static void register(Map<String, ArtifactKey<?>> byName, ArtifactKey<?> key) {
        byName.put(key.name(), key);
    }
}
