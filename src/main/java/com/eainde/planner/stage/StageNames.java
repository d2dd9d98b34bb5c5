package com.eainde.planner.stage;

/**
 * Names of the planning stages. Each name is also the owner recorded on the
 * artifact keys the stage is allowed to write.
 *
 * <pre>
 * intake               → business_profile, brand_profile, platform_selection
 * strategy-builder     → strategy_framework
 * content-type-recommender → content_types_day_N
 * daily-post-assembler → day_N_post
 * calendar-assembler   → content_calendar
 * hashtag-recommender  → hashtags_day_N
 * brand-visual-analyzer → brand_visual_guidelines
 * visual-concept-generator → visual_concept_day_N
 * summary-assembler    → strategy_summary
 * </pre>
 */
public final class StageNames {

    private StageNames() {}

    public static final String INTAKE = "intake";

    public static final String STRATEGY_BUILDER = "strategy-builder";

    public static final String CONTENT_TYPE_RECOMMENDER = "content-type-recommender";

    public static final String DAILY_POST_ASSEMBLER = "daily-post-assembler";

    /** Not a stage of its own: fans out the two per-day stages. */
    public static final String WEEKLY_POST_PLANNER = "weekly-post-planner";

    public static final String CALENDAR_ASSEMBLER = "calendar-assembler";

    public static final String HASHTAG_RECOMMENDER = "hashtag-recommender";

    /** Pure stage, owns no artifact. */
    public static final String PLATFORM_HASHTAG_OPTIMIZER = "platform-hashtag-optimizer";

    public static final String BRAND_VISUAL_ANALYZER = "brand-visual-analyzer";

    public static final String VISUAL_CONCEPT_GENERATOR = "visual-concept-generator";

    public static final String SUMMARY_ASSEMBLER = "summary-assembler";
}
