package com.eainde.planner.content;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BrandAlignment;
import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.DailyPost;
import com.eainde.planner.model.DayPlan;
import com.eainde.planner.model.PlatformSelection;
import com.eainde.planner.model.StrategyFramework;
import com.eainde.planner.model.Weekdays;
import com.eainde.planner.stage.AbstractPlanningStage;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.StageOutput;
import com.eainde.planner.stage.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Writes the post of one day.
 *
 * <p>Title, hook and call to action are drawn, in that order, from the day's
 * {@link RandomSource}; timestamps come from the injected {@link Clock}. With a fixed
 * seed and clock the post is reproducible exactly.</p>
 */
@Log4j2
@Component
@RequiredArgsConstructor
public class DailyPostAssembler extends AbstractPlanningStage<DailyPostRequest, DailyPost> {

    private static final List<ArtifactKey<?>> REQUIRED = List.of(
            ArtifactKeys.STRATEGY_FRAMEWORK,
            ArtifactKeys.BUSINESS_PROFILE,
            ArtifactKeys.BRAND_PROFILE,
            ArtifactKeys.PLATFORM_SELECTION);

    private final RandomSourceFactory randomSources;
    private final Clock clock;

    @Override
    public String name() {
        return StageNames.DAILY_POST_ASSEMBLER;
    }

    @Override
    protected List<ArtifactKey<?>> requiredKeys(DailyPostRequest request) {
        if (request == null) {
            throw new ValidationException("Daily post request is required");
        }
        ArtifactKeys.checkDay(request.day());
        return REQUIRED;
    }

    @Override
    protected StageOutput<DailyPost> process(ContextStore store, DailyPostRequest request) {
        DailyPostRequest checked = request.validated();
        PlatformSelection selection = store.require(ArtifactKeys.PLATFORM_SELECTION);
        if (!selection.includes(checked.platform())) {
            throw new ValidationException("Platform " + checked.platform()
                    + " is not among the selected platforms " + selection.platforms());
        }

        DailyPost post = assemble(checked,
                store.require(ArtifactKeys.BUSINESS_PROFILE),
                store.require(ArtifactKeys.BRAND_PROFILE),
                store.require(ArtifactKeys.STRATEGY_FRAMEWORK),
                randomSources.forDay(checked.day()));

        return StageOutput.writing(ArtifactKeys.dailyPost(checked.day()), post,
                "Post generated for day " + checked.day() + " (" + post.platform() + ", " + post.postType() + ")");
    }

    /** Builds the post without touching the store. */
    public DailyPost assemble(DailyPostRequest request, BusinessProfile business, BrandProfile brand,
                              StrategyFramework framework, RandomSource random) {
        String dayName = Weekdays.nameOf(request.day());
        String dayFocus = framework.dayPlan(dayName).map(DayPlan::focusArea).orElse(null);
        String theme = request.theme();

        String title = random.pick(PostTemplates.titles(
                request.platform(), theme, request.targetAudience(), request.brandVoice()));
        String hook = random.pick(PostTemplates.hooks(theme));
        String callToAction = random.pick(PostTemplates.callsToAction(request.platform()));

        String caption = PostTemplates.formatCaption(
                String.join("\n\n", hook, PostTemplates.body(theme, business, brand), callToAction),
                request.platform());

        log.debug("Day {} ({}) title='{}'", request.day(), dayName, title);

        return new DailyPost(
                request.day(),
                dayName,
                request.platform(),
                PostTemplates.goalFor(theme, dayFocus),
                request.postType(),
                title,
                caption,
                theme,
                PostTemplates.optimizationFor(request.platform()),
                BrandAlignment.of(brand),
                request.targetAudience(),
                Instant.now(clock));
    }
}
