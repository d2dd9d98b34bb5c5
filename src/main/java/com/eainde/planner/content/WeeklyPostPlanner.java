package com.eainde.planner.content;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.ContentTypeRanking;
import com.eainde.planner.model.DailyPost;
import com.eainde.planner.model.DayPlan;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.PlatformSelection;
import com.eainde.planner.model.StrategyFramework;
import com.eainde.planner.model.Weekdays;
import com.eainde.planner.stage.AbstractPlanningStage;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.StageOutput;
import com.eainde.planner.stage.StageResult;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs {@link ContentTypeRecommender} and {@link DailyPostAssembler} for days 1..7.
 *
 * <h3>Per day:</h3>
 * <ul>
 *   <li>theme from the weekly structure</li>
 *   <li>platform: the selection in priority order, cycled by day</li>
 *   <li>post type: first recommended content type the platform allows, otherwise the
 *       allowed types cycled by day</li>
 * </ul>
 *
 * <p>Days only read shared artifacts and write their own keys, so they may run on the day
 * executor. This stage returns once every day finished. A failed day, whether it returned
 * an error result or threw, is logged and left empty; the calendar fills it with a
 * placeholder.</p>
 *
 * <p>Owns no artifact: the per-day stages commit their own keys.</p>
 */
@Log4j2
@Component
public class WeeklyPostPlanner extends AbstractPlanningStage<Void, WeeklyPlan> {

    private static final List<ArtifactKey<?>> REQUIRED = List.of(
            ArtifactKeys.STRATEGY_FRAMEWORK,
            ArtifactKeys.BUSINESS_PROFILE,
            ArtifactKeys.BRAND_PROFILE,
            ArtifactKeys.PLATFORM_SELECTION);

    private final ContentTypeRecommender recommender;
    private final DailyPostAssembler assembler;
    private final Executor dayExecutor;
    private final boolean parallel;

    public WeeklyPostPlanner(ContentTypeRecommender recommender,
                             DailyPostAssembler assembler,
                             @Qualifier("dayExecutor") Executor dayExecutor,
                             @Value("${planner.parallel-days:true}") boolean parallel) {
        this.recommender = recommender;
        this.assembler = assembler;
        this.dayExecutor = dayExecutor;
        this.parallel = parallel;
    }

    @Override
    public String name() {
        return StageNames.WEEKLY_POST_PLANNER;
    }

    @Override
    protected List<ArtifactKey<?>> requiredKeys(Void input) {
        return REQUIRED;
    }

    @Override
    protected StageOutput<WeeklyPlan> process(ContextStore store, Void input) {
        StrategyFramework framework = store.require(ArtifactKeys.STRATEGY_FRAMEWORK);
        BusinessProfile business = store.require(ArtifactKeys.BUSINESS_PROFILE);
        BrandProfile brand = store.require(ArtifactKeys.BRAND_PROFILE);
        PlatformSelection selection = store.require(ArtifactKeys.PLATFORM_SELECTION);

        // inline executor keeps the sequential mode on the caller's thread
        Executor executor = parallel ? dayExecutor : Runnable::run;
        List<CompletableFuture<StageResult<DailyPost>>> days = new ArrayList<>();
        for (int day = 1; day <= ArtifactKeys.DAYS_PER_WEEK; day++) {
            final int current = day;
            days.add(CompletableFuture.supplyAsync(
                    () -> planDay(store, current, framework, business, brand, selection), executor));
        }

        // barrier: the calendar reads all seven keys afterwards
        List<Integer> generated = new ArrayList<>();
        Map<Integer, String> failures = new TreeMap<>();
        for (int i = 0; i < days.size(); i++) {
            int day = i + 1;
            try {
                StageResult<DailyPost> result = days.get(i).join();
                if (result.isSuccess()) {
                    generated.add(day);
                } else {
                    failures.put(day, result.message());
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.error("Day {} failed unexpectedly, leaving it for a placeholder", day, cause);
                failures.put(day, "Unexpected failure: " + cause);
            }
        }

        WeeklyPlan plan = new WeeklyPlan(generated, failures);
        String message = generated.size() + " of " + ArtifactKeys.DAYS_PER_WEEK + " posts generated"
                + (failures.isEmpty() ? "" : ", days " + failures.keySet() + " left for placeholders");
        return StageOutput.of(plan, message);
    }

    StageResult<DailyPost> planDay(ContextStore store, int day, StrategyFramework framework,
                                   BusinessProfile business, BrandProfile brand, PlatformSelection selection) {
        String dayName = Weekdays.nameOf(day);
        Platform platform = selection.platformForDay(day);
        DayPlan plan = framework.dayPlan(dayName).orElse(null);
        if (plan == null) {
            log.warn("No weekly structure entry for {}, leaving day {} empty", dayName, day);
            return StageResult.validationError(assembler.name(), "No theme planned for " + dayName);
        }

        StageResult<ContentTypeRanking> ranking =
                recommender.execute(store, ContentTypeRequest.forDay(day, platform, business));
        List<String> recommended = ranking.dataOptional()
                .map(ContentTypeRanking::contentTypes)
                .orElse(List.of());

        DailyPostRequest request = DailyPostRequest.builder()
                .day(day)
                .theme(plan.theme())
                .postType(choosePostType(recommended, framework.postTypesFor(platform), day))
                .targetAudience(business.targetAudience())
                .brandVoice(brand.voice())
                .platform(platform)
                .build();

        StageResult<DailyPost> result = assembler.execute(store, request);
        if (!result.isSuccess()) {
            log.warn("Day {} produced no post: {}", day, result.message());
        }
        return result;
    }

    /**
     * First recommended type matching an allowed post type (case-insensitive, plural
     * tolerant, either containing the other); otherwise the allowed types cycled by day.
     */
    static String choosePostType(List<String> recommended, List<String> allowed, int day) {
        if (allowed.isEmpty()) {
            return recommended.isEmpty() ? "Image Post" : recommended.get(0);
        }
        for (String candidate : recommended) {
            String wanted = singular(candidate);
            for (String type : allowed) {
                String offered = singular(type);
                if (offered.contains(wanted) || wanted.contains(offered)) {
                    return type;
                }
            }
        }
        return allowed.get((day - 1) % allowed.size());
    }

    private static String singular(String text) {
        String lowered = text.toLowerCase(Locale.ROOT).trim();
        return lowered.endsWith("s") ? lowered.substring(0, lowered.length() - 1) : lowered;
    }
}
