package com.eainde.planner.content;

import com.eainde.planner.PlanningFixtures;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.DailyPost;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.StrategyFramework;
import com.eainde.planner.stage.ErrorKind;
import com.eainde.planner.stage.StageResult;
import com.eainde.planner.strategy.StrategyBuilder;
import com.eainde.planner.thread.MdcAwareExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

class WeeklyPostPlannerTest {

    private static WeeklyPostPlanner planner(Executor executor, boolean parallel) {
        return new WeeklyPostPlanner(
                new ContentTypeRecommender(),
                new DailyPostAssembler(new RandomSourceFactory(42), PlanningFixtures.FIXED_CLOCK),
                executor,
                parallel);
    }

    /** Assembler that throws an unchecked, non-planning exception for one day. */
    private static DailyPostAssembler crashingOn(int crashDay) {
        return new DailyPostAssembler(new RandomSourceFactory(42), PlanningFixtures.FIXED_CLOCK) {
            @Override
            public DailyPost assemble(DailyPostRequest request, BusinessProfile business, BrandProfile brand,
                                      StrategyFramework framework, RandomSource random) {
                if (request.day() == crashDay) {
                    throw new IllegalStateException("template table corrupted");
                }
                return super.assemble(request, business, brand, framework, random);
            }
        };
    }

    private static ContextStore plannedStore(String... platforms) {
        ContextStore store = PlanningFixtures.storeWithInputs(platforms);
        new StrategyBuilder().execute(store);
        return store;
    }

    private static List<DailyPost> posts(ContextStore store) {
        List<DailyPost> posts = new ArrayList<>();
        for (int day = 1; day <= ArtifactKeys.DAYS_PER_WEEK; day++) {
            posts.add(store.require(ArtifactKeys.dailyPost(day)));
        }
        return posts;
    }

    @Nested
    @DisplayName("execute()")
    class Execute {

        @Test
        @DisplayName("writes a post and a content-type ranking for every day")
        void allDays() {
            ContextStore store = plannedStore("LinkedIn", "Instagram");

            StageResult<WeeklyPlan> result = planner(Runnable::run, false).execute(store);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.data().generatedDays()).containsExactly(1, 2, 3, 4, 5, 6, 7);
            assertThat(result.data().failures()).isEmpty();
            for (int day = 1; day <= 7; day++) {
                assertThat(store.contains(ArtifactKeys.contentTypes(day))).isTrue();
            }
        }

        @Test
        @DisplayName("platforms cycle through the selection in priority order")
        void platformCycle() {
            ContextStore store = plannedStore("LinkedIn", "Instagram");

            planner(Runnable::run, false).execute(store);

            assertThat(posts(store)).extracting(DailyPost::platform).containsExactly(
                    Platform.LINKEDIN, Platform.INSTAGRAM, Platform.LINKEDIN, Platform.INSTAGRAM,
                    Platform.LINKEDIN, Platform.INSTAGRAM, Platform.LINKEDIN);
        }

        @Test
        @DisplayName("parallel and sequential runs produce identical posts")
        void parallelMatchesSequential() throws Exception {
            ContextStore sequential = plannedStore("Facebook", "LinkedIn", "Instagram");
            ContextStore parallel = plannedStore("Facebook", "LinkedIn", "Instagram");

            planner(Runnable::run, false).execute(sequential);
            try (MdcAwareExecutor executor = new MdcAwareExecutor(4)) {
                planner(executor, true).execute(parallel);
            }

            assertThat(posts(parallel)).isEqualTo(posts(sequential));
        }

        @ParameterizedTest(name = "parallel={0}")
        @ValueSource(booleans = {false, true})
        @DisplayName("a day that throws is left empty while the other days are written")
        void crashingDayLeftForPlaceholder(boolean parallel) throws Exception {
            ContextStore store = plannedStore("LinkedIn", "Instagram");

            StageResult<WeeklyPlan> result;
            try (MdcAwareExecutor executor = new MdcAwareExecutor(4)) {
                result = new WeeklyPostPlanner(new ContentTypeRecommender(), crashingOn(3), executor, parallel)
                        .execute(store);
            }

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.data().generatedDays()).containsExactly(1, 2, 4, 5, 6, 7);
            assertThat(result.data().failures()).containsOnlyKeys(3);
            assertThat(result.data().failures().get(3)).contains("template table corrupted");
            assertThat(store.contains(ArtifactKeys.dailyPost(3))).isFalse();
            assertThat(store.contains(ArtifactKeys.dailyPost(4))).isTrue();
        }

        @Test
        @DisplayName("a missing strategy closes the gate")
        void missingStrategy() {
            StageResult<WeeklyPlan> result = planner(Runnable::run, false)
                    .execute(PlanningFixtures.storeWithInputs("LinkedIn"));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.MISSING_ARTIFACT);
        }
    }

    @Nested
    @DisplayName("choosePostType()")
    class ChoosePostType {

        @Test
        @DisplayName("matches a recommendation against the allowed types, plural tolerant")
        void pluralMatch() {
            assertThat(WeeklyPostPlanner.choosePostType(
                    List.of("Polls", "Articles"), List.of("Article", "Poll"), 1)).isEqualTo("Poll");
        }

        @Test
        @DisplayName("falls back to the allowed types cycled by day")
        void fallback() {
            List<String> allowed = List.of("Feed Post", "IGTV", "Carousel");

            assertThat(WeeklyPostPlanner.choosePostType(List.of("Case Studies"), allowed, 1)).isEqualTo("Feed Post");
            assertThat(WeeklyPostPlanner.choosePostType(List.of(), allowed, 5)).isEqualTo("IGTV");
        }
    }
}
