package com.eainde.planner.summary;

import com.eainde.planner.PlanningFixtures;
import com.eainde.planner.calendar.CalendarAssembler;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.hashtag.HashtagRecommender;
import com.eainde.planner.hashtag.HashtagRequest;
import com.eainde.planner.hashtag.PlatformHashtagOptimizer;
import com.eainde.planner.model.ContentCalendar;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.StrategySummary;
import com.eainde.planner.stage.ErrorKind;
import com.eainde.planner.stage.StageResult;
import com.eainde.planner.strategy.StrategyBuilder;
import com.eainde.planner.visual.BrandVisualAnalyzer;
import com.eainde.planner.visual.VisualConceptGenerator;
import com.eainde.planner.visual.VisualConceptRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryAssemblerTest {

    private final SummaryAssembler summaryAssembler = new SummaryAssembler();

    private ContextStore store;

    @BeforeEach
    void setUp() {
        store = PlanningFixtures.storeWithInputs("LinkedIn", "Instagram");
        new StrategyBuilder().execute(store);
        new CalendarAssembler(PlanningFixtures.FIXED_CLOCK).execute(store);
    }

    @Nested
    @DisplayName("execute()")
    class Execute {

        @Test
        @DisplayName("summarizes a seven-post calendar")
        void summary() {
            StageResult<StrategySummary> result = summaryAssembler.execute(store);

            assertThat(result.isSuccess()).isTrue();
            StrategySummary summary = store.require(ArtifactKeys.STRATEGY_SUMMARY);
            assertThat(summary.calendarSummary().totalPosts()).isEqualTo(7);
            assertThat(summary.calendarSummary().placeholderPosts()).isEqualTo(7);
            assertThat(summary.calendarSummary().postingSchedule()).hasSize(7);
            assertThat(summary.strategyOverview().primaryThemes()).contains("Innovation & Trends");
            assertThat(summary.implementationGuidance().engagementStrategies())
                    .containsOnlyKeys(Platform.LINKEDIN, Platform.INSTAGRAM);
            assertThat(summary.nextSteps().immediateActions()).first().isEqualTo("Review and approve content plan");
        }

        @Test
        @DisplayName("without hashtags the overview is empty")
        void noHashtags() {
            StrategySummary summary = summaryAssembler.execute(store).data();

            assertThat(summary.hashtagOverview().daysWithRecommendations()).isEmpty();
            assertThat(summary.hashtagOverview().averageSetSize()).isZero();
        }

        @Test
        @DisplayName("hashtag recommendations are rolled up when present")
        void withHashtags() {
            HashtagRecommender recommender = new HashtagRecommender(new PlatformHashtagOptimizer());
            recommender.execute(store, new HashtagRequest(1, List.of()));
            recommender.execute(store, new HashtagRequest(3, List.of()));

            StrategySummary summary = summaryAssembler.execute(store).data();

            assertThat(summary.hashtagOverview().daysWithRecommendations()).containsExactly(1, 3);
            assertThat(summary.hashtagOverview().averageSetSize()).isGreaterThanOrEqualTo(5.0);
        }

        @Test
        @DisplayName("visual guidelines and concepts are rolled up when present")
        void withVisuals() {
            StrategySummary before = summaryAssembler.execute(store).data();
            assertThat(before.visualOverview().daysWithConcepts()).isEmpty();
            assertThat(before.visualOverview().visualPersonalityType()).isNull();

            new BrandVisualAnalyzer().execute(store);
            new VisualConceptGenerator().execute(store, new VisualConceptRequest(2, null));

            StrategySummary after = summaryAssembler.execute(store).data();

            assertThat(after.visualOverview().daysWithConcepts()).containsExactly(2);
            assertThat(after.visualOverview().visualPersonalityType()).isEqualTo("professional_authority");
            assertThat(after.visualOverview().recommendedColors()).containsExactly("Blue", "Gray", "White");
        }

        @Test
        @DisplayName("a calendar without seven posts is a ValidationError")
        void shortCalendar() {
            ContentCalendar full = store.require(ArtifactKeys.CONTENT_CALENDAR);
            ContentCalendar shortWeek = new ContentCalendar(full.overview(), full.businessContext(),
                    full.dailyPosts().subList(0, 6), full.statistics(), full.platformSummaries(),
                    full.themeAnalysis(), full.implementationGuide(), full.calendarTable());
            ContextStore broken = PlanningFixtures.storeWithInputs("LinkedIn", "Instagram");
            new StrategyBuilder().execute(broken);
            broken.set(ArtifactKeys.CONTENT_CALENDAR, shortWeek);

            StageResult<StrategySummary> result = summaryAssembler.execute(broken);

            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThat(broken.contains(ArtifactKeys.STRATEGY_SUMMARY)).isFalse();
        }

        @Test
        @DisplayName("a missing calendar is a MissingArtifact")
        void missingCalendar() {
            ContextStore noCalendar = PlanningFixtures.storeWithInputs("LinkedIn");
            new StrategyBuilder().execute(noCalendar);

            StageResult<StrategySummary> result = summaryAssembler.execute(noCalendar);

            assertThat(result.errorKind()).isEqualTo(ErrorKind.MISSING_ARTIFACT);
            assertThat(result.missingKeys()).containsExactly("content_calendar");
        }
    }

    @Nested
    @DisplayName("guidance tables")
    class Guidance {

        @Test
        @DisplayName("industry adds its success factor and creation tip")
        void industryExtras() {
            assertThat(summaryAssembler.successFactors("Healthcare")).hasSize(5)
                    .last().isEqualTo("Trust-building educational content");
            assertThat(summaryAssembler.successFactors("Bakery")).hasSize(4);
            assertThat(summaryAssembler.creationTips(PlanningFixtures.brand(), "Technology consulting"))
                    .contains("Maintain Professional voice consistently",
                            "Include relevant tech trends and innovations");
        }
    }
}
