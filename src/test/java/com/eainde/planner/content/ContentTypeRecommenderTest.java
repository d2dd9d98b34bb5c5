package com.eainde.planner.content;

import com.eainde.planner.PlanningFixtures;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.ContentTypeRanking;
import com.eainde.planner.model.ContentTypeRecommendation;
import com.eainde.planner.model.Platform;
import com.eainde.planner.stage.ErrorKind;
import com.eainde.planner.stage.StageResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentTypeRecommenderTest {

    private final ContentTypeRecommender recommender = new ContentTypeRecommender();

    @Nested
    @DisplayName("rankCandidates()")
    class Ranking {

        @Test
        @DisplayName("a type listed in three pools outranks a type listed in one")
        void videoAbovePolls() {
            List<List<String>> pools = List.of(
                    List.of("Video", "Articles"),
                    List.of("Video", "Polls"),
                    List.of("Video"),
                    List.of("Case Studies"));

            List<ContentTypeRecommendation> ranked = recommender.rankCandidates(pools, Platform.LINKEDIN, "Monday");

            assertThat(ranked.get(0).contentType()).isEqualTo("Video");
            assertThat(ranked.get(0).confidenceScore()).isEqualTo(3);
            List<String> order = ranked.stream().map(ContentTypeRecommendation::contentType).toList();
            assertThat(order.indexOf("Video")).isLessThan(order.indexOf("Polls"));
        }

        @Test
        @DisplayName("ties keep first-seen order and only the top five are returned")
        void stableTopFive() {
            List<List<String>> pools = List.of(List.of("A", "B", "C", "D", "E", "F", "G"));

            List<ContentTypeRecommendation> ranked = recommender.rankCandidates(pools, Platform.FACEBOOK, "Friday");

            assertThat(ranked).extracting(ContentTypeRecommendation::contentType)
                    .containsExactly("A", "B", "C", "D", "E");
        }

        @Test
        @DisplayName("a duplicate inside one pool scores once")
        void duplicateWithinPool() {
            List<ContentTypeRecommendation> ranked = recommender.rankCandidates(
                    List.of(List.of("Reels", "Reels"), List.of("Stories")), Platform.INSTAGRAM, "Sunday");

            assertThat(ranked.get(0).confidenceScore()).isEqualTo(1);
        }

        @Test
        @DisplayName("unknown types get default annotations")
        void defaultAnnotations() {
            ContentTypeRecommendation only = recommender.rankCandidates(
                    List.of(List.of("Memes")), Platform.FACEBOOK, "Saturday").get(0);

            assertThat(only.rationale()).isEqualTo(ContentTypeRecommender.DEFAULT_RATIONALE);
            assertThat(only.optimalTiming()).isEqualTo("Optimal for Facebook on Saturday");
            assertThat(only.engagementPotential()).isEqualTo(ContentTypeRecommender.DEFAULT_ENGAGEMENT);
        }
    }

    @Nested
    @DisplayName("recommend()")
    class Recommend {

        @Test
        @DisplayName("Video leads for a LinkedIn brand-awareness audience")
        void linkedInAwareness() {
            ContentTypeRanking ranking = recommender.recommend(new ContentTypeRequest(
                    2, Platform.LINKEDIN, "Software", "Grow brand awareness", "Young professionals"));

            assertThat(ranking.contentTypes()).hasSizeLessThanOrEqualTo(ContentTypeRecommender.TOP_N);
            assertThat(ranking.contentTypes().get(0)).isEqualTo("Video");
        }

        @Test
        @DisplayName("unmatched goals fall back to educational preferences")
        void defaultGoals() {
            assertThat(recommender.goalPreferences("Keep customers happy"))
                    .containsExactly("Educational Content", "Industry Insights");
        }

        @Test
        @DisplayName("stage writes content_types_day_N")
        void writesKey() {
            ContextStore store = new ContextStore();

            StageResult<ContentTypeRanking> result = recommender.execute(store,
                    ContentTypeRequest.forDay(4, Platform.FACEBOOK, PlanningFixtures.business()));

            assertThat(result.isSuccess()).isTrue();
            assertThat(store.get(ArtifactKeys.contentTypes(4))).contains(result.data());
        }

        @Test
        @DisplayName("a day outside 1 to 7 is a ValidationError")
        void badDay() {
            StageResult<ContentTypeRanking> result = recommender.execute(new ContextStore(),
                    ContentTypeRequest.forDay(9, Platform.FACEBOOK, PlanningFixtures.business()));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        }

        @Test
        @DisplayName("a missing platform is a ValidationError and writes nothing")
        void missingPlatform() {
            ContextStore store = new ContextStore();

            StageResult<ContentTypeRanking> result = recommender.execute(store,
                    ContentTypeRequest.forDay(2, null, PlanningFixtures.business()));

            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThat(result.message()).isEqualTo("Field 'platform' must not be empty");
            assertThat(store.contains(ArtifactKeys.contentTypes(2))).isFalse();
        }
    }
}
