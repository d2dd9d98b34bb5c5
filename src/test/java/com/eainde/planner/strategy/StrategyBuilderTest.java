package com.eainde.planner.strategy;

import com.eainde.planner.PlanningFixtures;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.DayPlan;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.StrategyFramework;
import com.eainde.planner.model.Theme;
import com.eainde.planner.stage.StageResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StrategyBuilderTest {

    private final StrategyBuilder builder = new StrategyBuilder();

    private StrategyFramework build(String industry, String voice, String... platforms) {
        BusinessProfile base = PlanningFixtures.business();
        BusinessProfile business = BusinessProfile.of(industry, base.targetAudience(),
                base.businessGoals(), base.currentChallenges());
        BrandProfile brand = BrandProfile.of(voice, "Warm", "Care", "Kind");
        return builder.build(business, brand, PlanningFixtures.selection(platforms));
    }

    @Nested
    @DisplayName("framework shape")
    class Shape {

        @Test
        @DisplayName("content mix sums to 100")
        void contentMixSums() {
            StrategyFramework framework = build("Retail", "Playful", "Instagram");

            assertThat(framework.contentMixTotal()).isEqualTo(100);
            assertThat(framework.contentMix()).containsEntry("educational", 40);
        }

        @Test
        @DisplayName("weekly structure covers Monday to Sunday in order with cycled themes")
        void weeklyStructure() {
            StrategyFramework framework = build("Retail", "Playful", "Instagram");

            assertThat(framework.weeklyStructure().keySet()).containsExactly(
                    "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday");
            DayPlan monday = framework.weeklyStructure().get("Monday");
            DayPlan thursday = framework.weeklyStructure().get("Thursday");
            assertThat(monday.theme()).isEqualTo("Educational Content");
            assertThat(monday.focusArea()).isEqualTo("engagement");
            assertThat(thursday.theme()).isEqualTo(monday.theme());
            assertThat(thursday.focusArea()).isEqualTo("engagement");
        }

        @Test
        @DisplayName("stage writes strategy_framework once the inputs exist")
        void writesArtifact() {
            ContextStore store = PlanningFixtures.storeWithInputs("LinkedIn", "Facebook");

            StageResult<StrategyFramework> result = builder.execute(store);

            assertThat(result.isSuccess()).isTrue();
            assertThat(store.require(ArtifactKeys.STRATEGY_FRAMEWORK)).isEqualTo(result.data());
            assertThat(result.data().platformGuidance()).containsOnlyKeys(Platform.LINKEDIN, Platform.FACEBOOK);
        }
    }

    @Nested
    @DisplayName("themes")
    class Themes {

        @Test
        @DisplayName("a known sector adds its industry theme")
        void industryTheme() {
            StrategyFramework framework = build("Healthcare clinic", "Caring", "Facebook");

            assertThat(framework.themes()).extracting(Theme::name).containsExactly(
                    "Educational Content", "Behind-the-Scenes", "Problem-Solution", "Health & Wellness");
        }

        @Test
        @DisplayName("other industries keep the three universal themes")
        void universalOnly() {
            StrategyFramework framework = build("Bakery", "Caring", "Facebook");

            assertThat(framework.themes()).hasSize(3);
            assertThat(framework.themes()).hasSizeLessThanOrEqualTo(StrategyBuilder.MAX_THEMES);
        }
    }

    @Nested
    @DisplayName("post types")
    class PostTypes {

        @Test
        @DisplayName("a professional voice drops Story, Reel and Live")
        void professionalVoice() {
            StrategyFramework framework = build("Bakery", "Professional and formal", "Instagram");

            assertThat(framework.postTypesFor(Platform.INSTAGRAM))
                    .containsExactly("Feed Post", "IGTV", "Carousel");
        }

        @Test
        @DisplayName("a casual voice keeps every type")
        void casualVoice() {
            StrategyFramework framework = build("Bakery", "Playful", "Instagram");

            assertThat(framework.postTypesFor(Platform.INSTAGRAM)).contains("Story", "Reel", "Live");
        }
    }

    @Nested
    @DisplayName("goal analysis")
    class Goals {

        @Test
        @DisplayName("goals are classified in table order and drive the success metrics")
        void goalsAndMetrics() {
            StrategyFramework framework = build("Bakery", "Playful", "Facebook");

            assertThat(framework.goalsAnalysis().contentPriorities())
                    .containsExactly("brand_awareness", "lead_generation");
            assertThat(framework.successMetrics()).containsExactly(
                    "engagement_rate", "reach", "impressions", "lead_generation", "brand_mention_increase");
            assertThat(framework.challengesAnalysis().contentSolutions())
                    .containsExactly("interactive_content", "diverse_content_types");
        }
    }
}
