package com.eainde.planner.stage;

import com.eainde.planner.PlanningFixtures;
import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.StrategyFramework;
import com.eainde.planner.strategy.StrategyBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractPlanningStageTest {

    /** Writes a key it does not own. */
    static class RogueStage extends AbstractPlanningStage<Void, String> {

        @Override
        public String name() {
            return "rogue";
        }

        @Override
        protected List<ArtifactKey<?>> requiredKeys(Void input) {
            return List.of();
        }

        @Override
        protected StageOutput<String> process(ContextStore store, Void input) {
            return StageOutput.of("done", "done")
                    .plus(ArtifactKeys.BRAND_PROFILE, PlanningFixtures.brand());
        }
    }

    /** Fails validation after the gate opened. */
    static class RejectingStage extends AbstractPlanningStage<Void, String> {

        @Override
        public String name() {
            return StageNames.STRATEGY_BUILDER;
        }

        @Override
        protected List<ArtifactKey<?>> requiredKeys(Void input) {
            return ArtifactKeys.inputs();
        }

        @Override
        protected StageOutput<String> process(ContextStore store, Void input) {
            throw new ValidationException("Field 'industry' must not be empty");
        }
    }

    @Nested
    @DisplayName("closed gate")
    class ClosedGate {

        @Test
        @DisplayName("returns MissingArtifact listing every absent key and leaves the store untouched")
        void missingArtifact() {
            ContextStore store = new ContextStore();
            store.set(ArtifactKeys.BRAND_PROFILE, PlanningFixtures.brand());

            StageResult<StrategyFramework> result = new StrategyBuilder().execute(store);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.errorKind()).isEqualTo(ErrorKind.MISSING_ARTIFACT);
            assertThat(result.missingKeys()).containsExactly("business_profile", "platform_selection");
            assertThat(result.data()).isNull();
            assertThat(store.keys()).containsExactly("brand_profile");
        }
    }

    @Nested
    @DisplayName("failing process()")
    class FailingProcess {

        @Test
        @DisplayName("converts ValidationException into a ValidationError result without writes")
        void validationError() {
            ContextStore store = PlanningFixtures.storeWithInputs("LinkedIn");

            StageResult<String> result = new RejectingStage().execute(store);

            assertThat(result.status()).isEqualTo(ResultStatus.ERROR);
            assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThat(result.message()).contains("industry");
            assertThat(store.contains(ArtifactKeys.STRATEGY_FRAMEWORK)).isFalse();
        }
    }

    @Nested
    @DisplayName("ownership")
    class Ownership {

        @Test
        @DisplayName("a stage cannot commit a key it does not own")
        void foreignWrite() {
            ContextStore store = new ContextStore();

            assertThatThrownBy(() -> new RogueStage().execute(store))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("rogue");
            assertThat(store.size()).isZero();
        }
    }

    @Nested
    @DisplayName("StageResult")
    class Results {

        @Test
        @DisplayName("propagate() re-types an error and refuses a success")
        void propagate() {
            StageResult<String> error = StageResult.validationError("x", "bad");
            StageResult<Integer> retyped = error.propagate();

            assertThat(retyped.message()).isEqualTo("bad");
            assertThat(retyped.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
            assertThatThrownBy(() -> StageResult.success("x", "ok", 1).propagate())
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
