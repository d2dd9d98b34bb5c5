package com.eainde.planner.context;

import com.eainde.planner.PlanningFixtures;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.stage.MissingArtifactException;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextStoreTest {

    @Nested
    @DisplayName("commit()")
    class Commit {

        @Test
        @DisplayName("stores artifacts written by their owner")
        void ownerWrites() {
            ContextStore store = new ContextStore();
            BusinessProfile business = PlanningFixtures.business();

            store.commit(StageNames.INTAKE, Map.of(ArtifactKeys.BUSINESS_PROFILE, business));

            assertThat(store.get(ArtifactKeys.BUSINESS_PROFILE)).contains(business);
        }

        @Test
        @DisplayName("rejects a key owned by another stage and writes nothing")
        void foreignKeyRejected() {
            ContextStore store = new ContextStore();
            Map<ArtifactKey<?>, Object> writes = new LinkedHashMap<>();
            writes.put(ArtifactKeys.BUSINESS_PROFILE, PlanningFixtures.business());
            writes.put(ArtifactKeys.BRAND_PROFILE, PlanningFixtures.brand());

            assertThatThrownBy(() -> store.commit(StageNames.STRATEGY_BUILDER, writes))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("business_profile");
            assertThat(store.size()).isZero();
        }
    }

    @Nested
    @DisplayName("require()")
    class Require {

        @Test
        @DisplayName("throws MissingArtifactException naming the key")
        void missing() {
            ContextStore store = new ContextStore();

            assertThatThrownBy(() -> store.require(ArtifactKeys.STRATEGY_FRAMEWORK))
                    .isInstanceOf(MissingArtifactException.class)
                    .satisfies(e -> assertThat(((MissingArtifactException) e).getMissingKeys())
                            .containsExactly("strategy_framework"));
        }
    }

    @Nested
    @DisplayName("snapshots")
    class Snapshots {

        @Test
        @DisplayName("snapshot lists artifacts in pipeline order")
        void pipelineOrder() {
            ContextStore store = new ContextStore();
            store.set(ArtifactKeys.PLATFORM_SELECTION, PlanningFixtures.selection("LinkedIn"));
            store.set(ArtifactKeys.BUSINESS_PROFILE, PlanningFixtures.business());

            assertThat(store.snapshot().keySet()).containsExactly("business_profile", "platform_selection");
        }

        @Test
        @DisplayName("fromSnapshot ignores unknown keys and values of the wrong type")
        void fromSnapshotFilters() {
            Map<String, Object> snapshot = new LinkedHashMap<>();
            snapshot.put("business_profile", PlanningFixtures.business());
            snapshot.put("brand_profile", "not a brand");
            snapshot.put("last_stage", "intake");

            ContextStore store = ContextStore.fromSnapshot(snapshot);

            assertThat(store.keys()).containsExactly("business_profile");
            assertThat(store.writtenSinceCreation()).isEmpty();
        }

        @Test
        @DisplayName("writtenSinceCreation only reports new writes")
        void writtenSinceCreation() {
            ContextStore store = ContextStore.fromSnapshot(Map.of("business_profile", PlanningFixtures.business()));
            store.set(ArtifactKeys.BRAND_PROFILE, PlanningFixtures.brand());

            assertThat(store.writtenSinceCreation().keySet()).containsExactly("brand_profile");
        }
    }

    @Nested
    @DisplayName("StageGate")
    class Gate {

        @Test
        @DisplayName("reports missing keys in the order they were required")
        void missingInOrder() {
            ContextStore store = new ContextStore();
            store.set(ArtifactKeys.BRAND_PROFILE, PlanningFixtures.brand());

            GateDecision decision = StageGate.check(store, List.of(
                    ArtifactKeys.STRATEGY_FRAMEWORK, ArtifactKeys.BRAND_PROFILE, ArtifactKeys.BUSINESS_PROFILE));

            assertThat(decision.open()).isFalse();
            assertThat(decision.missing()).containsExactly("strategy_framework", "business_profile");
        }

        @Test
        @DisplayName("opens when every key is present")
        void open() {
            ContextStore store = PlanningFixtures.storeWithInputs("LinkedIn");

            assertThat(StageGate.check(store, ArtifactKeys.inputs()).open()).isTrue();
        }
    }

    @Nested
    @DisplayName("ArtifactKeys")
    class Keys {

        @Test
        @DisplayName("day-scoped keys exist only for days 1 to 7")
        void dayRange() {
            assertThat(ArtifactKeys.dailyPost(7).name()).isEqualTo("day_7_post");
            assertThat(ArtifactKeys.hashtags(1).name()).isEqualTo("hashtags_day_1");
            assertThat(ArtifactKeys.visualConcept(2).name()).isEqualTo("visual_concept_day_2");
            assertThatThrownBy(() -> ArtifactKeys.dailyPost(8)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> ArtifactKeys.contentTypes(0)).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("every key has a known owner")
        void owners() {
            assertThat(ArtifactKeys.all()).hasSize(7 + 4 * ArtifactKeys.DAYS_PER_WEEK);
            assertThat(ArtifactKeys.contentTypes(3).owner()).isEqualTo(StageNames.CONTENT_TYPE_RECOMMENDER);
            assertThat(ArtifactKeys.BRAND_VISUAL_GUIDELINES.owner()).isEqualTo(StageNames.BRAND_VISUAL_ANALYZER);
            assertThat(ArtifactKeys.visualConcept(5).owner()).isEqualTo(StageNames.VISUAL_CONCEPT_GENERATOR);
        }
    }
}
