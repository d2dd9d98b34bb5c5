package com.eainde.planner.intake;

import com.eainde.planner.PlanningFixtures;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.PlatformSelection;
import com.eainde.planner.stage.ErrorKind;
import com.eainde.planner.stage.StageResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntakeStageTest {

    private final IntakeStage intake = new IntakeStage();

    @Test
    @DisplayName("writes trimmed business, brand and platform artifacts")
    void writesInputs() {
        ContextStore store = new ContextStore();

        StageResult<PlanningInputs> result = intake.execute(store,
                PlanningFixtures.request().industry("  Healthcare  ").build());

        assertThat(result.isSuccess()).isTrue();
        assertThat(store.require(ArtifactKeys.BUSINESS_PROFILE).industry()).isEqualTo("Healthcare");
        assertThat(store.require(ArtifactKeys.PLATFORM_SELECTION).platforms())
                .containsExactly(Platform.LINKEDIN, Platform.INSTAGRAM, Platform.FACEBOOK);
        assertThat(store.require(ArtifactKeys.PLATFORM_SELECTION).priorities())
                .isEqualTo(PlatformSelection.EQUAL_FOCUS);
    }

    @Test
    @DisplayName("a blank field is a ValidationError and nothing is written")
    void blankField() {
        ContextStore store = new ContextStore();

        StageResult<PlanningInputs> result = intake.execute(store,
                PlanningFixtures.request().brandVoice("   ").build());

        assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(result.message()).contains("voice");
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("an unknown platform is rejected with the valid options")
    void unknownPlatform() {
        StageResult<PlanningInputs> result = intake.execute(new ContextStore(),
                PlanningFixtures.request().clearPlatforms().platform("TikTok").build());

        assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(result.message()).contains("TikTok", "Facebook, Instagram, LinkedIn");
    }

    @Test
    @DisplayName("an empty selection is rejected")
    void noPlatforms() {
        StageResult<PlanningInputs> result = intake.execute(new ContextStore(),
                PlanningFixtures.request().clearPlatforms().build());

        assertThat(result.errorKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("duplicate platforms collapse onto the first occurrence")
    void duplicates() {
        ContextStore store = new ContextStore();

        intake.execute(store, PlanningFixtures.request().clearPlatforms()
                .platform("instagram").platform("LinkedIn").platform("Instagram").build());

        assertThat(store.require(ArtifactKeys.PLATFORM_SELECTION).platforms())
                .containsExactly(Platform.INSTAGRAM, Platform.LINKEDIN);
    }
}
