package com.eainde.planner.intake;

import com.eainde.planner.context.ArtifactKey;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.model.BrandProfile;
import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.PlanningRequest;
import com.eainde.planner.model.PlatformSelection;
import com.eainde.planner.stage.AbstractPlanningStage;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.StageOutput;
import com.eainde.planner.stage.ValidationException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Validates the raw request into the business, brand and platform artifacts.
 * Every string field must be non-empty after trimming; at least one known platform
 * must be selected.
 */
@Log4j2
@Component
public class IntakeStage extends AbstractPlanningStage<PlanningRequest, PlanningInputs> {

    @Override
    public String name() {
        return StageNames.INTAKE;
    }

    @Override
    protected List<ArtifactKey<?>> requiredKeys(PlanningRequest request) {
        return List.of();
    }

    @Override
    protected StageOutput<PlanningInputs> process(ContextStore store, PlanningRequest request) {
        if (request == null) {
            throw new ValidationException("Planning request is required");
        }

        BusinessProfile business = BusinessProfile.of(
                request.getIndustry(),
                request.getTargetAudience(),
                request.getBusinessGoals(),
                request.getCurrentChallenges());

        BrandProfile brand = BrandProfile.of(
                request.getBrandVoice(),
                request.getBrandTone(),
                request.getCoreValues(),
                request.getPersonalityAdjectives());

        PlatformSelection platforms = PlatformSelection.of(request.getPlatforms(), request.getPlatformPriorities());

        log.debug("Intake accepted industry='{}' platforms={}", business.industry(), platforms.platforms());

        PlanningInputs inputs = new PlanningInputs(business, brand, platforms);
        return StageOutput.of(inputs, "Collected business, brand and platform inputs")
                .plus(ArtifactKeys.BUSINESS_PROFILE, business)
                .plus(ArtifactKeys.BRAND_PROFILE, brand)
                .plus(ArtifactKeys.PLATFORM_SELECTION, platforms);
    }
}
