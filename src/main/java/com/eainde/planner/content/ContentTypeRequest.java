package com.eainde.planner.content;

import com.eainde.planner.model.BusinessProfile;
import com.eainde.planner.model.Platform;
import com.eainde.planner.model.Validation;
import com.eainde.planner.stage.ValidationException;

import java.io.Serializable;

/**
 * Inputs for ranking the content types of one day.
 */
public record ContentTypeRequest(
        int day,
        Platform platform,
        String industry,
        String businessGoals,
        String targetAudience
) implements Serializable {

    public static ContentTypeRequest forDay(int day, Platform platform, BusinessProfile business) {
        return new ContentTypeRequest(day, platform,
                business.industry(), business.businessGoals(), business.targetAudience());
    }

    /** Checks the text fields; the day is checked against the key set by the caller. */
    ContentTypeRequest validated() {
        if (platform == null) {
            throw new ValidationException("Field 'platform' must not be empty");
        }
        return new ContentTypeRequest(day, platform,
                Validation.requireText("industry", industry),
                Validation.requireText("business_goals", businessGoals),
                Validation.requireText("target_audience", targetAudience));
    }
}
