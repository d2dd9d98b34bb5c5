package com.eainde.planner.content;

import com.eainde.planner.model.Platform;
import com.eainde.planner.model.Validation;
import com.eainde.planner.stage.ValidationException;
import lombok.Builder;

import java.io.Serializable;

/**
 * What to write for one day.
 *
 * @param day      1 = Monday .. 7 = Sunday
 * @param theme    content theme name, e.g. "Educational Content"
 * @param postType post format, e.g. "Image Post"
 */
@Builder
public record DailyPostRequest(
        int day,
        String theme,
        String postType,
        String targetAudience,
        String brandVoice,
        Platform platform
) implements Serializable {

    DailyPostRequest validated() {
        if (platform == null) {
            throw new ValidationException("Field 'platform' must not be empty");
        }
        return new DailyPostRequest(day,
                Validation.requireText("theme", theme),
                Validation.requireText("post_type", postType),
                Validation.requireText("target_audience", targetAudience),
                Validation.requireText("brand_voice", brandVoice),
                platform);
    }
}
