package com.eainde.planner.model;

import com.eainde.planner.stage.ValidationException;

/**
 * Shared input checks for raw caller strings.
 */
public final class Validation {

    private Validation() {}

    /**
     * @return the trimmed value
     * @throws ValidationException when the value is null or blank
     */
    public static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Field '" + field + "' must not be empty");
        }
        return value.trim();
    }
}
