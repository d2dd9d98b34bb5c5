package com.eainde.planner.model;

import com.eainde.planner.stage.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The three supported social platforms.
 */
public enum Platform {
    FACEBOOK("Facebook"),
    INSTAGRAM("Instagram"),
    LINKEDIN("LinkedIn");

    private final String label;

    Platform(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Parses a platform label, case-insensitively.
     *
     * @throws ValidationException for anything but Facebook, Instagram or LinkedIn
     */
    @JsonCreator
    public static Platform fromLabel(String label) {
        if (label != null) {
            String trimmed = label.trim();
            for (Platform platform : values()) {
                if (platform.label.equalsIgnoreCase(trimmed)) {
                    return platform;
                }
            }
        }
        throw new ValidationException("Unknown platform '" + label + "'. Valid options are: "
                + Arrays.stream(values()).map(Platform::getLabel).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return label;
    }
}
