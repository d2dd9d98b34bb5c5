package com.eainde.planner.model;

import com.eainde.planner.stage.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Platforms chosen for the week, in priority order.
 *
 * @param platforms  non-empty, duplicate-free
 * @param priorities free-text focus note
 */
public record PlatformSelection(
        @JsonProperty("platforms")  List<Platform> platforms,
        @JsonProperty("priorities") String priorities
) implements Serializable {

    public static final String EQUAL_FOCUS = "Equal focus on all selected platforms";

    public PlatformSelection {
        platforms = List.copyOf(platforms);
    }

    /**
     * Parses platform labels. Duplicates collapse onto their first occurrence.
     *
     * @throws ValidationException for an empty selection or an unknown label
     */
    public static PlatformSelection of(Collection<String> labels, String priorities) {
        if (labels == null || labels.isEmpty()) {
            throw new ValidationException("At least one platform must be selected");
        }
        Set<Platform> parsed = new LinkedHashSet<>();
        for (String label : labels) {
            parsed.add(Platform.fromLabel(label));
        }
        String focus = priorities == null || priorities.isBlank() ? EQUAL_FOCUS : priorities.trim();
        return new PlatformSelection(new ArrayList<>(parsed), focus);
    }

    public boolean includes(Platform platform) {
        return platforms.contains(platform);
    }

    /** Platform for a day of the week: the selection cycled in priority order. */
    public Platform platformForDay(int day) {
        return platforms.get((day - 1) % platforms.size());
    }
}
