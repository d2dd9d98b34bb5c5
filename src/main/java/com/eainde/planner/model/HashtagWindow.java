package com.eainde.planner.model;

import com.eainde.planner.stage.ValidationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inclusive hashtag count range.
 */
public record HashtagWindow(
        @JsonProperty("min") int min,
        @JsonProperty("max") int max
) implements Serializable {

    private static final Pattern RANGE = Pattern.compile("(\\d+)-(\\d+)");

    public HashtagWindow {
        if (min < 0 || max < min) {
            throw new ValidationException("invalid hashtag window [" + min + "," + max + "]");
        }
    }

    /** Parses the first {@code N-M} range found in the text. */
    public static Optional<HashtagWindow> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = RANGE.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int low = Integer.parseInt(matcher.group(1));
        int high = Integer.parseInt(matcher.group(2));
        return low <= high ? Optional.of(new HashtagWindow(low, high)) : Optional.empty();
    }

    public boolean contains(int count) {
        return count >= min && count <= max;
    }

    /** Overlap of both windows, empty when they are disjoint. */
    public Optional<HashtagWindow> intersect(HashtagWindow other) {
        int low = Math.max(min, other.min);
        int high = Math.min(max, other.max);
        return low <= high ? Optional.of(new HashtagWindow(low, high)) : Optional.empty();
    }

    @Override
    public String toString() {
        return "[" + min + "," + max + "]";
    }
}
