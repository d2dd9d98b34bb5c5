package com.eainde.planner.stage;

import com.eainde.planner.context.ArtifactKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a stage computed: its payload plus the artifacts it wants committed.
 * Nothing reaches the store until the stage returned this object.
 */
public final class StageOutput<O> {

    private final O data;
    private final String message;
    private final Map<ArtifactKey<?>, Object> writes;

    private StageOutput(O data, String message, Map<ArtifactKey<?>, Object> writes) {
        this.data = data;
        this.message = message;
        this.writes = Collections.unmodifiableMap(writes);
    }

    public static <O> StageOutput<O> of(O data, String message) {
        return new StageOutput<>(data, message, new LinkedHashMap<>());
    }

    /** Output that stores its payload under {@code key}. */
    public static <O> StageOutput<O> writing(ArtifactKey<O> key, O data, String message) {
        Map<ArtifactKey<?>, Object> writes = new LinkedHashMap<>();
        writes.put(key, data);
        return new StageOutput<>(data, message, writes);
    }

    /** Copy of this output with one more artifact to commit. */
    public <T> StageOutput<O> plus(ArtifactKey<T> key, T value) {
        Map<ArtifactKey<?>, Object> merged = new LinkedHashMap<>(writes);
        merged.put(key, value);
        return new StageOutput<>(data, message, merged);
    }

    public O getData() {
        return data;
    }

    public String getMessage() {
        return message;
    }

    public Map<ArtifactKey<?>, Object> getWrites() {
        return writes;
    }
}
