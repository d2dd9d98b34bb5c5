package com.eainde.planner.context;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed name of one artifact in the {@link ContextStore}.
 *
 * @param name  key under which the artifact is stored, e.g. {@code day_3_post}
 * @param type  runtime type of the stored value
 * @param owner name of the only stage allowed to write it
 * @param <T>   artifact type
 */
public record ArtifactKey<T>(String name, Class<T> type, String owner) implements Serializable {

    public ArtifactKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(owner, "owner");
    }

    public T cast(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return name;
    }
}
