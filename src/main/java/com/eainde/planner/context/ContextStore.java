package com.eainde.planner.context;

import com.eainde.planner.stage.MissingArtifactException;
import lombok.extern.log4j.Log4j2;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keyed artifact map for one planning run.
 *
 * <h3>Discipline:</h3>
 * <ul>
 *   <li>Every key has exactly one writer, named by {@link ArtifactKey#owner()}.
 *       {@link #commit(String, Map)} rejects writes from any other stage.</li>
 *   <li>Readers only ever see committed artifacts; stages buffer their writes and
 *       commit them in one call after their computation succeeded.</li>
 *   <li>Distinct keys may be written concurrently (the per-day stages do).</li>
 * </ul>
 *
 * <p>The store is passed by reference through the pipeline. It is never shared
 * between runs.</p>
 */
@Log4j2
public class ContextStore {

    private final Map<String, Object> artifacts = new ConcurrentHashMap<>();
    private final Set<String> written = ConcurrentHashMap.newKeySet();

    public ContextStore() {
    }

    /**
     * Rebuilds a store from a snapshot (e.g. the state of a graph run).
     * Entries that are not artifact keys of the run are ignored.
     */
    public static ContextStore fromSnapshot(Map<String, Object> snapshot) {
        ContextStore store = new ContextStore();
        snapshot.forEach((name, value) -> ArtifactKeys.byName(name)
                .filter(key -> value != null && key.type().isInstance(value))
                .ifPresent(key -> store.artifacts.put(name, value)));
        return store;
    }

    public <T> Optional<T> get(ArtifactKey<T> key) {
        return Optional.ofNullable(artifacts.get(key.name())).map(key::cast);
    }

    /**
     * Returns the artifact or throws {@link MissingArtifactException}.
     * Stages call this only for keys their gate already checked.
     */
    public <T> T require(ArtifactKey<T> key) {
        return get(key).orElseThrow(() ->
                new MissingArtifactException(List.of(key.name())));
    }

    public boolean contains(ArtifactKey<?> key) {
        return artifacts.containsKey(key.name());
    }

    /** Overwrites the artifact. Used by external collaborators that seed a run. */
    public <T> void set(ArtifactKey<T> key, T value) {
        if (value == null) {
            throw new IllegalArgumentException("Artifact " + key + " must not be null");
        }
        artifacts.put(key.name(), key.cast(value));
        written.add(key.name());
    }

    /**
     * Commits a stage's buffered writes.
     *
     * @throws IllegalStateException if the stage does not own one of the keys;
     *                               nothing is written in that case
     */
    public void commit(String stage, Map<ArtifactKey<?>, Object> writes) {
        for (ArtifactKey<?> key : writes.keySet()) {
            if (!key.owner().equals(stage)) {
                throw new IllegalStateException(
                        "Stage '" + stage + "' cannot write " + key + " (owned by '" + key.owner() + "')");
            }
        }
        writes.forEach((key, value) -> {
            artifacts.put(key.name(), key.cast(value));
            written.add(key.name());
        });
        log.debug("{} committed {}", stage, writes.keySet());
    }

    /** Artifacts in pipeline key order. */
    public Map<String, Object> snapshot() {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (ArtifactKey<?> key : ArtifactKeys.all()) {
            Object value = artifacts.get(key.name());
            if (value != null) {
                ordered.put(key.name(), value);
            }
        }
        return ordered;
    }

    /** Artifacts set or committed since this instance was created. */
    public Map<String, Object> writtenSinceCreation() {
        Map<String, Object> changes = new LinkedHashMap<>();
        snapshot().forEach((name, value) -> {
            if (written.contains(name)) {
                changes.put(name, value);
            }
        });
        return changes;
    }

    public Collection<String> keys() {
        return snapshot().keySet();
    }

    public int size() {
        return artifacts.size();
    }
}
