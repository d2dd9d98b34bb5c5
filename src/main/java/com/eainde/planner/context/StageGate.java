package com.eainde.planner.context;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Precondition check run by every stage before it computes anything.
 */
public final class StageGate {

    private StageGate() {}

    public static GateDecision check(ContextStore store, Collection<? extends ArtifactKey<?>> required) {
        List<String> missing = new ArrayList<>();
        for (ArtifactKey<?> key : required) {
            if (!store.contains(key)) {
                missing.add(key.name());
            }
        }
        return missing.isEmpty() ? GateDecision.ok() : GateDecision.missing(missing);
    }
}
