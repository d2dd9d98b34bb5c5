package com.eainde.planner.stage;

import java.util.List;

/**
 * A required upstream artifact is absent from the context store.
 */
public class MissingArtifactException extends PlanningException {

    private final List<String> missingKeys;

    public MissingArtifactException(List<String> missingKeys) {
        super("Missing required artifacts: " + String.join(", ", missingKeys));
        this.missingKeys = List.copyOf(missingKeys);
    }

    public List<String> getMissingKeys() {
        return missingKeys;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.MISSING_ARTIFACT;
    }
}
