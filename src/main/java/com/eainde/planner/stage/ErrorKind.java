package com.eainde.planner.stage;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorKind {
    VALIDATION_ERROR("ValidationError"),
    MISSING_ARTIFACT("MissingArtifact");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
