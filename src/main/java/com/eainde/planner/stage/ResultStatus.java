package com.eainde.planner.stage;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResultStatus {
    SUCCESS,
    ERROR;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase();
    }
}
