package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * @param remediation what to change, null when the check passed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComplianceCheck(
        @JsonProperty("passed")      boolean passed,
        @JsonProperty("remediation") String remediation
) implements Serializable {

    public static ComplianceCheck evaluate(boolean passed, String remediation) {
        return new ComplianceCheck(passed, passed ? null : remediation);
    }
}
