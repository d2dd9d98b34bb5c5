package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record ComplianceReport(
        @JsonProperty("count_compliance")           ComplianceCheck countCompliance,
        @JsonProperty("appropriateness_compliance") ComplianceCheck appropriatenessCompliance,
        @JsonProperty("avoid_list_compliance")      ComplianceCheck avoidListCompliance,
        @JsonProperty("best_practice_adherence")    ComplianceCheck bestPracticeAdherence
) implements Serializable {

    @JsonProperty("overall_compliance")
    public boolean overallCompliance() {
        return countCompliance.passed()
                && appropriatenessCompliance.passed()
                && avoidListCompliance.passed()
                && bestPracticeAdherence.passed();
    }
}
