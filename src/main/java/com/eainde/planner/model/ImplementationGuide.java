package com.eainde.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

public record ImplementationGuide(
        @JsonProperty("pre_launch_checklist") List<String> preLaunchChecklist,
        @JsonProperty("posting_schedule")     PostingSchedule postingSchedule,
        @JsonProperty("quality_assurance")    List<String> qualityAssurance,
        @JsonProperty("performance_tracking") List<String> performanceTracking
) implements Serializable {

    public ImplementationGuide {
        preLaunchChecklist = List.copyOf(preLaunchChecklist);
        qualityAssurance = List.copyOf(qualityAssurance);
        performanceTracking = List.copyOf(performanceTracking);
    }
}
