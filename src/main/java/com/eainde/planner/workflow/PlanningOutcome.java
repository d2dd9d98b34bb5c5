package com.eainde.planner.workflow;

import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.model.ContentCalendar;
import com.eainde.planner.model.StrategySummary;
import com.eainde.planner.stage.ResultStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one planning run.
 *
 * @param runId       id of the run, also the MDC {@code runId}
 * @param status      success when every node succeeded
 * @param message     message of the last node that ran
 * @param failedStage stage that stopped the run, null on success
 * @param artifacts   everything committed before the run ended, in pipeline key order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanningOutcome(
        @JsonProperty("run_id")       String runId,
        @JsonProperty("status")       ResultStatus status,
        @JsonProperty("message")      String message,
        @JsonProperty("failed_stage") String failedStage,
        @JsonProperty("artifacts")    Map<String, Object> artifacts
) {

    public PlanningOutcome {
        artifacts = Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }

    @JsonIgnore
    public Optional<ContentCalendar> calendar() {
        return Optional.ofNullable((ContentCalendar) artifacts.get(ArtifactKeys.CONTENT_CALENDAR.name()));
    }

    @JsonIgnore
    public Optional<StrategySummary> summary() {
        return Optional.ofNullable((StrategySummary) artifacts.get(ArtifactKeys.STRATEGY_SUMMARY.name()));
    }
}
