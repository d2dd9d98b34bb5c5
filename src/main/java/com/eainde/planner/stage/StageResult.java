package com.eainde.planner.stage;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Tagged result returned by every public planning operation.
 *
 * @param status      success or error
 * @param stage       name of the stage that produced the result
 * @param message     human readable outcome
 * @param data        produced artifact, null on error
 * @param errorKind   ValidationError or MissingArtifact, null on success
 * @param missingKeys absent artifact keys for MissingArtifact, empty otherwise
 * @param <T>         payload type
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageResult<T>(
        @JsonProperty("status")       ResultStatus status,
        @JsonProperty("stage")        String stage,
        @JsonProperty("message")      String message,
        @JsonProperty("data")         T data,
        @JsonProperty("error_kind")   ErrorKind errorKind,
        @JsonProperty("missing_keys") List<String> missingKeys
) implements Serializable {

    public StageResult {
        missingKeys = missingKeys == null ? List.of() : List.copyOf(missingKeys);
    }

    public static <T> StageResult<T> success(String stage, String message, T data) {
        return new StageResult<>(ResultStatus.SUCCESS, stage, message, data, null, List.of());
    }

    public static <T> StageResult<T> validationError(String stage, String message) {
        return new StageResult<>(ResultStatus.ERROR, stage, message, null, ErrorKind.VALIDATION_ERROR, List.of());
    }

    public static <T> StageResult<T> missingArtifact(String stage, List<String> missingKeys) {
        return new StageResult<>(ResultStatus.ERROR, stage,
                "Missing required artifacts: " + String.join(", ", missingKeys),
                null, ErrorKind.MISSING_ARTIFACT, missingKeys);
    }

    public static <T> StageResult<T> failure(String stage, PlanningException e) {
        if (e instanceof MissingArtifactException missing) {
            return missingArtifact(stage, missing.getMissingKeys());
        }
        return new StageResult<>(ResultStatus.ERROR, stage, e.getMessage(), null, e.kind(), List.of());
    }

    /** This error result re-typed, for steps that aggregate several stage results. */
    public <U> StageResult<U> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("Only error results can be propagated");
        }
        return new StageResult<>(status, stage, message, null, errorKind, missingKeys);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ResultStatus.SUCCESS;
    }

    @JsonIgnore
    public Optional<T> dataOptional() {
        return Optional.ofNullable(data);
    }
}
