package com.eainde.planner.stage;

/**
 * Base of the two structured failures a stage can report. Both are converted into
 * an error {@link StageResult} at the stage boundary and never escape a stage.
 */
public abstract class PlanningException extends RuntimeException {

    protected PlanningException(String message) {
        super(message);
    }

    public abstract ErrorKind kind();
}
