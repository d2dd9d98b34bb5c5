package com.eainde.planner.stage;

/**
 * Malformed or out-of-range input: day outside 1 to 7, unknown platform, blank field.
 */
public class ValidationException extends PlanningException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION_ERROR;
    }
}
