package com.flowrunner.core.exception;

/**
 * Thrown when a workflow, action, run or credential record is not found.
 */
public class NotFoundException extends FlowRunnerException {
    
    public static final String ERROR_CODE = "NOT_FOUND";
    
    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }

    public NotFoundException(String message) {
        super(ERROR_CODE, message);
    }
}
