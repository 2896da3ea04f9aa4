package com.flowrunner.core.exception;

/**
 * Thrown when a workflow update or its action graph fails validation.
 */
public class WorkflowValidationException extends FlowRunnerException {
    
    public static final String ERROR_CODE = "WORKFLOW_VALIDATION_FAILED";
    
    public WorkflowValidationException(String message) {
        super(ERROR_CODE, message);
    }
    
    public WorkflowValidationException(String field, String reason) {
        super(ERROR_CODE, String.format("Invalid workflow: %s - %s", field, reason));
    }
}
