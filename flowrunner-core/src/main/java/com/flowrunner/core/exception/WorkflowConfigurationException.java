package com.flowrunner.core.exception;

/**
 * Thrown for fatal configuration problems: a trigger definition without idKey,
 * a dangling integration reference, a missing credentials key.
 * Never retried; propagates to the caller of the trigger check or tree run.
 */
public class WorkflowConfigurationException extends FlowRunnerException {

    public static final String ERROR_CODE = "CONFIGURATION_ERROR";

    public WorkflowConfigurationException(String message) {
        super(ERROR_CODE, message);
    }

    public WorkflowConfigurationException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
