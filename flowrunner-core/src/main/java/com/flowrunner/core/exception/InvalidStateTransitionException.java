package com.flowrunner.core.exception;

import com.flowrunner.core.model.WorkflowRunStatus;

/**
 * Thrown when an invalid run status transition is attempted.
 */
public class InvalidStateTransitionException extends FlowRunnerException {
    
    public static final String ERROR_CODE = "INVALID_STATE_TRANSITION";
    
    public InvalidStateTransitionException(WorkflowRunStatus currentStatus, WorkflowRunStatus targetStatus) {
        super(ERROR_CODE, String.format(
            "Cannot transition from %s to %s",
            currentStatus, targetStatus
        ));
    }
    
    public InvalidStateTransitionException(String entityType, String currentState, String targetState) {
        super(ERROR_CODE, String.format(
            "Cannot transition %s from %s to %s",
            entityType, currentState, targetState
        ));
    }
}
