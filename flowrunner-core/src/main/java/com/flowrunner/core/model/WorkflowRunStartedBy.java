package com.flowrunner.core.model;

/**
 * Reason a workflow run was started.
 */
public enum WorkflowRunStartedBy {
    TRIGGER,
    USER,
    WORKFLOW_FAILURE
}
