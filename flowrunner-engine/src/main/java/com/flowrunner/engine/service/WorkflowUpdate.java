package com.flowrunner.engine.service;

/**
 * Partial update of a workflow. Null fields are left unchanged;
 * an empty onFailureWorkflowId clears the failure workflow.
 */
public record WorkflowUpdate(
    String name,
    String onFailureWorkflowId
) {
    public static WorkflowUpdate onFailure(String onFailureWorkflowId) {
        return new WorkflowUpdate(null, onFailureWorkflowId);
    }

    public static WorkflowUpdate rename(String name) {
        return new WorkflowUpdate(name, null);
    }
}
