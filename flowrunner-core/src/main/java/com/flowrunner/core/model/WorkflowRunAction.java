package com.flowrunner.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Per-node execution record within a run. Written only by the branch executing the node.
 */
public record WorkflowRunAction(
    String id,
    String runId,
    String workflowActionId,
    String integrationName,
    String operationName,
    ActionRunStatus status,
    String errorMessage,
    String errorResponse,
    Instant startedAt,
    Instant finishedAt
) {
    public static WorkflowRunAction running(String runId, String workflowActionId,
                                            String integrationName, String operationName) {
        return new WorkflowRunAction(UUID.randomUUID().toString(), runId, workflowActionId,
            integrationName, operationName, ActionRunStatus.RUNNING, null, null, Instant.now(), null);
    }

    public WorkflowRunAction withCompleted() {
        return new WorkflowRunAction(id, runId, workflowActionId, integrationName, operationName,
            ActionRunStatus.COMPLETED, null, null, startedAt, Instant.now());
    }

    public WorkflowRunAction withFailed(String errorMessage, String errorResponse) {
        return new WorkflowRunAction(id, runId, workflowActionId, integrationName, operationName,
            ActionRunStatus.FAILED, errorMessage, errorResponse, startedAt, Instant.now());
    }
}
