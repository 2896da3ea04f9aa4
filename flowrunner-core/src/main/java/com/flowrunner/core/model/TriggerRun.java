package com.flowrunner.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Trigger outcome embedded in a workflow run.
 */
public record TriggerRun(
    String workflowTriggerId,
    String integrationName,
    String operationName,
    WorkflowRunStatus status,
    boolean satisfied,
    List<String> triggerIds,
    String errorMessage,
    String errorResponse,
    Instant finishedAt
) {
    public TriggerRun {
        triggerIds = triggerIds == null ? List.of() : List.copyOf(triggerIds);
    }

    public static TriggerRun running(String workflowTriggerId, String integrationName, String operationName) {
        return new TriggerRun(workflowTriggerId, integrationName, operationName,
            WorkflowRunStatus.RUNNING, false, List.of(), null, null, null);
    }

    public TriggerRun withCompleted(boolean satisfied, List<String> triggerIds) {
        return new TriggerRun(workflowTriggerId, integrationName, operationName,
            WorkflowRunStatus.COMPLETED, satisfied, triggerIds, null, null, Instant.now());
    }

    public TriggerRun withFailed(String errorMessage, String errorResponse) {
        return new TriggerRun(workflowTriggerId, integrationName, operationName,
            WorkflowRunStatus.FAILED, false, triggerIds, errorMessage, errorResponse, Instant.now());
    }
}
