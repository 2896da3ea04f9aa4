package com.flowrunner.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One execution of a workflow.
 * 
 * Invariants:
 * - status transitions follow {@link WorkflowRunStatus#canTransitionTo}
 * - a terminal status is reached exactly once
 */
public record WorkflowRun(
    String id,
    String owner,
    String workflowId,
    WorkflowRunStatus status,
    WorkflowRunStartedBy startedBy,
    TriggerRun triggerRun,
    String errorMessage,
    Instant createdAt,
    Instant finishedAt
) {
    public static WorkflowRun create(String owner, String workflowId, WorkflowRunStartedBy startedBy) {
        return new WorkflowRun(UUID.randomUUID().toString(), owner, workflowId,
            WorkflowRunStatus.RUNNING, startedBy, null, null, Instant.now(), null);
    }

    public static WorkflowRun createForTrigger(String owner, String workflowId,
                                               WorkflowRunStartedBy startedBy, TriggerRun triggerRun) {
        return new WorkflowRun(UUID.randomUUID().toString(), owner, workflowId,
            WorkflowRunStatus.RUNNING, startedBy, triggerRun, null, Instant.now(), null);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public WorkflowRun withStatus(WorkflowRunStatus newStatus) {
        return new WorkflowRun(id, owner, workflowId, newStatus, startedBy, triggerRun,
            errorMessage, createdAt, newStatus.isTerminal() ? Instant.now() : finishedAt);
    }

    public WorkflowRun withTriggerRun(TriggerRun triggerRun) {
        return new WorkflowRun(id, owner, workflowId, status, startedBy, triggerRun,
            errorMessage, createdAt, finishedAt);
    }

    public WorkflowRun withFailed(String errorMessage) {
        return new WorkflowRun(id, owner, workflowId, WorkflowRunStatus.FAILED, startedBy, triggerRun,
            errorMessage, createdAt, Instant.now());
    }
}
