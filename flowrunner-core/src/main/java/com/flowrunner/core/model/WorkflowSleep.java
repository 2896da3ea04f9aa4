package com.flowrunner.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A suspended branch. Resumes the successors of workflowActionId with the
 * snapshotted output bag once sleepUntil has passed.
 * 
 * Invariants:
 * - consumed at most once (consumedAt set by an atomic compare-and-set)
 */
public record WorkflowSleep(
    String id,
    String runId,
    String workflowActionId,
    Map<String, JsonNode> nextActionInputs,
    Instant sleepUntil,
    Instant createdAt,
    Instant consumedAt
) {
    public WorkflowSleep {
        nextActionInputs = nextActionInputs == null ? Map.of() : Map.copyOf(nextActionInputs);
    }

    public static WorkflowSleep create(String runId, String workflowActionId,
                                       Map<String, JsonNode> nextActionInputs, Instant sleepUntil) {
        return new WorkflowSleep(UUID.randomUUID().toString(), runId, workflowActionId,
            nextActionInputs, sleepUntil, Instant.now(), null);
    }

    public boolean isConsumed() {
        return consumedAt != null;
    }

    public boolean isDue(Instant now) {
        return !sleepUntil.isAfter(now);
    }

    public WorkflowSleep withConsumed(Instant consumedAt) {
        return new WorkflowSleep(id, runId, workflowActionId, nextActionInputs,
            sleepUntil, createdAt, consumedAt);
    }
}
