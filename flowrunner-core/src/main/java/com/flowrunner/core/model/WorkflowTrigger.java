package com.flowrunner.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The entry point of a workflow. One per workflow.
 * 
 * lastId is the dedup cursor: the id of the newest item already processed.
 */
public record WorkflowTrigger(
    String id,
    String owner,
    String workflowId,
    String integrationTriggerId,
    JsonNode inputs,
    String credentialsId,
    String lastId,
    boolean enabled
) {
    public boolean hasCursor() {
        return lastId != null && !lastId.isEmpty();
    }

    public WorkflowTrigger withLastId(String lastId) {
        return new WorkflowTrigger(id, owner, workflowId, integrationTriggerId,
            inputs, credentialsId, lastId, enabled);
    }

    public WorkflowTrigger withEnabled(boolean enabled) {
        return new WorkflowTrigger(id, owner, workflowId, integrationTriggerId,
            inputs, credentialsId, lastId, enabled);
    }
}
