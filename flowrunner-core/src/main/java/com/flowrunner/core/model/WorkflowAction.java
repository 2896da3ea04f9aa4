package com.flowrunner.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * A node in a workflow's action graph. Invokes one integration action.
 */
public record WorkflowAction(
    String id,
    String owner,
    String workflowId,
    String integrationActionId,
    JsonNode inputs,
    String credentialsId,
    boolean rootAction,
    List<NextAction> nextActions
) {
    public WorkflowAction {
        nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
    }

    public WorkflowAction withNextActions(List<NextAction> nextActions) {
        return new WorkflowAction(id, owner, workflowId, integrationActionId,
            inputs, credentialsId, rootAction, nextActions);
    }
}
