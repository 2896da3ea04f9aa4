package com.flowrunner.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A user-owned workflow: one trigger plus a graph of actions.
 *
 * Invariants:
 * - onFailureWorkflowId never equals id (enforced at update time)
 */
public record Workflow(
    String id,
    String owner,
    String name,
    String onFailureWorkflowId,
    JsonNode templateSchema,
    boolean isTemplate
) {
    public static Workflow create(String id, String owner, String name) {
        return new Workflow(id, owner, name, null, null, false);
    }

    public boolean hasOnFailureWorkflow() {
        return onFailureWorkflowId != null && !onFailureWorkflowId.isBlank();
    }

    public Workflow withOnFailureWorkflowId(String onFailureWorkflowId) {
        return new Workflow(id, owner, name, onFailureWorkflowId, templateSchema, isTemplate);
    }

    public Workflow withName(String name) {
        return new Workflow(id, owner, name, onFailureWorkflowId, templateSchema, isTemplate);
    }

    public Workflow withTemplate(JsonNode templateSchema) {
        return new Workflow(id, owner, name, onFailureWorkflowId, templateSchema, true);
    }
}
