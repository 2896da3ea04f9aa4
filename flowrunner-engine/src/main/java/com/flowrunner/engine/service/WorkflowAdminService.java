package com.flowrunner.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.flowrunner.core.model.Workflow;

/**
 * Update-time validation and maintenance of workflow definitions.
 */
public interface WorkflowAdminService {

    /**
     * Apply a partial update to a workflow.
     * 
     * @param workflowId The workflow ID
     * @param update The fields to change
     * @return The updated workflow
     * @throws com.flowrunner.core.exception.NotFoundException if the workflow does not exist
     * @throws com.flowrunner.core.exception.WorkflowValidationException if the workflow would run itself on failure
     */
    Workflow updateWorkflow(String workflowId, WorkflowUpdate update);

    /**
     * Validate the action graph of a workflow: edge targets exist within the workflow,
     * a root action exists, and the graph is acyclic.
     * 
     * @param workflowId The workflow ID
     * @throws com.flowrunner.core.exception.WorkflowValidationException if the graph is invalid
     */
    void validateActionGraph(String workflowId);

    /**
     * Recompute the template schema from the {@code template.*} fields referenced by inputs.
     * 
     * @param workflow The workflow owning the inputs
     * @param inputs The new inputs of a trigger or action
     * @param oldInputs The previous inputs, may be null
     * @return true if the workflow was updated
     */
    boolean updateTemplateSettings(Workflow workflow, JsonNode inputs, JsonNode oldInputs);
}
