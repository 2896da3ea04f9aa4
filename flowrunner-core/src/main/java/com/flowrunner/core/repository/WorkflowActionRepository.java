package com.flowrunner.core.repository;

import com.flowrunner.core.model.WorkflowAction;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the action nodes of workflow graphs.
 */
public interface WorkflowActionRepository {

    void save(WorkflowAction action);

    Optional<WorkflowAction> findById(String actionId);

    /**
     * Find actions by ID, preserving the order of the given IDs and skipping unknown ones.
     */
    List<WorkflowAction> findByIds(Collection<String> actionIds);

    List<WorkflowAction> findByWorkflow(String workflowId);

    List<WorkflowAction> findRootActions(String workflowId);
}
