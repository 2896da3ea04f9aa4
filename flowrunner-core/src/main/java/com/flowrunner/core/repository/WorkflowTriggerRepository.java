package com.flowrunner.core.repository;

import com.flowrunner.core.model.WorkflowTrigger;
import java.util.List;
import java.util.Optional;

/**
 * Repository for WorkflowTrigger persistence.
 */
public interface WorkflowTriggerRepository {

    void save(WorkflowTrigger trigger);

    Optional<WorkflowTrigger> findById(String triggerId);

    Optional<WorkflowTrigger> findByWorkflow(String workflowId);

    /**
     * Find triggers eligible for polling.
     * 
     * @param limit Maximum number of results
     * @return Enabled triggers
     */
    List<WorkflowTrigger> findEnabled(int limit);

    /**
     * Advance the dedup cursor of a trigger.
     * 
     * @param triggerId The trigger ID
     * @param lastId The id of the newest processed item
     */
    void updateLastId(String triggerId, String lastId);
}
