package com.flowrunner.core.repository;

import com.flowrunner.core.model.Workflow;
import java.util.Optional;

/**
 * Repository for Workflow persistence.
 */
public interface WorkflowRepository {

    void save(Workflow workflow);

    void update(Workflow workflow);

    Optional<Workflow> findById(String workflowId);
}
