package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.Workflow;
import com.flowrunner.core.repository.WorkflowRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowRepository.
 */
@Repository
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private final Map<String, Workflow> workflows = new ConcurrentHashMap<>();

    @Override
    public void save(Workflow workflow) {
        workflows.put(workflow.id(), workflow);
    }

    @Override
    public void update(Workflow workflow) {
        workflows.put(workflow.id(), workflow);
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }
}
