package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.WorkflowTrigger;
import com.flowrunner.core.repository.WorkflowTriggerRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowTriggerRepository.
 */
@Repository
public class InMemoryWorkflowTriggerRepository implements WorkflowTriggerRepository {

    private final Map<String, WorkflowTrigger> triggers = new ConcurrentHashMap<>();

    @Override
    public void save(WorkflowTrigger trigger) {
        triggers.put(trigger.id(), trigger);
    }

    @Override
    public Optional<WorkflowTrigger> findById(String triggerId) {
        return Optional.ofNullable(triggers.get(triggerId));
    }

    @Override
    public Optional<WorkflowTrigger> findByWorkflow(String workflowId) {
        return triggers.values().stream()
            .filter(t -> t.workflowId().equals(workflowId))
            .findFirst();
    }

    @Override
    public List<WorkflowTrigger> findEnabled(int limit) {
        return triggers.values().stream()
            .filter(WorkflowTrigger::enabled)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public void updateLastId(String triggerId, String lastId) {
        triggers.computeIfPresent(triggerId, (id, trigger) -> trigger.withLastId(lastId));
    }
}
