package com.flowrunner.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowrunner.core.exception.NotFoundException;
import com.flowrunner.core.exception.WorkflowValidationException;
import com.flowrunner.core.model.NextAction;
import com.flowrunner.core.model.Workflow;
import com.flowrunner.core.model.WorkflowAction;
import com.flowrunner.core.repository.WorkflowActionRepository;
import com.flowrunner.core.repository.WorkflowRepository;
import com.flowrunner.engine.expression.ExpressionResolver;
import com.flowrunner.engine.service.WorkflowAdminService;
import com.flowrunner.engine.service.WorkflowUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Validates workflow definitions when they are saved.
 */
public class WorkflowAdminCoordinator implements WorkflowAdminService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAdminCoordinator.class);

    private final WorkflowRepository workflowRepository;
    private final WorkflowActionRepository actionRepository;
    private final ObjectMapper objectMapper;

    public WorkflowAdminCoordinator(
            WorkflowRepository workflowRepository,
            WorkflowActionRepository actionRepository,
            ObjectMapper objectMapper) {
        this.workflowRepository = workflowRepository;
        this.actionRepository = actionRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Workflow updateWorkflow(String workflowId, WorkflowUpdate update) {
        Workflow workflow = workflowRepository.findById(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));

        if (update.onFailureWorkflowId() != null) {
            if (update.onFailureWorkflowId().equals(workflowId)) {
                throw new WorkflowValidationException("onFailure", "a workflow cannot run itself on failure");
            }
            workflow = workflow.withOnFailureWorkflowId(
                update.onFailureWorkflowId().isEmpty() ? null : update.onFailureWorkflowId());
        }
        if (update.name() != null) {
            workflow = workflow.withName(update.name());
        }

        workflowRepository.update(workflow);
        log.info("Updated workflow {}", workflowId);
        return workflow;
    }

    @Override
    public void validateActionGraph(String workflowId) {
        List<WorkflowAction> actions = actionRepository.findByWorkflow(workflowId);
        if (actions.isEmpty()) {
            return;
        }

        Map<String, WorkflowAction> byId = actions.stream()
            .collect(Collectors.toMap(WorkflowAction::id, Function.identity()));

        if (actions.stream().noneMatch(WorkflowAction::rootAction)) {
            throw new WorkflowValidationException("actions", "workflow has no root action");
        }

        Map<String, Integer> inDegree = new HashMap<>();
        byId.keySet().forEach(id -> inDegree.put(id, 0));
        for (WorkflowAction action : actions) {
            for (NextAction next : action.nextActions()) {
                if (!byId.containsKey(next.actionId())) {
                    throw new WorkflowValidationException("nextActions",
                        "action " + action.id() + " points to unknown action " + next.actionId());
                }
                inDegree.merge(next.actionId(), 1, Integer::sum);
            }
        }

        // Kahn: every node is visited iff the graph has no cycle
        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        int visited = 0;
        while (!ready.isEmpty()) {
            WorkflowAction action = byId.get(ready.poll());
            visited++;
            for (NextAction next : action.nextActions()) {
                if (inDegree.merge(next.actionId(), -1, Integer::sum) == 0) {
                    ready.add(next.actionId());
                }
            }
        }

        if (visited < actions.size()) {
            Set<String> cyclic = inDegree.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
            throw new WorkflowValidationException("nextActions", "action graph contains a cycle through " + cyclic);
        }
    }

    @Override
    public boolean updateTemplateSettings(Workflow workflow, JsonNode inputs, JsonNode oldInputs) {
        Set<String> newFields = ExpressionResolver.findTemplateFields(inputs);
        Set<String> oldFields = ExpressionResolver.findTemplateFields(oldInputs);

        if (!workflow.isTemplate() && newFields.isEmpty()) {
            return false;
        }
        if (newFields.equals(oldFields)) {
            return false;
        }

        ObjectNode schema = workflow.templateSchema() != null && workflow.templateSchema().isObject()
            ? ((ObjectNode) workflow.templateSchema()).deepCopy()
            : objectMapper.createObjectNode().put("type", "object");
        ObjectNode properties = schema.has("properties") && schema.get("properties").isObject()
            ? (ObjectNode) schema.get("properties")
            : schema.putObject("properties");

        oldFields.stream()
            .filter(field -> !newFields.contains(field))
            .forEach(properties::remove);
        newFields.stream()
            .filter(field -> !oldFields.contains(field))
            .forEach(field -> properties.putObject(field).put("type", "string"));

        workflowRepository.update(workflow.withTemplate(schema));
        log.info("Updated template schema of workflow {}: {} field(s)", workflow.id(), properties.size());
        return true;
    }
}
