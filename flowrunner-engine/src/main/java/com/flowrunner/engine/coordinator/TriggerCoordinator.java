package com.flowrunner.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowrunner.core.exception.CredentialException;
import com.flowrunner.core.exception.InvalidInputsException;
import com.flowrunner.core.exception.NotFoundException;
import com.flowrunner.core.exception.WorkflowConfigurationException;
import com.flowrunner.core.model.ExecutionLease;
import com.flowrunner.core.model.Integration;
import com.flowrunner.core.model.IntegrationAction;
import com.flowrunner.core.model.IntegrationTrigger;
import com.flowrunner.core.model.TriggerPopulate;
import com.flowrunner.core.model.TriggerRun;
import com.flowrunner.core.model.WorkflowRun;
import com.flowrunner.core.model.WorkflowRunStartedBy;
import com.flowrunner.core.model.WorkflowTrigger;
import com.flowrunner.core.repository.IntegrationCatalog;
import com.flowrunner.core.repository.LeaseRepository;
import com.flowrunner.core.repository.WorkflowActionRepository;
import com.flowrunner.core.repository.WorkflowTriggerRepository;
import com.flowrunner.engine.credentials.CredentialResolver;
import com.flowrunner.engine.credentials.ResolvedCredentials;
import com.flowrunner.engine.expression.ExpressionResolver;
import com.flowrunner.engine.logging.LoggingContext;
import com.flowrunner.engine.metrics.WorkflowMetrics;
import com.flowrunner.engine.operation.OperationException;
import com.flowrunner.engine.operation.OperationInvoker;
import com.flowrunner.engine.operation.OperationRequest;
import com.flowrunner.engine.operation.OperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Polls a trigger, deduplicates the polled items against the trigger's cursor and
 * runs the workflow once per new item.
 * 
 * Checks of the same trigger are mutually exclusive through a lease keyed by trigger ID;
 * a check that cannot acquire the lease is skipped.
 */
public class TriggerCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TriggerCoordinator.class);

    private final WorkflowActionRepository actionRepository;
    private final WorkflowTriggerRepository triggerRepository;
    private final IntegrationCatalog integrationCatalog;
    private final LeaseRepository leaseRepository;
    private final CredentialResolver credentialResolver;
    private final ExpressionResolver expressionResolver;
    private final OperationInvoker operationInvoker;
    private final WorkflowRunRecorder recorder;
    private final ActionTreeExecutor actionTreeExecutor;
    private final WorkflowMetrics metrics;
    private final Executor executor;

    private final UUID holderId;
    private final String holderName;
    private final Duration leaseDuration;

    public TriggerCoordinator(
            WorkflowActionRepository actionRepository,
            WorkflowTriggerRepository triggerRepository,
            IntegrationCatalog integrationCatalog,
            LeaseRepository leaseRepository,
            CredentialResolver credentialResolver,
            ExpressionResolver expressionResolver,
            OperationInvoker operationInvoker,
            WorkflowRunRecorder recorder,
            ActionTreeExecutor actionTreeExecutor,
            WorkflowMetrics metrics,
            Executor executor,
            String holderName,
            Duration leaseDuration) {
        this.actionRepository = actionRepository;
        this.triggerRepository = triggerRepository;
        this.integrationCatalog = integrationCatalog;
        this.leaseRepository = leaseRepository;
        this.credentialResolver = credentialResolver;
        this.expressionResolver = expressionResolver;
        this.operationInvoker = operationInvoker;
        this.recorder = recorder;
        this.actionTreeExecutor = actionTreeExecutor;
        this.metrics = metrics;
        this.executor = executor;
        this.holderId = UUID.randomUUID();
        this.holderName = holderName;
        this.leaseDuration = leaseDuration;
    }

    /**
     * Check a trigger and dispatch new items to the workflow's action graph.
     * 
     * @param trigger The trigger to check
     * @param startedBy Why the check runs
     * @return Completes once every dispatched branch has finished or suspended
     */
    public CompletableFuture<Void> runWorkflowTriggerCheck(WorkflowTrigger trigger, WorkflowRunStartedBy startedBy) {
        Optional<ExecutionLease> lease = leaseRepository.acquire(trigger.id(), holderId, holderName, leaseDuration);
        metrics.leaseAcquired(lease.isPresent());
        if (lease.isEmpty()) {
            log.info("Skipping check of trigger {}: another check is in flight", trigger.id());
            metrics.triggerChecked("skipped");
            return CompletableFuture.completedFuture(null);
        }

        return CompletableFuture
            .supplyAsync(() -> check(trigger, startedBy), executor)
            .thenCompose(Function.identity())
            .whenComplete((v, error) -> leaseRepository.release(lease.get()));
    }

    private CompletableFuture<Void> check(WorkflowTrigger snapshot, WorkflowRunStartedBy startedBy) {
        // the cursor is only trustworthy once read under the lease
        WorkflowTrigger trigger = triggerRepository.findById(snapshot.id()).orElse(snapshot);
        try (LoggingContext ctx = LoggingContext.forTrigger(trigger.workflowId(), trigger.id())) {
            if (actionRepository.findRootActions(trigger.workflowId()).isEmpty()) {
                log.debug("Workflow {} has no root actions, skipping trigger check", trigger.workflowId());
                metrics.triggerChecked("no_actions");
                return CompletableFuture.completedFuture(null);
            }

            IntegrationTrigger integrationTrigger = integrationCatalog.findTrigger(trigger.integrationTriggerId())
                .orElseThrow(() -> new WorkflowConfigurationException(
                    "Integration trigger " + trigger.integrationTriggerId() + " not found"));
            Integration integration = integrationCatalog.findIntegration(integrationTrigger.integrationId())
                .orElseThrow(() -> new WorkflowConfigurationException(
                    "Integration " + integrationTrigger.integrationId() + " not found"));
            if (!integrationTrigger.hasIdKey()) {
                throw new WorkflowConfigurationException(
                    "Integration trigger " + integrationTrigger.key() + " does not declare an idKey");
            }

            WorkflowRun run = recorder.startRun(WorkflowRun.createForTrigger(
                trigger.owner(), trigger.workflowId(), startedBy,
                TriggerRun.running(trigger.id(), integration.name(), integrationTrigger.name())));
            LoggingContext.setRunId(run.id());

            ResolvedCredentials credentials;
            try {
                credentials = credentialResolver.resolve(trigger.credentialsId(),
                    () -> recorder.failTrigger(run.id(), "Account credentials not found", null));
            } catch (NotFoundException e) {
                metrics.triggerChecked("failed");
                return actionTreeExecutor.cascadeFailure(trigger.workflowId());
            } catch (CredentialException e) {
                return failCheck(trigger, run, e.getMessage(), null);
            } catch (WorkflowConfigurationException e) {
                recorder.failTrigger(run.id(), e.getMessage(), null);
                throw e;
            }

            ObjectNode inputs;
            OperationResult result;
            List<TriggerItems.Item> newItems;
            List<String> polledIds;
            try {
                inputs = expressionResolver.resolveInputs(trigger.inputs(), Map.of());
                OperationRequest request = new OperationRequest(
                    integration,
                    credentials.integrationAccount(),
                    integrationTrigger,
                    inputs,
                    credentials.credentials(),
                    credentials.accountCredential()
                );
                result = operationInvoker.invoke(request);
                credentialResolver.storeRefreshed(credentials, result.refreshedCredentials());

                List<TriggerItems.Item> items = TriggerItems.extract(result.outputs(), integrationTrigger.idKey());
                polledIds = items.stream().map(TriggerItems.Item::id).collect(Collectors.toList());
                newItems = TriggerItems.selectNew(items, trigger.lastId());
                log.debug("Trigger {} polled {} item(s), {} new", trigger.id(), items.size(), newItems.size());

                if (!newItems.isEmpty() && integrationTrigger.hasPopulate()) {
                    newItems = populate(integrationTrigger.triggerPopulate(), request, newItems);
                }
            } catch (InvalidInputsException e) {
                return failCheck(trigger, run, e.getMessage(), null);
            } catch (OperationException e) {
                return failCheck(trigger, run, e.getMessage(), e.getResponseText());
            } catch (WorkflowConfigurationException e) {
                recorder.failTrigger(run.id(), e.getMessage(), null);
                throw e;
            } catch (RuntimeException e) {
                log.error("Check of trigger {} threw unexpectedly", trigger.id(), e);
                return failCheck(trigger, run, String.valueOf(e.getMessage()), null);
            }

            if (newItems.isEmpty()) {
                recorder.completeTrigger(run.id(), false,
                    polledIds.isEmpty() ? List.of() : polledIds.subList(0, 1));
                metrics.triggerChecked("not_satisfied");
                return actionTreeExecutor.runWorkflowActions(run, trigger.workflowId(), List.of());
            }

            triggerRepository.updateLastId(trigger.id(), newItems.get(0).id());
            recorder.completeTrigger(run.id(), true, polledIds);
            metrics.triggerChecked("satisfied");
            metrics.triggerItemsDispatched(newItems.size());
            log.info("Trigger {} satisfied with {} new item(s), cursor now {}",
                trigger.id(), newItems.size(), newItems.get(0).id());

            List<Map<String, JsonNode>> outputBags = TriggerItems.chronological(newItems).stream()
                .map(item -> Map.of(trigger.id(), item.data()))
                .collect(Collectors.toList());
            return actionTreeExecutor.runWorkflowActions(run, trigger.workflowId(), outputBags);
        }
    }

    /**
     * Enrich each new item with the outputs of the populate operation.
     * Item fields win over populated fields on conflict.
     */
    private List<TriggerItems.Item> populate(TriggerPopulate populate, OperationRequest triggerRequest,
                                             List<TriggerItems.Item> items) {
        IntegrationAction populateAction = integrationCatalog.findActionByKey(populate.operationId()).orElse(null);
        if (populateAction == null) {
            log.warn("Populate operation {} not found, items left unchanged", populate.operationId());
            return items;
        }

        List<TriggerItems.Item> populated = new ArrayList<>(items.size());
        for (TriggerItems.Item item : items) {
            ObjectNode inputs = expressionResolver.resolveInputs(populate.inputs(),
                Map.of("inputs", triggerRequest.inputs(), "outputs", item.data()));
            OperationResult result = operationInvoker.invoke(triggerRequest.withOperation(populateAction, inputs));

            JsonNode outputs = result.outputs();
            if (outputs != null && outputs.isObject() && item.data().isObject()) {
                ObjectNode merged = ((ObjectNode) outputs).deepCopy();
                merged.setAll((ObjectNode) item.data());
                populated.add(item.withData(merged));
            } else {
                populated.add(item);
            }
        }
        return populated;
    }

    private CompletableFuture<Void> failCheck(WorkflowTrigger trigger, WorkflowRun run,
                                              String errorMessage, String errorResponse) {
        recorder.failTrigger(run.id(), errorMessage, errorResponse);
        metrics.triggerChecked("failed");
        log.warn("Trigger {} check failed: {}", trigger.id(), errorMessage);
        return actionTreeExecutor.cascadeFailure(trigger.workflowId());
    }
}
