package com.flowrunner.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowrunner.core.exception.CredentialException;
import com.flowrunner.core.exception.InvalidInputsException;
import com.flowrunner.core.exception.NotFoundException;
import com.flowrunner.core.exception.WorkflowConfigurationException;
import com.flowrunner.core.model.Integration;
import com.flowrunner.core.model.IntegrationAction;
import com.flowrunner.core.model.NextAction;
import com.flowrunner.core.model.WorkflowAction;
import com.flowrunner.core.model.WorkflowRun;
import com.flowrunner.core.model.WorkflowRunAction;
import com.flowrunner.core.model.WorkflowSleep;
import com.flowrunner.core.repository.IntegrationCatalog;
import com.flowrunner.core.repository.WorkflowActionRepository;
import com.flowrunner.core.repository.WorkflowSleepRepository;
import com.flowrunner.engine.credentials.CredentialResolver;
import com.flowrunner.engine.credentials.ResolvedCredentials;
import com.flowrunner.engine.expression.ExpressionResolver;
import com.flowrunner.engine.logging.LoggingContext;
import com.flowrunner.engine.metrics.WorkflowMetrics;
import com.flowrunner.engine.operation.OperationException;
import com.flowrunner.engine.operation.OperationInvoker;
import com.flowrunner.engine.operation.OperationRequest;
import com.flowrunner.engine.operation.OperationResult;
import com.flowrunner.engine.service.ContinuationScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Executes a workflow's action graph.
 * 
 * Sibling branches run concurrently on the executor and are joined with an all-complete
 * barrier; a failed branch never cancels its siblings. Output bags are immutable: each node
 * passes its descendants a copy extended with its own outputs.
 */
public class ActionTreeExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionTreeExecutor.class);

    private final WorkflowActionRepository actionRepository;
    private final WorkflowSleepRepository sleepRepository;
    private final IntegrationCatalog integrationCatalog;
    private final CredentialResolver credentialResolver;
    private final ExpressionResolver expressionResolver;
    private final OperationInvoker operationInvoker;
    private final ContinuationScheduler continuationScheduler;
    private final WorkflowRunRecorder recorder;
    private final FailurePropagator failurePropagator;
    private final WorkflowMetrics metrics;
    private final Executor executor;

    public ActionTreeExecutor(
            WorkflowActionRepository actionRepository,
            WorkflowSleepRepository sleepRepository,
            IntegrationCatalog integrationCatalog,
            CredentialResolver credentialResolver,
            ExpressionResolver expressionResolver,
            OperationInvoker operationInvoker,
            ContinuationScheduler continuationScheduler,
            WorkflowRunRecorder recorder,
            FailurePropagator failurePropagator,
            WorkflowMetrics metrics,
            Executor executor) {
        this.actionRepository = actionRepository;
        this.sleepRepository = sleepRepository;
        this.integrationCatalog = integrationCatalog;
        this.credentialResolver = credentialResolver;
        this.expressionResolver = expressionResolver;
        this.operationInvoker = operationInvoker;
        this.continuationScheduler = continuationScheduler;
        this.recorder = recorder;
        this.failurePropagator = failurePropagator;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Run the root actions once per output bag.
     * Bags are processed in order; the roots of one bag run concurrently.
     * 
     * @param run The run record
     * @param workflowId The workflow whose graph is executed
     * @param outputBags Seed output bags
     * @return Completes once every branch of every bag has finished or suspended
     */
    public CompletableFuture<Void> runWorkflowActions(WorkflowRun run, String workflowId,
                                                      List<Map<String, JsonNode>> outputBags) {
        recorder.enter(run.id());
        CompletableFuture<Void> chain;
        try {
            List<String> rootIds = actionRepository.findRootActions(workflowId).stream()
                .map(WorkflowAction::id)
                .collect(Collectors.toList());
            log.debug("Run {}: {} root action(s), {} output bag(s)", run.id(), rootIds.size(), outputBags.size());

            chain = CompletableFuture.completedFuture(null);
            for (Map<String, JsonNode> bag : outputBags) {
                chain = chain.thenCompose(v -> runActionTrees(run, rootIds, bag));
            }
        } catch (RuntimeException e) {
            chain = CompletableFuture.failedFuture(e);
        }
        return settle(run.id(), chain);
    }

    /**
     * Resume the successors of a suspended node with its snapshotted output bag.
     * Edge conditions are not re-evaluated: every declared next action resumes.
     */
    public CompletableFuture<Void> wakeUpWorkflowRun(WorkflowSleep sleep) {
        WorkflowRun run = recorder.resume(sleep).orElse(null);
        if (run == null) {
            return CompletableFuture.completedFuture(null);
        }

        WorkflowAction action = actionRepository.findById(sleep.workflowActionId()).orElse(null);
        if (action == null) {
            log.warn("Lost continuation {}: action {} no longer exists", sleep.id(), sleep.workflowActionId());
            metrics.continuationLost("action_missing");
            recorder.exit(run.id());
            return CompletableFuture.completedFuture(null);
        }

        metrics.continuationResumed();
        List<String> nextIds = action.nextActions().stream()
            .map(NextAction::actionId)
            .collect(Collectors.toList());
        log.info("Resuming run {} after action {}: {} next action(s)", run.id(), action.id(), nextIds.size());
        return settle(run.id(), runActionTrees(run, nextIds, sleep.nextActionInputs()));
    }

    /**
     * Start the onFailure workflow of a failed workflow, if any.
     * 
     * @return Completes once the failure run has finished or suspended
     */
    public CompletableFuture<Void> cascadeFailure(String failedWorkflowId) {
        return failurePropagator.createFailureRun(failedWorkflowId)
            .map(failureRun -> runWorkflowActions(failureRun, failureRun.workflowId(), List.of(Map.of()))
                .exceptionally(e -> {
                    log.error("Failure workflow run {} aborted", failureRun.id(), unwrap(e));
                    return null;
                }))
            .orElseGet(() -> CompletableFuture.completedFuture(null));
    }

    private CompletableFuture<Void> runActionTrees(WorkflowRun run, List<String> actionIds,
                                                   Map<String, JsonNode> outputs) {
        CompletableFuture<?>[] branches = actionIds.stream()
            .map(actionId -> runActionTree(run, actionId, outputs))
            .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(branches);
    }

    private CompletableFuture<Void> runActionTree(WorkflowRun run, String actionId,
                                                  Map<String, JsonNode> outputs) {
        return CompletableFuture
            .supplyAsync(() -> executeNode(run, actionId, outputs), executor)
            .thenCompose(Function.identity());
    }

    /**
     * Execute one node and return the future of whatever follows it:
     * its selected successors, its failure cascade, or nothing when it suspends.
     */
    private CompletableFuture<Void> executeNode(WorkflowRun run, String actionId, Map<String, JsonNode> outputs) {
        WorkflowAction action = actionRepository.findById(actionId)
            .orElseThrow(() -> new WorkflowConfigurationException("Workflow action " + actionId + " not found"));
        IntegrationAction integrationAction = integrationCatalog.findAction(action.integrationActionId())
            .orElseThrow(() -> new WorkflowConfigurationException(
                "Integration action " + action.integrationActionId() + " not found"));
        Integration integration = integrationCatalog.findIntegration(integrationAction.integrationId())
            .orElseThrow(() -> new WorkflowConfigurationException(
                "Integration " + integrationAction.integrationId() + " not found"));

        try (LoggingContext ctx = LoggingContext.forAction(action.workflowId(), run.id(), action.id())) {
            WorkflowRunAction runAction = recorder.startAction(
                run.id(), action.id(), integration.name(), integrationAction.name());
            Instant startedAt = Instant.now();

            ResolvedCredentials credentials;
            try {
                credentials = credentialResolver.resolve(action.credentialsId(),
                    () -> recorder.failAction(runAction, "Account credentials not found", null));
            } catch (NotFoundException e) {
                log.warn("Action {} failed: {}", action.id(), e.getMessage());
                metrics.actionFailed(integration.name(), integrationAction.name(), e.getErrorCode());
                return cascadeFailure(action.workflowId());
            } catch (CredentialException e) {
                return failAction(runAction, action, integrationAction, integration,
                    e.getMessage(), null, e.getErrorCode());
            } catch (WorkflowConfigurationException e) {
                recorder.failAction(runAction, e.getMessage(), null);
                throw e;
            }

            ObjectNode inputs;
            try {
                inputs = expressionResolver.resolveInputs(action.inputs(), outputs);
            } catch (InvalidInputsException e) {
                return failAction(runAction, action, integrationAction, integration,
                    e.getMessage(), null, e.getErrorCode());
            }

            OperationResult result;
            try {
                log.debug("Invoking {}.{}", integration.key(), integrationAction.key());
                result = operationInvoker.invoke(new OperationRequest(
                    integration,
                    credentials.integrationAccount(),
                    integrationAction,
                    inputs,
                    credentials.credentials(),
                    credentials.accountCredential()
                ));
            } catch (OperationException e) {
                return failAction(runAction, action, integrationAction, integration,
                    e.getMessage(), e.getResponseText(), e.getErrorCode());
            } catch (RuntimeException e) {
                log.error("Operation {}.{} threw unexpectedly", integration.key(), integrationAction.key(), e);
                return failAction(runAction, action, integrationAction, integration,
                    String.valueOf(e.getMessage()), null, e.getClass().getSimpleName());
            }

            recorder.completeAction(runAction);
            metrics.actionCompleted(integration.name(), integrationAction.name(),
                Duration.between(startedAt, Instant.now()));
            try {
                credentialResolver.storeRefreshed(credentials, result.refreshedCredentials());
            } catch (CredentialException e) {
                // the call already succeeded; the next call will refresh again
                log.error("Refreshed credentials of action {} not stored: {}", action.id(), e.getMessage());
            }

            Map<String, JsonNode> nextOutputs = extend(outputs, action.id(), result.outputs());

            if (result.isSleep()) {
                suspend(run, action, nextOutputs, result.sleepUntil());
                return CompletableFuture.completedFuture(null);
            }

            String condition = result.conditionText();
            List<String> nextIds = action.nextActions().stream()
                .filter(next -> next.firesFor(condition))
                .map(NextAction::actionId)
                .collect(Collectors.toList());
            log.debug("Action {} completed, {} of {} next action(s) selected (condition={})",
                action.id(), nextIds.size(), action.nextActions().size(), condition);

            return runActionTrees(run, nextIds, nextOutputs);
        }
    }

    private CompletableFuture<Void> failAction(WorkflowRunAction runAction, WorkflowAction action,
                                               IntegrationAction integrationAction, Integration integration,
                                               String errorMessage, String errorResponse, String errorType) {
        recorder.failAction(runAction, errorMessage, errorResponse);
        metrics.actionFailed(integration.name(), integrationAction.name(), errorType);
        log.warn("Action {} failed: {}", action.id(), errorMessage);
        return cascadeFailure(action.workflowId());
    }

    private void suspend(WorkflowRun run, WorkflowAction action, Map<String, JsonNode> outputs, Instant sleepUntil) {
        WorkflowSleep sleep = WorkflowSleep.create(run.id(), action.id(), outputs, sleepUntil);
        sleepRepository.save(sleep);
        continuationScheduler.schedule(sleep);
        metrics.sleepScheduled();
        log.info("Action {} suspended its branch until {} (continuation {})", action.id(), sleepUntil, sleep.id());
    }

    private CompletableFuture<Void> settle(String runId, CompletableFuture<Void> branches) {
        return branches
            .handle((v, error) -> error)
            .thenCompose(error -> {
                if (error == null) {
                    recorder.exit(runId);
                    return CompletableFuture.completedFuture(null);
                }
                Throwable cause = unwrap(error);
                recorder.failRun(runId, cause.getMessage());
                recorder.exit(runId);
                return CompletableFuture.failedFuture(cause);
            });
    }

    private static Map<String, JsonNode> extend(Map<String, JsonNode> outputs, String actionId, JsonNode actionOutputs) {
        Map<String, JsonNode> extended = new LinkedHashMap<>(outputs);
        extended.put(actionId, actionOutputs != null ? actionOutputs : NullNode.getInstance());
        return Collections.unmodifiableMap(extended);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
