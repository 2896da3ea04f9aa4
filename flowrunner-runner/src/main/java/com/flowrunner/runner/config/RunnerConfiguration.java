package com.flowrunner.runner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flowrunner.core.repository.AccountCredentialRepository;
import com.flowrunner.core.repository.IntegrationCatalog;
import com.flowrunner.core.repository.LeaseRepository;
import com.flowrunner.core.repository.WorkflowActionRepository;
import com.flowrunner.core.repository.WorkflowRepository;
import com.flowrunner.core.repository.WorkflowRunActionRepository;
import com.flowrunner.core.repository.WorkflowRunRepository;
import com.flowrunner.core.repository.WorkflowSleepRepository;
import com.flowrunner.core.repository.WorkflowTriggerRepository;
import com.flowrunner.engine.coordinator.ActionTreeExecutor;
import com.flowrunner.engine.coordinator.FailurePropagator;
import com.flowrunner.engine.coordinator.RunnerCoordinator;
import com.flowrunner.engine.coordinator.TriggerCoordinator;
import com.flowrunner.engine.coordinator.WorkflowAdminCoordinator;
import com.flowrunner.engine.coordinator.WorkflowRunRecorder;
import com.flowrunner.engine.credentials.CredentialCipher;
import com.flowrunner.engine.credentials.CredentialResolver;
import com.flowrunner.engine.expression.ExpressionResolver;
import com.flowrunner.engine.metrics.WorkflowMetrics;
import com.flowrunner.engine.operation.OperationInvoker;
import com.flowrunner.engine.service.RunnerService;
import com.flowrunner.engine.service.WorkflowAdminService;
import com.flowrunner.runner.integration.IntegrationDefinition;
import com.flowrunner.runner.integration.IntegrationRegistry;
import com.flowrunner.scheduler.SleepScheduler;
import com.flowrunner.scheduler.TriggerPollScheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Wires the engine, the schedulers and the registered integration definitions.
 */
@Configuration
public class RunnerConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService branchExecutor(RunnerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "flowrunner-branch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.executor().poolSize(), threadFactory);
    }

    @Bean
    public IntegrationRegistry integrationRegistry(ObjectProvider<IntegrationDefinition> definitions) {
        return new IntegrationRegistry(definitions.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    public ExpressionResolver expressionResolver(ObjectMapper objectMapper) {
        return new ExpressionResolver(objectMapper);
    }

    @Bean
    public CredentialResolver credentialResolver(
            AccountCredentialRepository credentialRepository,
            IntegrationCatalog integrationCatalog,
            ObjectMapper objectMapper,
            RunnerProperties properties) {
        return new CredentialResolver(credentialRepository, integrationCatalog,
            new CredentialCipher(properties.credentials().aesKey()), objectMapper);
    }

    @Bean
    public SleepScheduler sleepScheduler(WorkflowSleepRepository sleepRepository, RunnerProperties properties) {
        return new SleepScheduler(sleepRepository, properties.continuation().sweepInterval());
    }

    @Bean
    public WorkflowRunRecorder workflowRunRecorder(
            WorkflowRunRepository runRepository,
            WorkflowRunActionRepository runActionRepository,
            WorkflowSleepRepository sleepRepository,
            WorkflowMetrics metrics) {
        return new WorkflowRunRecorder(runRepository, runActionRepository, sleepRepository, metrics);
    }

    @Bean
    public FailurePropagator failurePropagator(
            WorkflowRepository workflowRepository,
            WorkflowRunRecorder recorder,
            WorkflowMetrics metrics) {
        return new FailurePropagator(workflowRepository, recorder, metrics);
    }

    @Bean
    public ActionTreeExecutor actionTreeExecutor(
            WorkflowActionRepository actionRepository,
            WorkflowSleepRepository sleepRepository,
            IntegrationCatalog integrationCatalog,
            CredentialResolver credentialResolver,
            ExpressionResolver expressionResolver,
            OperationInvoker operationInvoker,
            SleepScheduler sleepScheduler,
            WorkflowRunRecorder recorder,
            FailurePropagator failurePropagator,
            WorkflowMetrics metrics,
            ExecutorService branchExecutor) {
        return new ActionTreeExecutor(actionRepository, sleepRepository, integrationCatalog,
            credentialResolver, expressionResolver, operationInvoker, sleepScheduler,
            recorder, failurePropagator, metrics, branchExecutor);
    }

    @Bean
    public TriggerCoordinator triggerCoordinator(
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
            ExecutorService branchExecutor,
            RunnerProperties properties) {
        return new TriggerCoordinator(actionRepository, triggerRepository, integrationCatalog,
            leaseRepository, credentialResolver, expressionResolver, operationInvoker, recorder,
            actionTreeExecutor, metrics, branchExecutor,
            properties.lease().holderName(), properties.lease().duration());
    }

    @Bean
    public RunnerService runnerService(
            TriggerCoordinator triggerCoordinator,
            ActionTreeExecutor actionTreeExecutor,
            WorkflowRunRecorder recorder) {
        return new RunnerCoordinator(triggerCoordinator, actionTreeExecutor, recorder);
    }

    @Bean
    public WorkflowAdminService workflowAdminService(
            WorkflowRepository workflowRepository,
            WorkflowActionRepository actionRepository,
            ObjectMapper objectMapper) {
        return new WorkflowAdminCoordinator(workflowRepository, actionRepository, objectMapper);
    }

    @Bean
    public TriggerPollScheduler triggerPollScheduler(
            WorkflowTriggerRepository triggerRepository,
            RunnerService runnerService,
            RunnerProperties properties) {
        return new TriggerPollScheduler(triggerRepository, runnerService, properties.trigger().pollInterval());
    }

    @Bean
    public SchedulerLifecycle schedulerLifecycle(
            SleepScheduler sleepScheduler,
            TriggerPollScheduler triggerPollScheduler,
            RunnerService runnerService,
            RunnerProperties properties) {
        return new SchedulerLifecycle(sleepScheduler, triggerPollScheduler, runnerService,
            properties.trigger().pollingEnabled());
    }
}
