package com.flowrunner.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.flowrunner.core.exception.CredentialException;
import com.flowrunner.core.exception.WorkflowConfigurationException;
import com.flowrunner.core.model.AccountCredential;
import com.flowrunner.core.model.ActionRunStatus;
import com.flowrunner.core.model.NextAction;
import com.flowrunner.core.model.Workflow;
import com.flowrunner.core.model.WorkflowAction;
import com.flowrunner.core.model.WorkflowRun;
import com.flowrunner.core.model.WorkflowRunAction;
import com.flowrunner.core.model.WorkflowRunStartedBy;
import com.flowrunner.core.model.WorkflowRunStatus;
import com.flowrunner.core.model.WorkflowSleep;
import com.flowrunner.engine.credentials.CredentialCipher;
import com.flowrunner.engine.metrics.WorkflowMetrics;
import com.flowrunner.engine.operation.OperationRequest;
import com.flowrunner.engine.operation.OperationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ActionTreeExecutor")
class ActionTreeExecutorTest {

    private static final String WF = "wf-1";

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        fixture.workflow(WF);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private WorkflowRun startRun(String workflowId) {
        Workflow workflow = fixture.workflowRepository.findById(workflowId).orElseThrow();
        return fixture.runner.createRun(workflow, WorkflowRunStartedBy.USER);
    }

    private WorkflowRun execute(String workflowId, Map<String, JsonNode> seed) throws Exception {
        WorkflowRun run = startRun(workflowId);
        fixture.runner.startWorkflowRun(workflowId, seed, run).get(5, TimeUnit.SECONDS);
        return reload(run);
    }

    private WorkflowRun reload(WorkflowRun run) {
        return fixture.runRepository.findById(run.id()).orElseThrow();
    }

    private Map<String, ActionRunStatus> actionStatuses(WorkflowRun run) {
        return fixture.runActionRepository.findByRun(run.id()).stream()
            .collect(Collectors.toMap(WorkflowRunAction::workflowActionId, WorkflowRunAction::status));
    }

    private OperationResult outputs(String json) {
        return OperationResult.of(fixture.json(json));
    }

    // ========== Traversal ==========

    @Test
    @DisplayName("Linear chain passes upstream outputs to descendants")
    void linearChainPassesOutputs() throws Exception {
        fixture.action(WF, "a", "fetch", true, NextAction.to("b"));
        fixture.action(WF, "b", "send", false, fixture.json("{\"message\": \"Got {{ a.count }} rows\"}"));
        fixture.invoker
            .on("fetch", r -> outputs("{\"count\": 7}"))
            .on("send", r -> outputs("{\"ok\": true}"));

        WorkflowRun run = execute(WF, Map.of());

        assertThat(run.status()).isEqualTo(WorkflowRunStatus.COMPLETED);
        assertThat(run.finishedAt()).isNotNull();
        assertThat(actionStatuses(run)).containsOnly(
            entry("a", ActionRunStatus.COMPLETED), entry("b", ActionRunStatus.COMPLETED));
        OperationRequest send = fixture.invoker.invocationsOf("send").get(0);
        assertThat(send.inputs().get("message").textValue()).isEqualTo("Got 7 rows");
    }

    @Test
    @DisplayName("Seed outputs are visible to root actions")
    void seedOutputsReachRoots() throws Exception {
        fixture.action(WF, "a", "send", true, fixture.json("{\"to\": \"{{ trigger.email }}\"}"));
        fixture.invoker.on("send", r -> outputs("{}"));

        execute(WF, Map.of("trigger", fixture.json("{\"email\": \"ada@example.com\"}")));

        assertThat(fixture.invoker.invocationsOf("send").get(0).inputs().get("to").textValue())
            .isEqualTo("ada@example.com");
    }

    @Test
    @DisplayName("Conditional edges fire only when the branch condition matches")
    void conditionalEdges() throws Exception {
        fixture.action(WF, "check", "check", true,
            NextAction.when("yes", "approved"), NextAction.when("no", "rejected"), NextAction.to("always"));
        fixture.action(WF, "yes", "yes", false);
        fixture.action(WF, "no", "no", false);
        fixture.action(WF, "always", "always", false);
        fixture.invoker
            .on("check", r -> OperationResult.withCondition(fixture.json("{}"), TextNode.valueOf("approved")))
            .on("yes", r -> outputs("{}"))
            .on("no", r -> outputs("{}"))
            .on("always", r -> outputs("{}"));

        WorkflowRun run = execute(WF, Map.of());

        assertThat(fixture.invoker.invocationsOf("yes")).hasSize(1);
        assertThat(fixture.invoker.invocationsOf("no")).isEmpty();
        assertThat(fixture.invoker.invocationsOf("always")).hasSize(1);
        assertThat(run.status()).isEqualTo(WorkflowRunStatus.COMPLETED);
    }

    @Test
    @DisplayName("Operation without a condition matches edges labelled undefined")
    void missingConditionMatchesUndefined() throws Exception {
        fixture.action(WF, "a", "plain", true, NextAction.when("b", "undefined"), NextAction.when("c", "true"));
        fixture.action(WF, "b", "b", false);
        fixture.action(WF, "c", "c", false);
        fixture.invoker
            .on("plain", r -> outputs("{}"))
            .on("b", r -> outputs("{}"))
            .on("c", r -> outputs("{}"));

        execute(WF, Map.of());

        assertThat(fixture.invoker.invocationsOf("b")).hasSize(1);
        assertThat(fixture.invoker.invocationsOf("c")).isEmpty();
    }

    @Test
    @DisplayName("Sibling branches run concurrently")
    void siblingsRunConcurrently() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        fixture.action(WF, "left", "left", true);
        fixture.action(WF, "right", "right", true);
        Function<OperationRequest, OperationResult> rendezvous = r -> {
            bothStarted.countDown();
            try {
                if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("sibling never started");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return outputs("{}");
        };
        fixture.invoker.on("left", rendezvous).on("right", rendezvous);

        WorkflowRun run = execute(WF, Map.of());

        assertThat(run.status()).isEqualTo(WorkflowRunStatus.COMPLETED);
        assertThat(actionStatuses(run).values()).containsOnly(ActionRunStatus.COMPLETED);
    }

    @Test
    @DisplayName("Each seed bag runs the roots once, in order")
    void multipleBagsRunInOrder() throws Exception {
        fixture.action(WF, "a", "echo", true, fixture.json("{\"n\": \"{{ item.n }}\"}"));
        fixture.invoker.on("echo", r -> outputs("{}"));
        WorkflowRun run = startRun(WF);

        fixture.actionTreeExecutor.runWorkflowActions(run, WF, List.of(
            Map.of("item", fixture.json("{\"n\": 1}")),
            Map.of("item", fixture.json("{\"n\": 2}"))
        )).get(5, TimeUnit.SECONDS);

        assertThat(fixture.invoker.invocationsOf("echo"))
            .extracting(r -> r.inputs().get("n").intValue())
            .containsExactly(1, 2);
        assertThat(reload(run).status()).isEqualTo(WorkflowRunStatus.COMPLETED);
    }

    // ========== Failures ==========

    @Test
    @DisplayName("A failing branch does not stop its siblings")
    void failingBranchIsIsolated() throws Exception {
        fixture.action(WF, "bad", "bad", true, NextAction.to("never"));
        fixture.action(WF, "never", "never", false);
        fixture.action(WF, "good", "good", true, NextAction.to("after"));
        fixture.action(WF, "after", "after", false);
        fixture.invoker
            .failing("bad", "Request failed with status 500", "{\"error\":\"boom\"}")
            .on("never", r -> outputs("{}"))
            .on("good", r -> outputs("{}"))
            .on("after", r -> outputs("{}"));

        WorkflowRun run = execute(WF, Map.of());

        assertThat(fixture.invoker.invocationsOf("after")).hasSize(1);
        assertThat(fixture.invoker.invocationsOf("never")).isEmpty();
        assertThat(actionStatuses(run)).containsOnly(
            entry("bad", ActionRunStatus.FAILED),
            entry("good", ActionRunStatus.COMPLETED),
            entry("after", ActionRunStatus.COMPLETED));
        assertThat(run.status()).isEqualTo(WorkflowRunStatus.FAILED);

        WorkflowRunAction failed = fixture.runActionRepository.findByRun(run.id()).stream()
            .filter(a -> a.workflowActionId().equals("bad"))
            .findFirst().orElseThrow();
        assertThat(failed.errorMessage()).isEqualTo("Request failed with status 500");
        assertThat(failed.errorResponse()).isEqualTo("{\"error\":\"boom\"}");
        assertThat(fixture.counter(WorkflowMetrics.ACTION_FAILURES)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Failed action starts the onFailure workflow with an empty bag")
    void failureCascadesToOnFailureWorkflow() throws Exception {
        fixture.workflowRepository.update(
            fixture.workflowRepository.findById(WF).orElseThrow().withOnFailureWorkflowId("wf-alert"));
        fixture.workflow("wf-alert");
        fixture.action(WF, "a", "bad", true);
        fixture.action("wf-alert", "notify", "notify", true, fixture.json("{\"text\": \"{{ a.anything }}\"}"));
        fixture.invoker
            .failing("bad", "boom", null)
            .on("notify", r -> outputs("{}"));

        execute(WF, Map.of());

        List<WorkflowRun> failureRuns = fixture.runRepository.findByWorkflow("wf-alert");
        assertThat(failureRuns).hasSize(1);
        WorkflowRun failureRun = failureRuns.get(0);
        assertThat(failureRun.startedBy()).isEqualTo(WorkflowRunStartedBy.WORKFLOW_FAILURE);
        assertThat(failureRun.owner()).isEqualTo("owner-1");
        assertThat(failureRun.status()).isEqualTo(WorkflowRunStatus.COMPLETED);
        assertThat(fixture.invoker.invocationsOf("notify").get(0).inputs().has("text")).isFalse();
        assertThat(fixture.counter(WorkflowMetrics.FAILURE_CASCADES)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Invalid inputs fail the action without invoking the operation")
    void invalidInputsFailAction() throws Exception {
        fixture.action(WF, "a", "send", true, fixture.json("{\"n\": \"{{ missing.value * 2 }}\"}"));
        fixture.invoker.on("send", r -> outputs("{}"));

        WorkflowRun run = execute(WF, Map.of());

        assertThat(fixture.invoker.invocations()).isEmpty();
        assertThat(actionStatuses(run)).containsOnly(entry("a", ActionRunStatus.FAILED));
        assertThat(run.status()).isEqualTo(WorkflowRunStatus.FAILED);
    }

    @Test
    @DisplayName("Out-of-range index fails the action and cascades")
    void oversizedIndexFailsActionAndCascades() throws Exception {
        assertMalformedInputCascades(fixture.json("{\"n\": \"{{ up[99999999999] }}\"}"));
    }

    @Test
    @DisplayName("Broken unicode escape fails the action and cascades")
    void brokenEscapeFailsActionAndCascades() throws Exception {
        assertMalformedInputCascades(fixture.objectMapper.createObjectNode().put("n", "{{ 'x\\uZZZZ' }}"));
    }

    private void assertMalformedInputCascades(JsonNode inputs) throws Exception {
        fixture.workflowRepository.update(
            fixture.workflowRepository.findById(WF).orElseThrow().withOnFailureWorkflowId("wf-alert"));
        fixture.workflow("wf-alert");
        fixture.action("wf-alert", "notify", "notify", true);
        fixture.action(WF, "a", "send", true, inputs);
        fixture.invoker
            .on("send", r -> outputs("{}"))
            .on("notify", r -> outputs("{}"));

        WorkflowRun run = execute(WF, Map.of());

        assertThat(fixture.invoker.invocationsOf("send")).isEmpty();
        assertThat(actionStatuses(run)).containsOnly(entry("a", ActionRunStatus.FAILED));
        assertThat(run.status()).isEqualTo(WorkflowRunStatus.FAILED);
        assertThat(fixture.invoker.invocationsOf("notify")).hasSize(1);
        assertThat(fixture.runRepository.findByWorkflow("wf-alert").get(0).status())
            .isEqualTo(WorkflowRunStatus.COMPLETED);
    }

    @Test
    @DisplayName("A failing onFailure workflow cascades to its own onFailure workflow")
    void failureCascadeIsTransitive() throws Exception {
        fixture.workflowRepository.update(
            fixture.workflowRepository.findById(WF).orElseThrow().withOnFailureWorkflowId("wf-alert"));
        fixture.workflowRepository.update(
            fixture.workflow("wf-alert").withOnFailureWorkflowId("wf-page"));
        fixture.workflow("wf-page");
        fixture.action(WF, "a", "bad", true);
        fixture.action("wf-alert", "notify", "notify", true);
        fixture.action("wf-page", "page", "page", true);
        fixture.invoker
            .failing("bad", "boom", null)
            .failing("notify", "mail server down", null)
            .on("page", r -> outputs("{}"));

        execute(WF, Map.of());

        assertThat(fixture.runRepository.findByWorkflow("wf-alert").get(0).status())
            .isEqualTo(WorkflowRunStatus.FAILED);
        List<WorkflowRun> pageRuns = fixture.runRepository.findByWorkflow("wf-page");
        assertThat(pageRuns).hasSize(1);
        assertThat(pageRuns.get(0).startedBy()).isEqualTo(WorkflowRunStartedBy.WORKFLOW_FAILURE);
        assertThat(pageRuns.get(0).status()).isEqualTo(WorkflowRunStatus.COMPLETED);
        assertThat(fixture.invoker.invocationsOf("page")).hasSize(1);
        assertThat(fixture.counter(WorkflowMetrics.FAILURE_CASCADES)).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Missing integration action is a configuration error that fails the run")
    void missingIntegrationActionFailsRun() {
        fixture.actionRepository.save(new WorkflowAction("a", "owner-1", WF, "op-unknown",
            null, null, true, List.of()));
        WorkflowRun run = startRun(WF);

        CompletableFuture<Void> future = fixture.runner.startWorkflowRun(WF, Map.of(), run);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(WorkflowConfigurationException.class);
        WorkflowRun failed = reload(run);
        assertThat(failed.status()).isEqualTo(WorkflowRunStatus.FAILED);
        assertThat(failed.errorMessage()).contains("op-unknown");
    }

    // ========== Credentials ==========

    @Test
    @DisplayName("Decrypted secrets override plain credential fields")
    void credentialsAreMerged() throws Exception {
        fixture.credentialRepository.save(new AccountCredential("cred-1", "owner-1", null,
            fixture.json("{\"user\": \"plain\", \"region\": \"eu\"}"),
            fixture.cipher.encrypt("{\"user\": \"secret-user\", \"token\": \"t0\"}")));
        fixture.withCredentials(fixture.action(WF, "a", "call", true), "cred-1");
        fixture.invoker.on("call", r -> outputs("{}"));

        execute(WF, Map.of());

        ObjectNode credentials = fixture.invoker.invocationsOf("call").get(0).credentials();
        assertThat(credentials.get("user").textValue()).isEqualTo("secret-user");
        assertThat(credentials.get("region").textValue()).isEqualTo("eu");
        assertThat(credentials.get("token").textValue()).isEqualTo("t0");
    }

    @Test
    @DisplayName("Refreshed credentials are encrypted and stored")
    void refreshedCredentialsAreStored() throws Exception {
        fixture.credentialRepository.save(new AccountCredential("cred-1", "owner-1", null, null,
            fixture.cipher.encrypt("{\"token\": \"old\", \"refresh\": \"r1\"}")));
        fixture.withCredentials(fixture.action(WF, "a", "call", true), "cred-1");
        ObjectNode refreshed = fixture.objectMapper.createObjectNode().put("token", "new");
        fixture.invoker.on("call", r -> new OperationResult(fixture.json("{}"), null, null, refreshed));

        execute(WF, Map.of());

        String stored = fixture.credentialRepository.findById("cred-1").orElseThrow().encryptedCredentials();
        JsonNode secrets = fixture.objectMapper.readTree(fixture.cipher.decrypt(stored));
        assertThat(secrets.get("token").textValue()).isEqualTo("new");
        assertThat(secrets.get("refresh").textValue()).isEqualTo("r1");
    }

    @Test
    @DisplayName("Missing stored credential fails the action")
    void missingCredentialFailsAction() throws Exception {
        fixture.withCredentials(fixture.action(WF, "a", "call", true), "cred-gone");
        fixture.invoker.on("call", r -> outputs("{}"));

        WorkflowRun run = execute(WF, Map.of());

        assertThat(fixture.invoker.invocations()).isEmpty();
        WorkflowRunAction action = fixture.runActionRepository.findByRun(run.id()).get(0);
        assertThat(action.status()).isEqualTo(ActionRunStatus.FAILED);
        assertThat(action.errorMessage()).isEqualTo("Account credentials not found");
        assertThat(run.status()).isEqualTo(WorkflowRunStatus.FAILED);
    }

    @Test
    @DisplayName("Credentials encrypted under another key fail the action and cascade")
    void undecryptableCredentialFailsAction() throws Exception {
        fixture.workflowRepository.update(
            fixture.workflowRepository.findById(WF).orElseThrow().withOnFailureWorkflowId("wf-alert"));
        fixture.workflow("wf-alert");
        fixture.action("wf-alert", "notify", "notify", true);
        fixture.credentialRepository.save(new AccountCredential("cred-1", "owner-1", null, null,
            new CredentialCipher("other-key").encrypt("{\"token\": \"t0\"}")));
        fixture.withCredentials(fixture.action(WF, "a", "call", true), "cred-1");
        fixture.invoker
            .on("call", r -> outputs("{}"))
            .on("notify", r -> outputs("{}"));

        WorkflowRun run = execute(WF, Map.of());

        assertThat(fixture.invoker.invocationsOf("call")).isEmpty();
        WorkflowRunAction action = fixture.runActionRepository.findByRun(run.id()).get(0);
        assertThat(action.status()).isEqualTo(ActionRunStatus.FAILED);
        assertThat(action.errorMessage()).contains("cred-1").contains("cannot be decrypted");
        assertThat(run.status()).isEqualTo(WorkflowRunStatus.FAILED);
        assertThat(fixture.invoker.invocationsOf("notify")).hasSize(1);
        assertThat(fixture.counter(WorkflowMetrics.ACTION_FAILURES, "error_type", CredentialException.ERROR_CODE))
            .isEqualTo(1.0);
    }

    // ========== Sleep and wake-up ==========

    @Test
    @DisplayName("Sleeping action suspends its branch and wake-up resumes every next action")
    void sleepAndWakeUp() throws Exception {
        Instant until = Instant.now().plusSeconds(3600);
        fixture.action(WF, "wait", "wait", true,
            NextAction.when("b", "never-matches"), NextAction.to("c"));
        fixture.action(WF, "b", "b", false, fixture.json("{\"v\": \"{{ wait.token }}\"}"));
        fixture.action(WF, "c", "c", false);
        fixture.invoker
            .on("wait", r -> OperationResult.sleeping(fixture.json("{\"token\": \"abc\"}"), until))
            .on("b", r -> outputs("{}"))
            .on("c", r -> outputs("{}"));

        WorkflowRun run = execute(WF, Map.of());

        assertThat(run.status()).isEqualTo(WorkflowRunStatus.SLEEPING);
        assertThat(fixture.scheduledSleeps).hasSize(1);
        WorkflowSleep sleep = fixture.scheduledSleeps.get(0);
        assertThat(sleep.sleepUntil()).isEqualTo(until);
        assertThat(sleep.workflowActionId()).isEqualTo("wait");
        assertThat(sleep.nextActionInputs().get("wait").get("token").textValue()).isEqualTo("abc");
        assertThat(fixture.invoker.invocationsOf("b")).isEmpty();

        fixture.runner.wakeUpWorkflowRun(sleep).get(5, TimeUnit.SECONDS);

        assertThat(fixture.invoker.invocationsOf("b")).hasSize(1);
        assertThat(fixture.invoker.invocationsOf("c")).hasSize(1);
        assertThat(fixture.invoker.invocationsOf("b").get(0).inputs().get("v").textValue()).isEqualTo("abc");
        assertThat(reload(run).status()).isEqualTo(WorkflowRunStatus.COMPLETED);
        assertThat(fixture.counter(WorkflowMetrics.CONTINUATIONS_RESUMED)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A continuation is consumed at most once")
    void continuationConsumedOnce() throws Exception {
        fixture.action(WF, "wait", "wait", true, NextAction.to("b"));
        fixture.action(WF, "b", "b", false);
        fixture.invoker
            .on("wait", r -> OperationResult.sleeping(fixture.json("{}"), Instant.now()))
            .on("b", r -> outputs("{}"));
        execute(WF, Map.of());
        WorkflowSleep sleep = fixture.scheduledSleeps.get(0);

        CompletableFuture.allOf(
            fixture.runner.wakeUpWorkflowRun(sleep),
            fixture.runner.wakeUpWorkflowRun(sleep)
        ).get(5, TimeUnit.SECONDS);

        assertThat(fixture.invoker.invocationsOf("b")).hasSize(1);
    }

    @Test
    @DisplayName("Run stays sleeping until its last continuation resumes")
    void runSleepsUntilLastContinuation() throws Exception {
        fixture.action(WF, "w1", "wait", true);
        fixture.action(WF, "w2", "wait", true);
        fixture.invoker.on("wait", r -> OperationResult.sleeping(fixture.json("{}"), Instant.now()));
        WorkflowRun run = execute(WF, Map.of());
        assertThat(fixture.scheduledSleeps).hasSize(2);

        fixture.runner.wakeUpWorkflowRun(fixture.scheduledSleeps.get(0)).get(5, TimeUnit.SECONDS);
        assertThat(reload(run).status()).isEqualTo(WorkflowRunStatus.SLEEPING);

        fixture.runner.wakeUpWorkflowRun(fixture.scheduledSleeps.get(1)).get(5, TimeUnit.SECONDS);
        assertThat(reload(run).status()).isEqualTo(WorkflowRunStatus.COMPLETED);
    }

    @Test
    @DisplayName("Continuation of a finished run is counted as lost")
    void continuationOfFinishedRunIsLost() throws Exception {
        WorkflowRun run = startRun(WF);
        fixture.runRepository.update(run.withStatus(WorkflowRunStatus.COMPLETED));
        WorkflowSleep sleep = WorkflowSleep.create(run.id(), "a", Map.of(), Instant.now());
        fixture.sleepRepository.save(sleep);

        fixture.runner.wakeUpWorkflowRun(sleep).get(5, TimeUnit.SECONDS);

        assertThat(fixture.counter(WorkflowMetrics.CONTINUATIONS_LOST, "reason", "run_finished")).isEqualTo(1.0);
        assertThat(fixture.invoker.invocations()).isEmpty();
    }

    @Test
    @DisplayName("Continuation of a deleted run is counted as lost")
    void continuationOfMissingRunIsLost() throws Exception {
        WorkflowSleep sleep = WorkflowSleep.create("run-gone", "a", Map.of(), Instant.now());
        fixture.sleepRepository.save(sleep);

        fixture.runner.wakeUpWorkflowRun(sleep).get(5, TimeUnit.SECONDS);

        assertThat(fixture.counter(WorkflowMetrics.CONTINUATIONS_LOST, "reason", "run_missing")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Continuation whose action was removed finalizes the run")
    void continuationOfMissingActionIsLost() throws Exception {
        fixture.action(WF, "wait", "wait", true);
        fixture.invoker.on("wait", r -> OperationResult.sleeping(fixture.json("{}"), Instant.now()));
        WorkflowRun run = execute(WF, Map.of());
        WorkflowSleep sleep = fixture.scheduledSleeps.get(0);
        WorkflowSleep orphan = new WorkflowSleep(sleep.id(), sleep.runId(), "removed-action",
            sleep.nextActionInputs(), sleep.sleepUntil(), sleep.createdAt(), null);
        fixture.sleepRepository.save(orphan);

        fixture.runner.wakeUpWorkflowRun(orphan).get(5, TimeUnit.SECONDS);

        assertThat(fixture.counter(WorkflowMetrics.CONTINUATIONS_LOST, "reason", "action_missing")).isEqualTo(1.0);
        assertThat(reload(run).status()).isEqualTo(WorkflowRunStatus.COMPLETED);
    }
}
