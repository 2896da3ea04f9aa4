package com.flowrunner.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowrunner.core.model.WorkflowSleep;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
@DisplayName("JdbcWorkflowSleepRepository")
class JdbcWorkflowSleepRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = PostgresTestSupport.postgres();

    private final ObjectMapper objectMapper = new ObjectMapper();
    private JdbcWorkflowSleepRepository repository;
    private String runId;

    @BeforeEach
    void setUp() {
        JdbcTemplate jdbcTemplate = PostgresTestSupport.jdbcTemplate(postgres);
        repository = new JdbcWorkflowSleepRepository(jdbcTemplate, objectMapper);
        runId = "run-" + UUID.randomUUID();
    }

    private WorkflowSleep sleep(Instant until) throws Exception {
        Map<String, JsonNode> bag = Map.of("a", objectMapper.readTree("{\"token\": \"abc\", \"n\": [1, 2]}"));
        WorkflowSleep sleep = WorkflowSleep.create(runId, "action-a", bag, until.truncatedTo(ChronoUnit.MILLIS));
        repository.save(sleep);
        return sleep;
    }

    @Test
    @DisplayName("Saved continuation keeps its output bag")
    void roundTripsOutputBag() throws Exception {
        WorkflowSleep saved = sleep(Instant.now().plusSeconds(60));

        WorkflowSleep loaded = repository.findById(saved.id()).orElseThrow();

        assertThat(loaded.runId()).isEqualTo(runId);
        assertThat(loaded.workflowActionId()).isEqualTo("action-a");
        assertThat(loaded.sleepUntil()).isEqualTo(saved.sleepUntil());
        assertThat(loaded.nextActionInputs().get("a").get("token").textValue()).isEqualTo("abc");
        assertThat(loaded.nextActionInputs().get("a").get("n")).hasSize(2);
        assertThat(loaded.isConsumed()).isFalse();
    }

    @Test
    @DisplayName("Only due, unconsumed continuations are returned")
    void findsDueContinuations() throws Exception {
        WorkflowSleep due = sleep(Instant.now().minusSeconds(5));
        WorkflowSleep later = sleep(Instant.now().plusSeconds(3600));
        WorkflowSleep consumed = sleep(Instant.now().minusSeconds(10));
        repository.tryConsume(consumed.id(), Instant.now());

        List<String> ids = repository.findDue(Instant.now(), 100).stream()
            .map(WorkflowSleep::id)
            .collect(Collectors.toList());

        assertThat(ids).contains(due.id()).doesNotContain(later.id(), consumed.id());
        assertThat(repository.countPendingByRun(runId)).isEqualTo(2);
    }

    @Test
    @DisplayName("Concurrent consumers: exactly one wins")
    void consumeIsExclusive() throws Exception {
        WorkflowSleep sleep = sleep(Instant.now());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> attempts = IntStream.range(0, 8)
                .mapToObj(i -> (Callable<Boolean>) () -> repository.tryConsume(sleep.id(), Instant.now()))
                .collect(Collectors.toList());

            long winners = 0;
            for (Future<Boolean> result : pool.invokeAll(attempts)) {
                if (result.get()) {
                    winners++;
                }
            }

            assertThat(winners).isEqualTo(1);
            assertThat(repository.findById(sleep.id()).orElseThrow().isConsumed()).isTrue();
        } finally {
            pool.shutdown();
        }
    }

    @Test
    @DisplayName("Purge deletes consumed continuations older than the cutoff only")
    void purgeConsumed() throws Exception {
        Instant now = Instant.now();
        WorkflowSleep consumed = sleep(now.minusSeconds(120));
        WorkflowSleep pending = sleep(now.plusSeconds(3600));
        repository.tryConsume(consumed.id(), now.minusSeconds(60));

        int purged = repository.deleteConsumedBefore(now);

        assertThat(purged).isEqualTo(1);
        assertThat(repository.findById(consumed.id())).isEmpty();
        assertThat(repository.findById(pending.id())).isPresent();
        assertThat(repository.countPendingByRun(runId)).isEqualTo(1);
    }
}
