package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.WorkflowSleep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InMemoryWorkflowSleepRepository")
class InMemoryWorkflowSleepRepositoryTest {

    private final InMemoryWorkflowSleepRepository repository = new InMemoryWorkflowSleepRepository();

    private WorkflowSleep saved(Instant until) {
        WorkflowSleep sleep = WorkflowSleep.create("run-1", "action-1", Map.of(), until);
        repository.save(sleep);
        return sleep;
    }

    @Test
    @DisplayName("Continuation is consumed only once")
    void consumeOnce() {
        WorkflowSleep sleep = saved(Instant.now().minusSeconds(1));

        assertThat(repository.tryConsume(sleep.id(), Instant.now())).isTrue();
        assertThat(repository.tryConsume(sleep.id(), Instant.now())).isFalse();
        assertThat(repository.tryConsume("unknown", Instant.now())).isFalse();
        assertThat(repository.findDue(Instant.now(), 10)).isEmpty();
    }

    @Test
    @DisplayName("Purge drops old consumed continuations and keeps pending and recent ones")
    void purgeConsumed() {
        Instant now = Instant.now();
        WorkflowSleep old = saved(now.minusSeconds(7200));
        WorkflowSleep recent = saved(now.minusSeconds(60));
        WorkflowSleep pending = saved(now.plusSeconds(3600));
        repository.tryConsume(old.id(), now.minusSeconds(3600));
        repository.tryConsume(recent.id(), now.minusSeconds(10));

        int purged = repository.deleteConsumedBefore(now.minusSeconds(600));

        assertThat(purged).isEqualTo(1);
        assertThat(repository.findById(old.id())).isEmpty();
        assertThat(repository.findById(recent.id())).isPresent();
        assertThat(repository.findById(pending.id())).isPresent();
        assertThat(repository.countPendingByRun("run-1")).isEqualTo(1);
    }
}
