package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.ExecutionLease;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("InMemoryLeaseRepository")
class InMemoryLeaseRepositoryTest {

    private final InMemoryLeaseRepository repository = new InMemoryLeaseRepository();

    @Test
    @DisplayName("Only one of many concurrent checks gets the lease")
    void concurrentAcquireIsExclusive() throws Exception {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<ExecutionLease>>> results = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String name = "runner-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return repository.acquire("trigger1", UUID.randomUUID(), name, Duration.ofMinutes(5));
                }));
            }
            start.countDown();

            int acquired = 0;
            for (Future<Optional<ExecutionLease>> result : results) {
                if (result.get(5, TimeUnit.SECONDS).isPresent()) {
                    acquired++;
                }
            }
            assertThat(acquired).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Release keeps the row so the next fence token continues")
    void releaseKeepsFenceToken() {
        ExecutionLease first = repository.acquire("trigger1", UUID.randomUUID(), "runner-a", Duration.ofMinutes(5))
            .orElseThrow();

        assertThat(repository.release(first)).isTrue();
        assertThat(repository.release(first)).isFalse();

        ExecutionLease second = repository.acquire("trigger1", UUID.randomUUID(), "runner-b", Duration.ofMinutes(5))
            .orElseThrow();
        assertThat(second.fenceToken()).isEqualTo(2);
    }

    @Test
    @DisplayName("Expired lease is taken over and the stale holder cannot release it")
    void expiredLeaseTakeover() throws InterruptedException {
        ExecutionLease stale = repository.acquire("trigger1", UUID.randomUUID(), "runner-a", Duration.ofMillis(20))
            .orElseThrow();
        Thread.sleep(60);

        ExecutionLease current = repository.acquire("trigger1", UUID.randomUUID(), "runner-b", Duration.ofMinutes(5))
            .orElseThrow();

        assertThat(repository.release(stale)).isFalse();
        assertThat(repository.findByTrigger("trigger1")).contains(current);
    }
}
