package com.flowrunner.runner.config;

import com.flowrunner.core.model.ExecutionLease;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalized configuration of the runner, bound from the {@code flowrunner.*} namespace.
 *
 * @param credentials credential decryption settings
 * @param executor    branch execution pool
 * @param lease       trigger lease settings
 * @param trigger     trigger polling settings
 * @param continuation continuation sweep settings
 * @param persistence repository backend
 */
@ConfigurationProperties(prefix = "flowrunner")
public record RunnerProperties(
        Credentials credentials,
        Executor executor,
        Lease lease,
        Trigger trigger,
        Continuation continuation,
        Persistence persistence) {

    public RunnerProperties {
        credentials = credentials != null ? credentials : new Credentials(null);
        executor = executor != null ? executor : new Executor(0);
        lease = lease != null ? lease : new Lease(null, null);
        trigger = trigger != null ? trigger : new Trigger(null, true);
        continuation = continuation != null ? continuation : new Continuation(null);
        persistence = persistence != null ? persistence : new Persistence(null);
    }

    /**
     * @param aesKey passphrase of stored credential secrets; empty disables decryption
     */
    public record Credentials(String aesKey) {}

    /**
     * @param poolSize threads executing action branches
     */
    public record Executor(int poolSize) {
        public Executor {
            poolSize = poolSize > 0 ? poolSize : 16;
        }
    }

    /**
     * @param duration      how long a trigger check may hold its lease
     * @param holderName    identifies this runner in lease records
     */
    public record Lease(Duration duration, String holderName) {
        public Lease {
            duration = duration != null ? duration : ExecutionLease.DEFAULT_DURATION;
            holderName = holderName != null ? holderName : "localhost";
        }
    }

    /**
     * @param pollInterval   delay between trigger poll rounds
     * @param pollingEnabled whether enabled triggers are polled at all
     */
    public record Trigger(Duration pollInterval, boolean pollingEnabled) {
        public Trigger {
            pollInterval = pollInterval != null ? pollInterval : Duration.ofMinutes(1);
        }
    }

    /**
     * @param sweepInterval delay between sweeps of due continuations
     */
    public record Continuation(Duration sweepInterval) {
        public Continuation {
            sweepInterval = sweepInterval != null ? sweepInterval : Duration.ofSeconds(30);
        }
    }

    /**
     * @param mode memory keeps everything in process; jdbc stores continuations and leases in PostgreSQL
     */
    public record Persistence(PersistenceMode mode) {
        public Persistence {
            mode = mode != null ? mode : PersistenceMode.MEMORY;
        }
    }

    public enum PersistenceMode {
        MEMORY,
        JDBC
    }
}
