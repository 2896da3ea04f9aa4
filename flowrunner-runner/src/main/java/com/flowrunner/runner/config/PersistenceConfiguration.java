package com.flowrunner.runner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowrunner.core.repository.AccountCredentialRepository;
import com.flowrunner.core.repository.LeaseRepository;
import com.flowrunner.core.repository.WorkflowActionRepository;
import com.flowrunner.core.repository.WorkflowRepository;
import com.flowrunner.core.repository.WorkflowRunActionRepository;
import com.flowrunner.core.repository.WorkflowRunRepository;
import com.flowrunner.core.repository.WorkflowSleepRepository;
import com.flowrunner.core.repository.WorkflowTriggerRepository;
import com.flowrunner.engine.persistence.InMemoryAccountCredentialRepository;
import com.flowrunner.engine.persistence.InMemoryIntegrationCatalog;
import com.flowrunner.engine.persistence.InMemoryLeaseRepository;
import com.flowrunner.engine.persistence.InMemoryWorkflowActionRepository;
import com.flowrunner.engine.persistence.InMemoryWorkflowRepository;
import com.flowrunner.engine.persistence.InMemoryWorkflowRunActionRepository;
import com.flowrunner.engine.persistence.InMemoryWorkflowRunRepository;
import com.flowrunner.engine.persistence.InMemoryWorkflowSleepRepository;
import com.flowrunner.engine.persistence.InMemoryWorkflowTriggerRepository;
import com.flowrunner.engine.persistence.jdbc.JdbcLeaseRepository;
import com.flowrunner.engine.persistence.jdbc.JdbcWorkflowSleepRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Repository wiring. Continuations and trigger leases move to PostgreSQL when
 * {@code flowrunner.persistence.mode=jdbc}; every other record stays in memory.
 */
@Configuration
public class PersistenceConfiguration {

    @Bean
    public WorkflowRepository workflowRepository() {
        return new InMemoryWorkflowRepository();
    }

    @Bean
    public WorkflowTriggerRepository workflowTriggerRepository() {
        return new InMemoryWorkflowTriggerRepository();
    }

    @Bean
    public WorkflowActionRepository workflowActionRepository() {
        return new InMemoryWorkflowActionRepository();
    }

    @Bean
    public WorkflowRunRepository workflowRunRepository() {
        return new InMemoryWorkflowRunRepository();
    }

    @Bean
    public WorkflowRunActionRepository workflowRunActionRepository() {
        return new InMemoryWorkflowRunActionRepository();
    }

    @Bean
    public AccountCredentialRepository accountCredentialRepository() {
        return new InMemoryAccountCredentialRepository();
    }

    @Bean
    public InMemoryIntegrationCatalog integrationCatalog() {
        return new InMemoryIntegrationCatalog();
    }

    @Configuration
    @ConditionalOnProperty(prefix = "flowrunner.persistence", name = "mode", havingValue = "memory", matchIfMissing = true)
    static class InMemory {

        @Bean
        public WorkflowSleepRepository workflowSleepRepository() {
            return new InMemoryWorkflowSleepRepository();
        }

        @Bean
        public LeaseRepository leaseRepository() {
            return new InMemoryLeaseRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "flowrunner.persistence", name = "mode", havingValue = "jdbc")
    static class Jdbc {

        @Bean
        public WorkflowSleepRepository workflowSleepRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            return new JdbcWorkflowSleepRepository(jdbcTemplate, objectMapper);
        }

        @Bean
        public LeaseRepository leaseRepository(JdbcTemplate jdbcTemplate) {
            return new JdbcLeaseRepository(jdbcTemplate);
        }
    }
}
