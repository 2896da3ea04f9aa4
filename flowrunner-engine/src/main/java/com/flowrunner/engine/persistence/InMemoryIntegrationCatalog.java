package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.Integration;
import com.flowrunner.core.model.IntegrationAccount;
import com.flowrunner.core.model.IntegrationAction;
import com.flowrunner.core.model.IntegrationTrigger;
import com.flowrunner.core.repository.IntegrationCatalog;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory integration catalog, populated at startup from registered integration definitions.
 */
@Repository
public class InMemoryIntegrationCatalog implements IntegrationCatalog {

    private final Map<String, Integration> integrations = new ConcurrentHashMap<>();
    private final Map<String, IntegrationTrigger> triggers = new ConcurrentHashMap<>();
    private final Map<String, IntegrationAction> actions = new ConcurrentHashMap<>();
    private final Map<String, IntegrationAccount> accounts = new ConcurrentHashMap<>();

    public void register(Integration integration) {
        integrations.put(integration.id(), integration);
    }

    public void register(IntegrationTrigger trigger) {
        triggers.put(trigger.id(), trigger);
    }

    public void register(IntegrationAction action) {
        actions.put(action.id(), action);
    }

    public void register(IntegrationAccount account) {
        accounts.put(account.id(), account);
    }

    @Override
    public Optional<Integration> findIntegration(String integrationId) {
        return Optional.ofNullable(integrations.get(integrationId));
    }

    @Override
    public Optional<IntegrationTrigger> findTrigger(String integrationTriggerId) {
        return Optional.ofNullable(triggers.get(integrationTriggerId));
    }

    @Override
    public Optional<IntegrationAction> findAction(String integrationActionId) {
        return Optional.ofNullable(actions.get(integrationActionId));
    }

    @Override
    public Optional<IntegrationAction> findActionByKey(String key) {
        return actions.values().stream()
            .filter(a -> a.key().equals(key))
            .findFirst();
    }

    @Override
    public Optional<IntegrationAccount> findIntegrationAccount(String integrationAccountId) {
        return Optional.ofNullable(accounts.get(integrationAccountId));
    }
}
