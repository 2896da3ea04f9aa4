package com.flowrunner.core.repository;

import com.flowrunner.core.model.Integration;
import com.flowrunner.core.model.IntegrationAccount;
import com.flowrunner.core.model.IntegrationAction;
import com.flowrunner.core.model.IntegrationTrigger;
import java.util.Optional;

/**
 * Read access to the integration catalog: integrations, their triggers and actions,
 * and integration accounts.
 */
public interface IntegrationCatalog {

    Optional<Integration> findIntegration(String integrationId);

    Optional<IntegrationTrigger> findTrigger(String integrationTriggerId);

    Optional<IntegrationAction> findAction(String integrationActionId);

    /**
     * Find an action by its operation key, as referenced by trigger populate extensions.
     */
    Optional<IntegrationAction> findActionByKey(String key);

    Optional<IntegrationAccount> findIntegrationAccount(String integrationAccountId);
}
