package com.flowrunner.engine.operation;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowrunner.core.model.AccountCredential;
import com.flowrunner.core.model.Integration;
import com.flowrunner.core.model.IntegrationAccount;
import com.flowrunner.core.model.IntegrationOperation;

/**
 * Everything an operation invocation needs.
 */
public record OperationRequest(
    Integration integration,
    IntegrationAccount integrationAccount,
    IntegrationOperation operation,
    ObjectNode inputs,
    ObjectNode credentials,
    AccountCredential accountCredential
) {
    public OperationRequest withOperation(IntegrationOperation operation, ObjectNode inputs) {
        return new OperationRequest(integration, integrationAccount, operation, inputs,
            credentials, accountCredential);
    }
}
