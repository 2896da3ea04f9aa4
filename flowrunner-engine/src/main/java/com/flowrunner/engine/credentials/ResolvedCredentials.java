package com.flowrunner.engine.credentials;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowrunner.core.model.AccountCredential;
import com.flowrunner.core.model.IntegrationAccount;

/**
 * Decrypted credentials for one operation call, with the records they came from.
 */
public record ResolvedCredentials(
    ObjectNode credentials,
    AccountCredential accountCredential,
    IntegrationAccount integrationAccount
) {
    public static ResolvedCredentials empty() {
        return new ResolvedCredentials(JsonNodeFactory.instance.objectNode(), null, null);
    }
}
