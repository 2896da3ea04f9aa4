package com.flowrunner.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Stored credential material for an integration account.
 * fields holds non-secret values; encryptedCredentials holds the encrypted secret blob.
 */
public record AccountCredential(
    String id,
    String owner,
    String integrationAccountId,
    JsonNode fields,
    String encryptedCredentials
) {
    public AccountCredential withEncryptedCredentials(String encryptedCredentials) {
        return new AccountCredential(id, owner, integrationAccountId, fields, encryptedCredentials);
    }
}
