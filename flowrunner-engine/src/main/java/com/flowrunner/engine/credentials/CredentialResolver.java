package com.flowrunner.engine.credentials;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowrunner.core.exception.CredentialException;
import com.flowrunner.core.exception.NotFoundException;
import com.flowrunner.core.exception.WorkflowConfigurationException;
import com.flowrunner.core.model.AccountCredential;
import com.flowrunner.core.model.IntegrationAccount;
import com.flowrunner.core.repository.AccountCredentialRepository;
import com.flowrunner.core.repository.IntegrationCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads, decrypts and merges stored credentials for an operation call.
 */
public class CredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(CredentialResolver.class);

    private final AccountCredentialRepository credentialRepository;
    private final IntegrationCatalog integrationCatalog;
    private final CredentialCipher cipher;
    private final ObjectMapper objectMapper;

    public CredentialResolver(
            AccountCredentialRepository credentialRepository,
            IntegrationCatalog integrationCatalog,
            CredentialCipher cipher,
            ObjectMapper objectMapper) {
        this.credentialRepository = credentialRepository;
        this.integrationCatalog = integrationCatalog;
        this.cipher = cipher;
        this.objectMapper = objectMapper;
    }

    /**
     * Resolve credentials for an operation call.
     * 
     * @param credentialsId Stored credential ID, may be null
     * @param onMissing Invoked before failing when the credential record does not exist
     * @return Merged credentials; decrypted values take precedence over plain fields
     * @throws NotFoundException if the credential record does not exist
     * @throws WorkflowConfigurationException if no credentials key is configured
     * @throws CredentialException if the stored secret cannot be decrypted
     */
    public ResolvedCredentials resolve(String credentialsId, Runnable onMissing) {
        if (credentialsId == null || credentialsId.isBlank()) {
            return ResolvedCredentials.empty();
        }

        AccountCredential accountCredential = credentialRepository.findById(credentialsId).orElse(null);
        if (accountCredential == null) {
            onMissing.run();
            throw new NotFoundException("Account credentials not found");
        }

        if (!cipher.isConfigured()) {
            throw new WorkflowConfigurationException("Credentials key not set");
        }

        ObjectNode credentials = objectMapper.createObjectNode();
        if (accountCredential.fields() != null && accountCredential.fields().isObject()) {
            credentials.setAll((ObjectNode) accountCredential.fields());
        }
        JsonNode decrypted = decrypt(accountCredential);
        if (decrypted.isObject()) {
            credentials.setAll((ObjectNode) decrypted);
        }

        IntegrationAccount integrationAccount = null;
        if (accountCredential.integrationAccountId() != null) {
            integrationAccount = integrationCatalog
                .findIntegrationAccount(accountCredential.integrationAccountId())
                .orElse(null);
        }

        return new ResolvedCredentials(credentials, accountCredential, integrationAccount);
    }

    /**
     * Persist credentials refreshed by an operation, e.g. a rotated OAuth token.
     */
    public void storeRefreshed(ResolvedCredentials resolved, ObjectNode refreshedCredentials) {
        AccountCredential accountCredential = resolved.accountCredential();
        if (accountCredential == null || refreshedCredentials == null || refreshedCredentials.isEmpty()) {
            return;
        }
        ObjectNode secrets = objectMapper.createObjectNode();
        JsonNode current = decrypt(accountCredential);
        if (current.isObject()) {
            secrets.setAll((ObjectNode) current);
        }
        secrets.setAll(refreshedCredentials);
        try {
            credentialRepository.updateEncryptedCredentials(
                accountCredential.id(), cipher.encrypt(objectMapper.writeValueAsString(secrets)));
            log.debug("Stored refreshed credentials for {}", accountCredential.id());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize refreshed credentials", e);
        }
    }

    private JsonNode decrypt(AccountCredential accountCredential) {
        if (accountCredential.encryptedCredentials() == null || accountCredential.encryptedCredentials().isEmpty()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(cipher.decrypt(accountCredential.encryptedCredentials()));
        } catch (JsonProcessingException e) {
            throw new CredentialException(
                "Stored credentials " + accountCredential.id() + " are not valid JSON", e);
        } catch (IllegalArgumentException e) {
            throw new CredentialException(
                "Stored credentials " + accountCredential.id() + " cannot be decrypted: " + e.getMessage(), e);
        }
    }
}
