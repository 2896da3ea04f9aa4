package com.flowrunner.engine.persistence;

import com.flowrunner.core.model.AccountCredential;
import com.flowrunner.core.repository.AccountCredentialRepository;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of AccountCredentialRepository.
 */
@Repository
public class InMemoryAccountCredentialRepository implements AccountCredentialRepository {

    private final Map<String, AccountCredential> credentials = new ConcurrentHashMap<>();

    @Override
    public void save(AccountCredential credential) {
        credentials.put(credential.id(), credential);
    }

    @Override
    public Optional<AccountCredential> findById(String credentialId) {
        return Optional.ofNullable(credentials.get(credentialId));
    }

    @Override
    public void updateEncryptedCredentials(String credentialId, String encryptedCredentials) {
        credentials.computeIfPresent(credentialId,
            (id, credential) -> credential.withEncryptedCredentials(encryptedCredentials));
    }
}
