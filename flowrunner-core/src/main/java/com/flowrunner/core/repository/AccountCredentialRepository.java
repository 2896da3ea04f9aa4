package com.flowrunner.core.repository;

import com.flowrunner.core.model.AccountCredential;
import java.util.Optional;

/**
 * Credential store. Holds encrypted credential material per account.
 */
public interface AccountCredentialRepository {

    void save(AccountCredential credential);

    Optional<AccountCredential> findById(String credentialId);

    /**
     * Replace the encrypted secret blob of a credential, e.g. after a token refresh.
     */
    void updateEncryptedCredentials(String credentialId, String encryptedCredentials);
}
