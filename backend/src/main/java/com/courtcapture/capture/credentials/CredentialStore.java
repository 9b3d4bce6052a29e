package com.courtcapture.capture.credentials;

import com.courtcapture.capture.model.CredentialContext;
import com.courtcapture.capture.model.Degree;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Source of truth for tenant credentials. Secrets come back decrypted.
 */
public interface CredentialStore {

    Optional<CredentialContext> findById(long credentialId);

    /**
     * Active credentials of one tenant whose court is in {@code courts} and degree in {@code degrees}.
     */
    List<CredentialContext> findActiveBatch(long tenantId, Collection<String> courts, Collection<Degree> degrees);
}
