package com.courtcapture.capture.model;

/**
 * A resolved credential with its decrypted secret. {@link #toString()} never prints the secret.
 */
public record CredentialContext(
    long credentialId,
    long tenantId,
    String court,
    Degree degree,
    String login,
    String secret
) {
    public CredentialKey key() {
        return new CredentialKey(tenantId, court, degree);
    }

    public CourtCombination combination() {
        return new CourtCombination(court, degree);
    }

    @Override
    public String toString() {
        return "CredentialContext[credentialId=" + credentialId
            + ", tenantId=" + tenantId
            + ", court=" + court
            + ", degree=" + degree
            + ", login=***, secret=***]";
    }
}
