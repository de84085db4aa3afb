package com.stashguard.identity;

/**
 * Resolves a caller credential to a stable player identifier.
 */
public interface IdentityVerifier {

    /**
     * Verifies a credential.
     *
     * @param credential the bearer credential, may be null when the caller sent none
     * @return the player identifier
     * @throws AuthenticationException if the credential is absent or not recognized
     */
    String verify(String credential) throws AuthenticationException;
}
