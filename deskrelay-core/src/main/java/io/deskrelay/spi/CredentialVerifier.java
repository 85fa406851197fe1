package io.deskrelay.spi;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves a bearer credential presented when a realtime connection is opened.
 *
 * <p>Token issuance and signature checks are the integrator's concern; this
 * library only needs the user the credential belongs to.
 */
@FunctionalInterface
public interface CredentialVerifier {

    /**
     * Returns the authenticated user id, or empty if the credential is invalid or expired.
     *
     * @param credential the raw credential, never {@code null}
     */
    Optional<UUID> verify(String credential);
}
