package com.questrail.dfx.config;

import java.util.Optional;

/**
 * CredentialStore
 * -----------------------------------------------------------------------------
 * Cache of tokens obtained during authentication, so a restart does not
 * register the license or log the user in again.
 *
 * <p>Entries are keyed by server id, then license key. Each license holds one
 * device token and one user token per email address.</p>
 */
public interface CredentialStore
{
    Optional<String> deviceToken(String serverId, String licenseKey);

    void putDeviceToken(String serverId, String licenseKey, String deviceToken);

    Optional<String> userToken(String serverId, String licenseKey, String email);

    void putUserToken(String serverId, String licenseKey, String email, String userToken);

    void removeUserToken(String serverId, String licenseKey, String email);

    /**
     * Forget every cached credential.
     */
    void clear();
}
