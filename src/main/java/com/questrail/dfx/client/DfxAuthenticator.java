package com.questrail.dfx.client;

import com.questrail.dfx.config.CredentialStore;
import com.questrail.dfx.model.DfxErrorCode;
import com.questrail.dfx.model.UserProfile;
import com.questrail.dfx.rest.DfxApiException;
import com.questrail.dfx.rest.OrganizationsApi;
import com.questrail.dfx.rest.UsersApi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * DfxAuthenticator
 * -----------------------------------------------------------------------------
 * Obtains and caches the two tokens the client needs.
 *
 * <ol>
 *   <li><b>Device token</b>: reused from the {@link CredentialStore} for this
 *       (server, license), otherwise obtained by registering the license.</li>
 *   <li><b>User token</b>: reused for (server, license, email), otherwise
 *       obtained by logging in. An unknown user is created first.</li>
 * </ol>
 */
public final class DfxAuthenticator
{
    private static final Logger log = LoggerFactory.getLogger(DfxAuthenticator.class);

    private final String serverId;
    private final String licenseKey;
    private final String deviceName;
    private final UserProfile user;
    private final CredentialStore store;
    private final OrganizationsApi organizations;
    private final UsersApi users;

    private String deviceToken;
    private String userToken;

    public DfxAuthenticator(String serverId,
                            String licenseKey,
                            String deviceName,
                            UserProfile user,
                            CredentialStore store,
                            OrganizationsApi organizations,
                            UsersApi users)
    {
        this.serverId = Objects.requireNonNull(serverId, "serverId");
        this.licenseKey = Objects.requireNonNull(licenseKey, "licenseKey");
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName");
        this.user = Objects.requireNonNull(user, "user");
        this.store = Objects.requireNonNull(store, "store");
        this.organizations = Objects.requireNonNull(organizations, "organizations");
        this.users = Objects.requireNonNull(users, "users");
    }

    /**
     * Ensure both tokens are available.
     *
     * @throws DfxAuthenticationException if either cannot be obtained
     */
    public synchronized void authenticate()
    {
        if (deviceToken == null) {
            deviceToken = resolveDeviceToken();
        }
        if (userToken == null) {
            Optional<String> cached = store.userToken(serverId, licenseKey, user.email());
            if (cached.isPresent()) {
                log.debug("Reusing cached user token for {}", user.email());
                userToken = cached.get();
            }
            else {
                userToken = login();
            }
        }
    }

    /**
     * Discard the user token and log in again. Used when the server reports
     * the current token as invalid.
     */
    public synchronized String refreshUserToken()
    {
        log.info("Refreshing user token for {}", user.email());
        store.removeUserToken(serverId, licenseKey, user.email());
        userToken = null;
        if (deviceToken == null) {
            deviceToken = resolveDeviceToken();
        }
        userToken = login();
        return userToken;
    }

    public synchronized String deviceToken()
    {
        if (deviceToken == null) {
            throw new IllegalStateException("authenticate() has not been called");
        }
        return deviceToken;
    }

    public synchronized String userToken()
    {
        if (userToken == null) {
            throw new IllegalStateException("authenticate() has not been called");
        }
        return userToken;
    }

    private String resolveDeviceToken()
    {
        Optional<String> cached = store.deviceToken(serverId, licenseKey);
        if (cached.isPresent()) {
            log.debug("Reusing cached device token for server {}", serverId);
            return cached.get();
        }

        String token;
        try {
            token = organizations.registerLicense(deviceName);
        }
        catch (DfxApiException e) {
            throw new DfxAuthenticationException(
                    "Registration error. Make sure your license key is valid for the selected server.", e);
        }
        log.info("Registered license on server {}", serverId);
        store.putDeviceToken(serverId, licenseKey, token);
        return token;
    }

    private String login()
    {
        String token;
        try {
            token = users.login(deviceToken, user.email(), user.password());
        }
        catch (DfxApiException e) {
            if (e.errorCode() == DfxErrorCode.INVALID_USER) {
                createUser();
                token = loginAfterCreate();
            }
            else if (e.errorCode() == DfxErrorCode.INVALID_PASSWORD) {
                throw new DfxAuthenticationException("Incorrect login password.", e);
            }
            else {
                throw new DfxAuthenticationException("Login failed for " + user.email(), e);
            }
        }
        store.putUserToken(serverId, licenseKey, user.email(), token);
        log.info("Logged in as {}", user.email());
        return token;
    }

    private void createUser()
    {
        try {
            String id = users.create(deviceToken, user);
            log.info("Created user {} ({})", user.email(), id);
        }
        catch (DfxApiException e) {
            throw new DfxAuthenticationException("Cannot create new user. Check your license permissions.", e);
        }
    }

    private String loginAfterCreate()
    {
        try {
            return users.login(deviceToken, user.email(), user.password());
        }
        catch (DfxApiException e) {
            throw new DfxAuthenticationException("Login failed for newly created user " + user.email(), e);
        }
    }
}
