package com.questrail.dfx.config;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Credential cache that lives only as long as the process. Default when no
 * file is configured.
 */
public final class InMemoryCredentialStore implements CredentialStore
{
    private final Map<String, String> deviceTokens = new HashMap<>();
    private final Map<String, String> userTokens = new HashMap<>();

    @Override
    public synchronized Optional<String> deviceToken(String serverId, String licenseKey)
    {
        return Optional.ofNullable(deviceTokens.get(key(serverId, licenseKey)));
    }

    @Override
    public synchronized void putDeviceToken(String serverId, String licenseKey, String deviceToken)
    {
        Objects.requireNonNull(deviceToken, "deviceToken");
        deviceTokens.put(key(serverId, licenseKey), deviceToken);
    }

    @Override
    public synchronized Optional<String> userToken(String serverId, String licenseKey, String email)
    {
        return Optional.ofNullable(userTokens.get(key(serverId, licenseKey, email)));
    }

    @Override
    public synchronized void putUserToken(String serverId, String licenseKey, String email, String userToken)
    {
        Objects.requireNonNull(userToken, "userToken");
        userTokens.put(key(serverId, licenseKey, email), userToken);
    }

    @Override
    public synchronized void removeUserToken(String serverId, String licenseKey, String email)
    {
        userTokens.remove(key(serverId, licenseKey, email));
    }

    @Override
    public synchronized void clear()
    {
        deviceTokens.clear();
        userTokens.clear();
    }

    private static String key(String... parts)
    {
        for (String p : parts) {
            Objects.requireNonNull(p, "key part");
        }
        return String.join("\u0000", parts);
    }
}
