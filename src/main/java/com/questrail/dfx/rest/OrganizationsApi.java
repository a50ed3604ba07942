package com.questrail.dfx.rest;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Organization endpoints (7xx).
 */
public final class OrganizationsApi
{
    static final String DEVICE_TYPE = "LINUX";
    static final String CLIENT_IDENTIFIER = "DFXCLIENT";
    static final String CLIENT_VERSION = "1.0.0";

    private final DfxRestClient rest;
    private final String licenseKey;

    public OrganizationsApi(DfxRestClient rest, String licenseKey)
    {
        this.rest = Objects.requireNonNull(rest, "rest");
        this.licenseKey = Objects.requireNonNull(licenseKey, "licenseKey");
    }

    /**
     * 705: register this device against the license.
     *
     * @return the device token
     * @throws DfxApiException if no token is returned
     */
    public String registerLicense(String deviceName)
    {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("Key", licenseKey);
        body.put("DeviceTypeID", DEVICE_TYPE);
        body.put("Name", deviceName);
        body.put("Identifier", CLIENT_IDENTIFIER);
        body.put("Version", CLIENT_VERSION);

        return rest.post("/organizations/licenses", body, null).require("Token", "registerLicense");
    }

    /**
     * 713: create a user within the organization.
     */
    public JsonNode createUser(String token, Map<String, Object> user)
    {
        Map<String, Object> body = new LinkedHashMap<>();
        user.forEach((k, v) -> body.put(k, v == null ? "" : String.valueOf(v)));
        return rest.post("/organizations/users", body, token).json();
    }

    /**
     * 717: log in to the organization.
     */
    public JsonNode login(String token, String email, String password, String organizationId)
    {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("Email", email);
        body.put("Password", password);
        body.put("Identifier", organizationId);
        return rest.post("/organizations/auth", body, token).json();
    }
}
