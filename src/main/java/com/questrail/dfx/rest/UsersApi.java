package com.questrail.dfx.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.dfx.model.UserProfile;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * User endpoints (2xx).
 */
public final class UsersApi
{
    private final DfxRestClient rest;

    public UsersApi(DfxRestClient rest)
    {
        this.rest = Objects.requireNonNull(rest, "rest");
    }

    /**
     * 200: create a user.
     *
     * @return the new user id
     * @throws DfxApiException carrying the server's code if no id is returned
     */
    public String create(String deviceToken, UserProfile user)
    {
        return rest.post("/users", user.toCreateRequest(), deviceToken).require("ID", "createUser");
    }

    /**
     * 201: log in.
     *
     * @return the user token
     * @throws DfxApiException carrying the server's code (e.g. {@code INVALID_USER})
     */
    public String login(String deviceToken, String email, String password)
    {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("Email", email);
        body.put("Password", password);
        return rest.post("/users/auth", body, deviceToken).require("Token", "login");
    }

    /** 202 */
    public JsonNode retrieve(String userToken)
    {
        return rest.get("/users", userToken).json();
    }

    /** 206 */
    public JsonNode remove(String userToken)
    {
        return rest.delete("/users", userToken).json();
    }

    /** 211 */
    public JsonNode getRole(String userToken)
    {
        return rest.get("/users/role", userToken).json();
    }
}
