package com.questrail.dfx.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrganizationsApiTest
{
    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private OrganizationsApi api;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        api = new OrganizationsApi(new DfxRestClient(server.url("/").toString()), "LICENSE-1");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void registerLicenseSendsDeviceIdentityAndReturnsToken() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"Token\":\"device-tok\",\"DeviceID\":\"d1\"}"));

        String token = api.registerLicense("Bench rig");

        assertEquals("device-tok", token);
        RecordedRequest request = server.takeRequest();
        assertEquals("/organizations/licenses", request.getPath());
        assertNull(request.getHeader("Authorization"));
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("LICENSE-1", body.get("Key").asText());
        assertEquals("LINUX", body.get("DeviceTypeID").asText());
        assertEquals("Bench rig", body.get("Name").asText());
        assertEquals("DFXCLIENT", body.get("Identifier").asText());
        assertEquals("1.0.0", body.get("Version").asText());
    }

    @Test
    void registerLicenseWithoutTokenFails() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"Code\":\"INVALID_LICENSE\"}"));

        DfxApiException e = assertThrows(DfxApiException.class, () -> api.registerLicense("rig"));
        assertEquals(400, e.httpStatus());
    }

    @Test
    void createUserSendsFieldsAsStrings() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"ID\":\"u1\"}"));
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("Email", "a@b.c");
        user.put("HeightCm", 180);

        JsonNode json = api.createUser("device-tok", user);

        assertEquals("u1", json.get("ID").asText());
        RecordedRequest request = server.takeRequest();
        assertEquals("/organizations/users", request.getPath());
        assertEquals("Bearer device-tok", request.getHeader("Authorization"));
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertTrue(body.get("HeightCm").isTextual());
        assertEquals("180", body.get("HeightCm").asText());
    }

    @Test
    void loginSendsCredentialsAndOrganization() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"Token\":\"org-user-tok\"}"));

        JsonNode json = api.login("device-tok", "a@b.c", "pw", "org-1");

        assertEquals("org-user-tok", json.get("Token").asText());
        RecordedRequest request = server.takeRequest();
        assertEquals("/organizations/auth", request.getPath());
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals("a@b.c", body.get("Email").asText());
        assertEquals("pw", body.get("Password").asText());
        assertEquals("org-1", body.get("Identifier").asText());
    }
}
