package com.questrail.dfx.client;

import com.questrail.dfx.config.InMemoryCredentialStore;
import com.questrail.dfx.model.UserProfile;
import com.questrail.dfx.rest.DfxRestClient;
import com.questrail.dfx.rest.OrganizationsApi;
import com.questrail.dfx.rest.UsersApi;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class DfxAuthenticatorTest
{
    private static final String EMAIL = "a@b.c";

    private MockWebServer server;
    private InMemoryCredentialStore store;
    private DfxAuthenticator authenticator;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        store = new InMemoryCredentialStore();
        DfxRestClient rest = new DfxRestClient(server.url("/").toString());
        authenticator = new DfxAuthenticator("qa", "L1", "rig", UserProfile.of(EMAIL, "pw"), store,
                new OrganizationsApi(rest, "L1"), new UsersApi(rest));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private void respond(int status, String body) {
        server.enqueue(new MockResponse().setResponseCode(status).setBody(body));
    }

    // ---------------------------------------------------------------------
    // Happy paths
    // ---------------------------------------------------------------------

    @Test
    void registersAndLogsInOnFirstUse() throws Exception {
        respond(200, "{\"Token\":\"dev\"}");
        respond(200, "{\"Token\":\"usr\"}");

        authenticator.authenticate();

        assertEquals("dev", authenticator.deviceToken());
        assertEquals("usr", authenticator.userToken());
        assertEquals("dev", store.deviceToken("qa", "L1").orElseThrow());
        assertEquals("usr", store.userToken("qa", "L1", EMAIL).orElseThrow());

        assertEquals("/organizations/licenses", server.takeRequest().getPath());
        assertEquals("Bearer dev", server.takeRequest().getHeader("Authorization"));
    }

    @Test
    void cachedTokensAvoidNetwork() {
        store.putDeviceToken("qa", "L1", "dev");
        store.putUserToken("qa", "L1", EMAIL, "usr");

        authenticator.authenticate();

        assertEquals("usr", authenticator.userToken());
        assertEquals(0, server.getRequestCount());
    }

    @Test
    void unknownUserIsCreatedThenLoggedIn() throws Exception {
        store.putDeviceToken("qa", "L1", "dev");
        respond(400, "{\"Code\":\"INVALID_USER\"}");
        respond(200, "{\"ID\":\"user-1\"}");
        respond(200, "{\"Token\":\"usr\"}");

        authenticator.authenticate();

        assertEquals("usr", authenticator.userToken());
        assertEquals("/users/auth", server.takeRequest().getPath());
        assertEquals("/users", server.takeRequest().getPath());
        assertEquals("/users/auth", server.takeRequest().getPath());
    }

    @Test
    void refreshDiscardsCachedUserToken() {
        store.putDeviceToken("qa", "L1", "dev");
        store.putUserToken("qa", "L1", EMAIL, "stale");
        authenticator.authenticate();
        respond(200, "{\"Token\":\"fresh\"}");

        assertEquals("fresh", authenticator.refreshUserToken());
        assertEquals("fresh", authenticator.userToken());
        assertEquals("fresh", store.userToken("qa", "L1", EMAIL).orElseThrow());
    }

    // ---------------------------------------------------------------------
    // Failures
    // ---------------------------------------------------------------------

    @Test
    void wrongPasswordIsReported() {
        store.putDeviceToken("qa", "L1", "dev");
        respond(400, "{\"Code\":\"INVALID_PASSWORD\"}");

        DfxAuthenticationException e = assertThrows(DfxAuthenticationException.class, authenticator::authenticate);
        assertEquals("Incorrect login password.", e.getMessage());
        assertTrue(store.userToken("qa", "L1", EMAIL).isEmpty());
    }

    @Test
    void registrationFailureIsReported() {
        respond(400, "{\"Code\":\"INVALID_LICENSE\"}");

        DfxAuthenticationException e = assertThrows(DfxAuthenticationException.class, authenticator::authenticate);
        assertTrue(e.getMessage().startsWith("Registration error"));
        assertTrue(store.deviceToken("qa", "L1").isEmpty());
    }

    @Test
    void userCreationFailureIsReported() {
        store.putDeviceToken("qa", "L1", "dev");
        respond(400, "{\"Code\":\"INVALID_USER\"}");
        respond(403, "{\"Code\":\"FORBIDDEN\"}");

        DfxAuthenticationException e = assertThrows(DfxAuthenticationException.class, authenticator::authenticate);
        assertTrue(e.getMessage().startsWith("Cannot create new user"));
    }

    @Test
    void tokensAreUnavailableBeforeAuthenticate() {
        assertThrows(IllegalStateException.class, authenticator::deviceToken);
        assertThrows(IllegalStateException.class, authenticator::userToken);
    }
}
