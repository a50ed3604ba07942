package com.questrail.dfx.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileCredentialStoreTest
{
    @TempDir
    Path dir;

    @Test
    void missingFileHasNoTokens() {
        JsonFileCredentialStore store = new JsonFileCredentialStore(dir.resolve("config.json"));

        assertEquals(Optional.empty(), store.deviceToken("prod", "L1"));
        assertEquals(Optional.empty(), store.userToken("prod", "L1", "a@b.c"));
    }

    @Test
    void tokensArePersistedUnderServerAndLicense() throws Exception {
        Path file = dir.resolve("nested").resolve("config.json");
        JsonFileCredentialStore store = new JsonFileCredentialStore(file);

        store.putDeviceToken("prod", "L1", "dev-tok");
        store.putUserToken("prod", "L1", "a@b.c", "user-tok");

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertEquals("dev-tok", root.get("prod").get("L1").get("device_token").asText());
        assertEquals("user-tok", root.get("prod").get("L1").get("a@b.c").get("user_token").asText());

        JsonFileCredentialStore reopened = new JsonFileCredentialStore(file);
        assertEquals("dev-tok", reopened.deviceToken("prod", "L1").orElseThrow());
        assertEquals("user-tok", reopened.userToken("prod", "L1", "a@b.c").orElseThrow());
    }

    @Test
    void removingUserTokenPrunesEmptyUser() throws Exception {
        Path file = dir.resolve("config.json");
        JsonFileCredentialStore store = new JsonFileCredentialStore(file);
        store.putDeviceToken("prod", "L1", "dev-tok");
        store.putUserToken("prod", "L1", "a@b.c", "user-tok");

        store.removeUserToken("prod", "L1", "a@b.c");

        JsonNode license = new ObjectMapper().readTree(file.toFile()).get("prod").get("L1");
        assertNull(license.get("a@b.c"));
        assertEquals("dev-tok", license.get("device_token").asText());
    }

    @Test
    void unknownServersAndEmptyValuesAreDroppedOnWrite() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{\"staging\":{\"L1\":{\"device_token\":\"x\"}},"
                + "\"prod\":{\"\":{\"device_token\":\"y\"},\"L2\":{\"device_token\":\"\"}}}");
        JsonFileCredentialStore store = new JsonFileCredentialStore(file);

        store.putDeviceToken("qa", "L1", "qa-tok");

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertNull(root.get("staging"));
        assertNull(root.get("prod"));
        assertEquals("qa-tok", root.get("qa").get("L1").get("device_token").asText());
    }

    @Test
    void customKnownServerSet() throws Exception {
        Path file = dir.resolve("config.json");
        JsonFileCredentialStore store = new JsonFileCredentialStore(file, Set.of("local"));

        store.putDeviceToken("local", "L1", "tok");
        store.putDeviceToken("prod", "L1", "dropped");

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        assertNotNull(root.get("local"));
        assertNull(root.get("prod"));
    }

    @Test
    void clearEmptiesTheFile() throws Exception {
        Path file = dir.resolve("config.json");
        JsonFileCredentialStore store = new JsonFileCredentialStore(file);
        store.putDeviceToken("prod", "L1", "dev-tok");

        store.clear();

        assertEquals(0, new ObjectMapper().readTree(file.toFile()).size());
        assertEquals(Optional.empty(), store.deviceToken("prod", "L1"));
    }

    @Test
    void unreadableFileIsReported() throws Exception {
        Path file = dir.resolve("config.json");
        Files.writeString(file, "{not json");
        JsonFileCredentialStore store = new JsonFileCredentialStore(file);

        assertThrows(CredentialStoreException.class, () -> store.deviceToken("prod", "L1"));
    }
}
