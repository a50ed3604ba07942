package com.questrail.dfx.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * JsonFileCredentialStore
 * -----------------------------------------------------------------------------
 * Credential cache persisted as a JSON file.
 *
 * <h2>Layout</h2>
 * <pre>
 *   {
 *     "&lt;server&gt;": {
 *       "&lt;license key&gt;": {
 *         "device_token": "...",
 *         "&lt;email&gt;": { "user_token": "..." }
 *       }
 *     }
 *   }
 * </pre>
 *
 * <p>Every write prunes empty objects, blank keys and empty strings, and drops
 * servers not in the known set. The file is created on first write. Each call
 * re-reads the file, so several clients may share it sequentially.</p>
 */
public final class JsonFileCredentialStore implements CredentialStore
{
    static final String DEVICE_TOKEN = "device_token";
    static final String USER_TOKEN = "user_token";

    private final Path file;
    private final Predicate<String> knownServer;
    private final ObjectMapper mapper = new ObjectMapper();

    public JsonFileCredentialStore(Path file)
    {
        this(file, DfxServer::isKnownId);
    }

    /**
     * @param knownServers server ids kept on write; all others are dropped
     */
    public JsonFileCredentialStore(Path file, Set<String> knownServers)
    {
        this(file, Set.copyOf(knownServers)::contains);
    }

    private JsonFileCredentialStore(Path file, Predicate<String> knownServer)
    {
        this.file = Objects.requireNonNull(file, "file");
        this.knownServer = knownServer;
    }

    public Path file()
    {
        return file;
    }

    @Override
    public synchronized Optional<String> deviceToken(String serverId, String licenseKey)
    {
        return text(read().path(serverId).path(licenseKey).path(DEVICE_TOKEN));
    }

    @Override
    public synchronized void putDeviceToken(String serverId, String licenseKey, String deviceToken)
    {
        Objects.requireNonNull(deviceToken, "deviceToken");
        ObjectNode root = read();
        license(root, serverId, licenseKey).put(DEVICE_TOKEN, deviceToken);
        write(root);
    }

    @Override
    public synchronized Optional<String> userToken(String serverId, String licenseKey, String email)
    {
        return text(read().path(serverId).path(licenseKey).path(email).path(USER_TOKEN));
    }

    @Override
    public synchronized void putUserToken(String serverId, String licenseKey, String email, String userToken)
    {
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(userToken, "userToken");
        ObjectNode root = read();
        child(license(root, serverId, licenseKey), email).put(USER_TOKEN, userToken);
        write(root);
    }

    @Override
    public synchronized void removeUserToken(String serverId, String licenseKey, String email)
    {
        ObjectNode root = read();
        JsonNode user = root.path(serverId).path(licenseKey).path(email);
        if (user.isObject()) {
            ((ObjectNode) user).remove(USER_TOKEN);
            write(root);
        }
    }

    @Override
    public synchronized void clear()
    {
        write(mapper.createObjectNode());
    }

    // -------------------------------------------------------------------------

    private ObjectNode license(ObjectNode root, String serverId, String licenseKey)
    {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(licenseKey, "licenseKey");
        return child(child(root, serverId), licenseKey);
    }

    private static ObjectNode child(ObjectNode parent, String name)
    {
        JsonNode existing = parent.get(name);
        if (existing instanceof ObjectNode) {
            return (ObjectNode) existing;
        }
        return parent.putObject(name);
    }

    private ObjectNode read()
    {
        if (!Files.exists(file)) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode node = mapper.readTree(file.toFile());
            return node instanceof ObjectNode ? (ObjectNode) node : mapper.createObjectNode();
        }
        catch (IOException e) {
            throw new CredentialStoreException("Unable to read credentials from " + file, e);
        }
    }

    private void write(ObjectNode root)
    {
        prune(root);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(file.toFile(), root);
        }
        catch (IOException e) {
            throw new CredentialStoreException("Unable to write credentials to " + file, e);
        }
    }

    private void prune(ObjectNode root)
    {
        List<String> servers = new ArrayList<>();
        root.fieldNames().forEachRemaining(servers::add);
        for (String server : servers) {
            if (!knownServer.test(server)) {
                root.remove(server);
            }
        }
        pruneEmpty(root);
    }

    /**
     * Removes blank keys, empty strings and (recursively) empty objects.
     */
    private static void pruneEmpty(ObjectNode node)
    {
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode value = e.getValue();
            if (e.getKey().isBlank()) {
                it.remove();
                continue;
            }
            if (value.isObject()) {
                pruneEmpty((ObjectNode) value);
                if (value.isEmpty()) {
                    it.remove();
                }
            }
            else if (value.isTextual() && value.asText().isEmpty()) {
                it.remove();
            }
        }
    }

    private static Optional<String> text(JsonNode node)
    {
        if (node.isTextual() && !node.asText().isEmpty()) {
            return Optional.of(node.asText());
        }
        return Optional.empty();
    }
}
