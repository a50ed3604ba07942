package com.questrail.dfx.config;

import java.net.URI;
import java.util.Locale;

/**
 * DFX API deployments this client can talk to.
 */
public enum DfxServer
{
    QA("qa", "https://qa.api.deepaffex.ai:9443", "wss://qa.api.deepaffex.ai:9080"),
    DEV("dev", "https://dev.api.deepaffex.ai:9443", "wss://dev.api.deepaffex.ai:9080"),
    DEMO("demo", "https://demo.api.deepaffex.ai:9443", "wss://demo.api.deepaffex.ai:9080"),
    PROD("prod", "https://api.deepaffex.ai:9443", "wss://api.deepaffex.ai:9080"),
    PROD_CN("prod-cn", "https://api.deepaffex.cn:9443", "wss://api.deepaffex.cn:9080"),
    DEMO_CN("demo-cn", "https://demo.api.deepaffex.cn:9443", "wss://demo.api.deepaffex.cn:9080");

    private final String id;
    private final String restUrl;
    private final String webSocketUrl;

    DfxServer(String id, String restUrl, String webSocketUrl) {
        this.id = id;
        this.restUrl = restUrl;
        this.webSocketUrl = webSocketUrl;
    }

    /** Short identifier, also the key under which credentials are cached. */
    public String id() {
        return id;
    }

    public String restUrl() {
        return restUrl;
    }

    public URI webSocketUri() {
        return URI.create(webSocketUrl);
    }

    public DfxEndpoints endpoints() {
        return new DfxEndpoints(id, restUrl, webSocketUri());
    }

    /**
     * Looks up a server by its identifier, case-insensitively.
     *
     * @throws IllegalArgumentException for an unknown id
     */
    public static DfxServer fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (DfxServer s : values()) {
                if (s.id.equals(normalized)) {
                    return s;
                }
            }
        }
        throw new IllegalArgumentException("Invalid server ID given: " + id);
    }

    public static boolean isKnownId(String id) {
        for (DfxServer s : values()) {
            if (s.id.equals(id)) {
                return true;
            }
        }
        return false;
    }
}
