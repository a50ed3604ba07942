package com.questrail.dfx.config;

import java.net.URI;
import java.util.Objects;

/**
 * Resolved addresses of one DFX deployment.
 *
 * <p>Normally obtained from {@link DfxServer#endpoints()}. Tests point the
 * client at local servers by building one directly.</p>
 *
 * @param serverId key used for credential caching
 * @param restUrl base URL of the REST API, without a trailing slash
 * @param webSocketUri address of the WebSocket API
 */
public record DfxEndpoints(String serverId, String restUrl, URI webSocketUri) {
    public DfxEndpoints {
        Objects.requireNonNull(serverId, "serverId");
        Objects.requireNonNull(restUrl, "restUrl");
        Objects.requireNonNull(webSocketUri, "webSocketUri");
        while (restUrl.endsWith("/")) {
            restUrl = restUrl.substring(0, restUrl.length() - 1);
        }
    }
}
