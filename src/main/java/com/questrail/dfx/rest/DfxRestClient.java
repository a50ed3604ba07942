package com.questrail.dfx.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * DfxRestClient
 * -----------------------------------------------------------------------------
 * Thin JSON-over-HTTPS helper shared by the REST API wrappers.
 *
 * <p>Requests carry {@code Content-Type: application/json} and, when a token is
 * supplied, {@code Authorization: Bearer <token>}. Every status code is
 * returned to the caller; only I/O failures throw.</p>
 */
public final class DfxRestClient
{
    private static final Logger log = LoggerFactory.getLogger(DfxRestClient.class);

    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json; charset=utf-8");

    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;

    public DfxRestClient(String baseUrl)
    {
        this(baseUrl, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(60))
                .build());
    }

    public DfxRestClient(String baseUrl, OkHttpClient httpClient)
    {
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.mapper = new ObjectMapper();
    }

    public ObjectMapper mapper()
    {
        return mapper;
    }

    public DfxRestResponse get(String path, String token)
    {
        return execute("GET", path, null, token);
    }

    public DfxRestResponse post(String path, Object body, String token)
    {
        return execute("POST", path, body, token);
    }

    public DfxRestResponse delete(String path, String token)
    {
        return execute("DELETE", path, null, token);
    }

    private DfxRestResponse execute(String method, String path, Object body, String token)
    {
        HttpUrl url = HttpUrl.parse(baseUrl + path);
        if (url == null) {
            throw new IllegalArgumentException("Invalid URL: " + baseUrl + path);
        }

        RequestBody requestBody = null;
        if (body != null) {
            try {
                requestBody = RequestBody.create(mapper.writeValueAsBytes(body), JSON_MEDIA_TYPE);
            }
            catch (JsonProcessingException e) {
                throw new DfxApiException("Unable to serialize " + method + " " + path + " body", e);
            }
        }

        Request.Builder request = new Request.Builder()
                .url(url)
                .method(method, requestBody)
                .header("Content-Type", "application/json");
        if (token != null && !token.isEmpty()) {
            request.header("Authorization", "Bearer " + token);
        }

        log.debug("{} {}", method, path);
        try (Response response = httpClient.newCall(request.build()).execute()) {
            ResponseBody responseBody = response.body();
            String raw = responseBody == null ? "" : responseBody.string();
            log.debug("{} {} -> {}", method, path, response.code());
            return new DfxRestResponse(response.code(), parse(raw), raw);
        }
        catch (IOException e) {
            throw new DfxApiException(method + " " + path + " failed", e);
        }
    }

    private JsonNode parse(String raw)
    {
        if (raw.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode node = mapper.readTree(raw);
            return node != null && node.isObject() ? node : mapper.createObjectNode();
        }
        catch (JsonProcessingException e) {
            log.debug("Non-JSON response body: {}", raw);
            return mapper.createObjectNode();
        }
    }
}
