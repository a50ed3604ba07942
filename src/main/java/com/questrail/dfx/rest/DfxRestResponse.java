package com.questrail.dfx.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.dfx.model.DfxErrorCode;

import java.util.Objects;
import java.util.Optional;

/**
 * One REST response. Bodies that are not JSON objects are exposed as an empty
 * object, with the raw text kept for diagnostics.
 */
public record DfxRestResponse(int status, JsonNode json, String rawBody) {

    public DfxRestResponse {
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(rawBody, "rawBody");
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    public DfxErrorCode errorCode() {
        return DfxErrorCode.parse(rawBody);
    }

    /**
     * Text value of a top-level field, if present and non-empty.
     */
    public Optional<String> text(String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return Optional.empty();
        }
        String value = node.asText();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Text value of {@code field}, or a {@link DfxApiException} carrying the
     * response's error code.
     */
    public String require(String field, String operation) {
        return text(field).orElseThrow(() -> new DfxApiException(
                operation + " failed: response has no " + field, status, errorCode(), rawBody));
    }
}
