package com.questrail.dfx.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Locale;

/**
 * DfxErrorCode
 * -----------------------------------------------------------------------------
 * Application-level error codes reported by the DFX API.
 *
 * <p>The API reports these in two shapes: a JSON object with a {@code Code}
 * field (REST responses) or a bare token somewhere in the text of an add-data
 * acknowledgement (WebSocket). {@link #parse(String)} accepts either, so every
 * caller decides on the same structured value.</p>
 */
public enum DfxErrorCode
{
    MEASUREMENT_CLOSED,
    INVALID_USER,
    INVALID_PASSWORD,
    INVALID_TOKEN,
    INTERNAL_ERROR,

    /** A code was present but is not one this client knows. */
    UNKNOWN,

    /** No code present. */
    NONE;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Codes that can be recognised by scanning text. */
    private static final DfxErrorCode[] SCANNABLE = {
            MEASUREMENT_CLOSED, INVALID_USER, INVALID_PASSWORD, INVALID_TOKEN, INTERNAL_ERROR
    };

    /**
     * Parses a response body.
     *
     * @param body JSON or plain text; may be {@code null}
     * @return the recognised code, {@link #UNKNOWN} for an unrecognised
     *         {@code Code} field, or {@link #NONE}
     */
    public static DfxErrorCode parse(String body)
    {
        if (body == null || body.isBlank()) {
            return NONE;
        }

        String trimmed = body.trim();
        if (trimmed.startsWith("{")) {
            try {
                JsonNode node = MAPPER.readTree(trimmed);
                JsonNode code = node.get("Code");
                if (code != null && code.isTextual()) {
                    return fromCode(code.asText());
                }
            }
            catch (IOException e) {
                // Not JSON after all; fall back to scanning.
            }
        }
        return scan(body);
    }

    /**
     * Maps a {@code Code} value to an enum constant.
     */
    public static DfxErrorCode fromCode(String code)
    {
        if (code == null || code.isBlank()) {
            return NONE;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (DfxErrorCode c : SCANNABLE) {
            if (c.name().equals(normalized)) {
                return c;
            }
        }
        return UNKNOWN;
    }

    private static DfxErrorCode scan(String text)
    {
        for (DfxErrorCode c : SCANNABLE) {
            if (text.contains(c.name())) {
                return c;
            }
        }
        return NONE;
    }
}
