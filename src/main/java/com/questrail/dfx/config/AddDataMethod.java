package com.questrail.dfx.config;

import java.util.Locale;

/**
 * How chunks are uploaded: one REST call per chunk, or over the shared WebSocket.
 */
public enum AddDataMethod
{
    REST,
    WEBSOCKET;

    /**
     * Accepts {@code rest}, {@code websocket} and {@code ws}, case-insensitively.
     */
    public static AddDataMethod fromName(String name) {
        String n = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        switch (n) {
            case "rest":
                return REST;
            case "websocket":
            case "ws":
                return WEBSOCKET;
            default:
                throw new IllegalArgumentException("Invalid add-data method: " + name);
        }
    }
}
