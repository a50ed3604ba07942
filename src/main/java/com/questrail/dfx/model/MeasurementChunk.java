package com.questrail.dfx.model;

import java.util.Map;
import java.util.Objects;

/**
 * One slice of recorded payload handed to the client for upload.
 *
 * @param chunkOrder zero-based position in the recording
 * @param startTime chunk start, seconds
 * @param endTime chunk end, seconds
 * @param duration chunk length, seconds
 * @param payload opaque payload bytes
 * @param meta caller metadata merged into the uploaded meta JSON
 */
public record MeasurementChunk(
        int chunkOrder,
        double startTime,
        double endTime,
        double duration,
        byte[] payload,
        Map<String, Object> meta
) {
    public MeasurementChunk {
        Objects.requireNonNull(payload, "payload");
        if (chunkOrder < 0) {
            throw new IllegalArgumentException("chunkOrder must be >= 0");
        }
        payload = payload.clone();
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
