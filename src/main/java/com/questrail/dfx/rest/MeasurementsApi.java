package com.questrail.dfx.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.dfx.protocol.ws.internal.body.ProtobufRequestBodies;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Measurement endpoints (5xx).
 */
public final class MeasurementsApi
{
    static final int RESOLUTION = 100;

    private final DfxRestClient rest;

    public MeasurementsApi(DfxRestClient rest)
    {
        this.rest = Objects.requireNonNull(rest, "rest");
    }

    /**
     * 504: create a measurement.
     *
     * @return the measurement id
     * @throws DfxApiException if no id is returned
     */
    public String create(String userToken, String studyId, String userProfileId, String mode)
    {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("StudyID", studyId);
        body.put("Resolution", RESOLUTION);
        body.put("UserProfileID", userProfileId);
        body.put("Mode", mode);

        return rest.post("/measurements", body, userToken).require("ID", "createMeasurement");
    }

    /**
     * 500: retrieve a measurement and its results.
     *
     * @throws IllegalArgumentException if {@code measurementId} is blank
     */
    public JsonNode retrieve(String userToken, String measurementId)
    {
        if (measurementId == null || measurementId.isBlank()) {
            throw new IllegalArgumentException("No measurement ID given");
        }
        DfxRestResponse response = rest.get("/measurements/" + measurementId, userToken);
        if (!response.isSuccessful()) {
            throw new DfxApiException("retrieveMeasurement failed", response.status(), response.errorCode(), response.rawBody());
        }
        return response.json();
    }

    /**
     * 506: add one chunk of data. The response is returned whatever its status,
     * so the caller can decide on measurement rotation.
     */
    public DfxRestResponse addData(String userToken,
                                   String measurementId,
                                   int chunkOrder,
                                   String action,
                                   double startTime,
                                   double endTime,
                                   double duration,
                                   byte[] payload,
                                   Map<String, Object> meta)
    {
        Objects.requireNonNull(measurementId, "measurementId");
        Objects.requireNonNull(payload, "payload");

        byte[] metaJson = ProtobufRequestBodies.metaJson(chunkOrder, startTime, endTime, duration, meta);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ChunkOrder", chunkOrder);
        body.put("Action", action);
        body.put("StartTime", startTime);
        body.put("EndTime", endTime);
        body.put("Duration", duration);
        body.put("Meta", new String(metaJson, StandardCharsets.UTF_8));
        body.put("Payload", Base64.getEncoder().encodeToString(payload));

        return rest.post("/measurements/" + measurementId + "/data", body, userToken);
    }
}
