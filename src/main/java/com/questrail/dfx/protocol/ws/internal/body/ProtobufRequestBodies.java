package com.questrail.dfx.protocol.ws.internal.body;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.CodedOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * ProtobufRequestBodies
 * -----------------------------------------------------------------------------
 * Serializes the bodies of the two WebSocket requests this client sends, in
 * protobuf wire format.
 *
 * <h2>Messages</h2>
 * <pre>
 *   Params                  { string ID = 1; }
 *
 *   DataRequest             { Params Params = 1; int32 ChunkOrder = 2;
 *                             string Action = 3; double StartTime = 4;
 *                             double EndTime = 5; double Duration = 6;
 *                             bytes Meta = 7; bytes Payload = 8; }
 *
 *   SubscribeResultsRequest { Params Params = 1; string RequestID = 2; }
 * </pre>
 *
 * <p>{@code Meta} is the UTF-8 JSON of the caller's metadata, extended with
 * {@code Order}, {@code StartTime}, {@code EndTime} and {@code Duration}.</p>
 *
 * <p>Serialization failures surface as {@link RequestBodyException}. They are
 * never swallowed.</p>
 */
public final class ProtobufRequestBodies
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProtobufRequestBodies() {}

    /**
     * Body of an add-data (0506) request.
     */
    public static byte[] dataRequest(String measurementId,
                                     int chunkOrder,
                                     String action,
                                     double startTime,
                                     double endTime,
                                     double duration,
                                     byte[] payload,
                                     Map<String, Object> meta)
    {
        Objects.requireNonNull(measurementId, "measurementId");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(payload, "payload");

        byte[] metaJson = metaJson(chunkOrder, startTime, endTime, duration, meta);

        try {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream(payload.length + metaJson.length + 64);
            CodedOutputStream out = CodedOutputStream.newInstance(bytes);
            out.writeByteArray(1, params(measurementId));
            out.writeInt32(2, chunkOrder);
            out.writeString(3, action);
            out.writeDouble(4, startTime);
            out.writeDouble(5, endTime);
            out.writeDouble(6, duration);
            out.writeByteArray(7, metaJson);
            out.writeByteArray(8, payload);
            out.flush();
            return bytes.toByteArray();
        }
        catch (IOException e) {
            throw new RequestBodyException("Failed to serialize DataRequest for measurement " + measurementId, e);
        }
    }

    /**
     * Body of a subscribe-results (0510) request.
     */
    public static byte[] subscribeResultsRequest(String measurementId, String requestId)
    {
        Objects.requireNonNull(measurementId, "measurementId");
        Objects.requireNonNull(requestId, "requestId");

        try {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            CodedOutputStream out = CodedOutputStream.newInstance(bytes);
            out.writeByteArray(1, params(measurementId));
            out.writeString(2, requestId);
            out.flush();
            return bytes.toByteArray();
        }
        catch (IOException e) {
            throw new RequestBodyException("Failed to serialize SubscribeResultsRequest for measurement " + measurementId, e);
        }
    }

    /**
     * JSON metadata for a chunk. Also used by the REST add-data call, which
     * carries the same object as a string.
     */
    public static byte[] metaJson(int chunkOrder,
                                  double startTime,
                                  double endTime,
                                  double duration,
                                  Map<String, Object> meta)
    {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (meta != null) {
            merged.putAll(meta);
        }
        merged.put("Order", chunkOrder);
        merged.put("StartTime", startTime);
        merged.put("EndTime", endTime);
        merged.put("Duration", duration);

        try {
            return MAPPER.writeValueAsBytes(merged);
        }
        catch (JsonProcessingException e) {
            throw new RequestBodyException("Failed to serialize chunk meta", e);
        }
    }

    private static byte[] params(String measurementId) throws IOException
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        out.writeString(1, measurementId);
        out.flush();
        return bytes.toByteArray();
    }
}
