package com.questrail.dfx.protocol.ws.internal.exec;

/**
 * Receives result payloads delivered by a subscription, in arrival order.
 */
@FunctionalInterface
public interface ResultChunkSink
{
    /**
     * @param chunkIndex running index of this result across the recording
     * @param payload result bytes with the 13-byte header removed
     */
    void onResultChunk(int chunkIndex, byte[] payload);
}
