package com.questrail.dfx.model;

/**
 * Processing action attached to each uploaded chunk.
 *
 * <p>The server uses the action to tell the first and last chunk of a
 * measurement apart from the ones in between.</p>
 */
public enum ChunkAction
{
    FIRST("FIRST::PROCESS"),
    CHUNK("CHUNK::PROCESS"),
    LAST("LAST::PROCESS");

    private final String wireValue;

    ChunkAction(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * Picks the action for a chunk by its position in the recording.
     *
     * <p>A recording of one chunk sends it as {@link #LAST}, so the server
     * finalises the measurement.</p>
     *
     * @param chunkOrder zero-based order of the chunk
     * @param numChunks total chunks in the recording
     */
    public static ChunkAction forOrder(int chunkOrder, int numChunks) {
        if (chunkOrder < 0) {
            throw new IllegalArgumentException("chunkOrder must be >= 0 (was " + chunkOrder + ")");
        }
        if (chunkOrder >= numChunks - 1) {
            return LAST;
        }
        if (chunkOrder == 0) {
            return FIRST;
        }
        return CHUNK;
    }
}
