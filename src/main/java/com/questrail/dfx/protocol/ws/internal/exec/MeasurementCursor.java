package com.questrail.dfx.protocol.ws.internal.exec;

/**
 * MeasurementCursor
 * -----------------------------------------------------------------------------
 * Subscription quota for one recording.
 *
 * <p>{@code chunksRemaining} counts result chunks not yet allocated to a
 * subscribe call. {@code maxChunksPerMeasurement} is the number of chunks that
 * fit in one server-side measurement window; a recording longer than that is
 * spread over several measurements.</p>
 *
 * <p>A negative remaining count is never clamped. {@link #allocate()} fails
 * fast with {@link InvalidQuotaException}.</p>
 */
public final class MeasurementCursor
{
    private final int maxChunksPerMeasurement;
    private int chunksRemaining;

    public MeasurementCursor(int chunksRemaining, int maxChunksPerMeasurement)
    {
        if (maxChunksPerMeasurement < 1) {
            throw new IllegalArgumentException(
                    "maxChunksPerMeasurement must be >= 1 (was " + maxChunksPerMeasurement + ")");
        }
        this.chunksRemaining = chunksRemaining;
        this.maxChunksPerMeasurement = maxChunksPerMeasurement;
    }

    /**
     * Derive a cursor from recording parameters, all in seconds.
     *
     * <pre>
     *   chunksRemaining         = floor(recordingLength / chunkDuration)
     *   maxChunksPerMeasurement = floor(measurementLimit / chunkDuration)
     * </pre>
     */
    public static MeasurementCursor forRecording(double chunkDuration, double recordingLength, double measurementLimit)
    {
        if (!(chunkDuration > 0)) {
            throw new IllegalArgumentException("chunkDuration must be > 0 (was " + chunkDuration + ")");
        }
        if (recordingLength < 0) {
            throw new IllegalArgumentException("recordingLength must be >= 0 (was " + recordingLength + ")");
        }
        int numChunks = (int) Math.floor(recordingLength / chunkDuration);
        int maxChunks = (int) Math.floor(measurementLimit / chunkDuration);
        return new MeasurementCursor(numChunks, maxChunks);
    }

    /**
     * Take the quota for the next subscribe call:
     * {@code min(chunksRemaining, maxChunksPerMeasurement)}.
     *
     * @throws InvalidQuotaException if {@code chunksRemaining < 0}
     */
    public synchronized int allocate()
    {
        if (chunksRemaining < 0) {
            throw new InvalidQuotaException(chunksRemaining);
        }
        int allocated = Math.min(chunksRemaining, maxChunksPerMeasurement);
        chunksRemaining -= allocated;
        return allocated;
    }

    public synchronized int chunksRemaining()
    {
        return chunksRemaining;
    }

    public int maxChunksPerMeasurement()
    {
        return maxChunksPerMeasurement;
    }

    @Override
    public synchronized String toString()
    {
        return "MeasurementCursor[remaining=" + chunksRemaining + ", max=" + maxChunksPerMeasurement + ']';
    }
}
