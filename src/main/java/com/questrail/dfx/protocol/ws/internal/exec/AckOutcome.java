package com.questrail.dfx.protocol.ws.internal.exec;

import com.questrail.dfx.model.DfxErrorCode;

import java.util.Arrays;
import java.util.Objects;

/**
 * AckOutcome
 * -----------------------------------------------------------------------------
 * Result of one {@link ChunkUploadFlow#uploadChunk} call.
 *
 * <p>{@link Kind#ABORTED} and {@link Kind#TIMED_OUT} carry no response: their
 * status is {@code -1}, their text and raw bytes empty and their error code
 * {@link DfxErrorCode#NONE}.</p>
 *
 * @param kind what happened
 * @param status parsed 3-digit status, or -1
 * @param text acknowledgement decoded as UTF-8
 * @param raw acknowledgement exactly as received
 * @param errorCode application error code found in the acknowledgement
 */
public record AckOutcome(Kind kind, int status, String text, byte[] raw, DfxErrorCode errorCode) {

    public enum Kind {
        SUCCESS,
        REJECTED,
        ABORTED,
        TIMED_OUT
    }

    public AckOutcome {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        raw = Objects.requireNonNull(raw, "raw").clone();
        Objects.requireNonNull(errorCode, "errorCode");
    }

    public static AckOutcome aborted() {
        return new AckOutcome(Kind.ABORTED, -1, "", new byte[0], DfxErrorCode.NONE);
    }

    public static AckOutcome timedOut() {
        return new AckOutcome(Kind.TIMED_OUT, -1, "", new byte[0], DfxErrorCode.NONE);
    }

    @Override
    public byte[] raw() {
        return raw.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AckOutcome)) return false;
        AckOutcome that = (AckOutcome) o;
        return status == that.status
                && kind == that.kind
                && text.equals(that.text)
                && Arrays.equals(raw, that.raw)
                && errorCode == that.errorCode;
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(kind, status, text, errorCode) + Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "AckOutcome{kind=" + kind + ", status=" + status + ", text=" + text
                + ", raw=" + raw.length + " bytes, errorCode=" + errorCode + "}";
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    /**
     * True when the server refused the chunk because the measurement is closed
     * and the chunk should be re-sent to a new measurement.
     */
    public boolean isMeasurementClosed() {
        return kind == Kind.REJECTED
                && (status == 400 || status == 405)
                && errorCode == DfxErrorCode.MEASUREMENT_CLOSED;
    }
}
