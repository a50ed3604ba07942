package com.questrail.dfx.protocol.ws.codec.impl;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Source of 10-character ids for outbound frames and WebSocket connections.
 *
 * <p>Each outbound request draws a fresh id. Each connection also draws one,
 * which the router compares against the sender prefix of inbound replies.
 * Ids are not secrets, so a non-cryptographic generator is used.</p>
 */
@FunctionalInterface
public interface RequestIdGenerator
{
    String nextId();

    /**
     * Random lowercase hex ids of exactly {@link DfxFraming#REQUEST_ID_WIDTH} characters.
     */
    static RequestIdGenerator random()
    {
        return () -> {
            // 40 random bits; the extra leading bit forces exactly 10 hex digits.
            long bits = ThreadLocalRandom.current().nextLong() & 0xFF_FFFF_FFFFL;
            return Long.toHexString(bits | (1L << 40)).substring(1);
        };
    }
}
