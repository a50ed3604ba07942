package com.questrail.dfx.protocol.ws.internal.exec;

/**
 * Thrown when a subscription is attempted with a negative remaining-chunk count.
 * Indicates a caller bug; never clamped.
 */
public final class InvalidQuotaException extends IllegalStateException
{
    public InvalidQuotaException(int chunksRemaining)
    {
        super("Invalid number of chunks remaining: " + chunksRemaining);
    }
}
