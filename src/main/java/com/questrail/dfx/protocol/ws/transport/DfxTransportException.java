package com.questrail.dfx.protocol.ws.transport;

/**
 * Socket-level failure. Fatal to the current session and never retried locally.
 */
public class DfxTransportException extends RuntimeException
{
    public DfxTransportException(String message)
    {
        super(message);
    }

    public DfxTransportException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
