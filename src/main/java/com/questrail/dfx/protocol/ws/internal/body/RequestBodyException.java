package com.questrail.dfx.protocol.ws.internal.body;

/**
 * Thrown when an outbound request body cannot be serialized.
 */
public final class RequestBodyException extends RuntimeException
{
    public RequestBodyException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
