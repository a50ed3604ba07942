package com.questrail.dfx.protocol.ws.internal.exec;

/**
 * Thrown when the server answers a subscribe-results request with a non-200
 * status. Fatal to that measurement: a new measurement must be created before
 * subscribing again.
 */
public final class SubscriptionRejectedException extends RuntimeException
{
    private final String measurementId;
    private final int statusCode;

    public SubscriptionRejectedException(String measurementId, int statusCode, String statusText)
    {
        super("Subscribe request for measurement " + measurementId
                + " rejected with status '" + statusText + "'. Check the measurement ID.");
        this.measurementId = measurementId;
        this.statusCode = statusCode;
    }

    public String measurementId()
    {
        return measurementId;
    }

    /**
     * Parsed status, or -1 if the status bytes were not digits.
     */
    public int statusCode()
    {
        return statusCode;
    }
}
