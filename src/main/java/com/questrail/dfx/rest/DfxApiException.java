package com.questrail.dfx.rest;

import com.questrail.dfx.model.DfxErrorCode;

/**
 * A REST call did not produce the expected result: a non-success status, a
 * response missing its expected field, or an I/O failure (status -1).
 */
public final class DfxApiException extends RuntimeException
{
    private final int httpStatus;
    private final DfxErrorCode errorCode;
    private final String responseBody;

    public DfxApiException(String message, int httpStatus, DfxErrorCode errorCode, String responseBody)
    {
        super(message + " (status=" + httpStatus + ", code=" + errorCode + ")");
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
        this.responseBody = responseBody;
    }

    public DfxApiException(String message, Throwable cause)
    {
        super(message, cause);
        this.httpStatus = -1;
        this.errorCode = DfxErrorCode.NONE;
        this.responseBody = "";
    }

    public int httpStatus()
    {
        return httpStatus;
    }

    public DfxErrorCode errorCode()
    {
        return errorCode;
    }

    public String responseBody()
    {
        return responseBody;
    }

    /**
     * True when the token used for the call is no longer accepted.
     */
    public boolean isInvalidToken()
    {
        return errorCode == DfxErrorCode.INVALID_TOKEN || httpStatus == 401;
    }
}
