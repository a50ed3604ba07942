package com.questrail.dfx.client;

/**
 * License registration, user creation or login failed while setting up the
 * client.
 */
public final class DfxAuthenticationException extends RuntimeException
{
    public DfxAuthenticationException(String message)
    {
        super(message);
    }

    public DfxAuthenticationException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
