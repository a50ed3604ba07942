package com.questrail.dfx.config;

/**
 * Thrown when the credential cache cannot be read or written.
 */
public final class CredentialStoreException extends RuntimeException
{
    public CredentialStoreException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
