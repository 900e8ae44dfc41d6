package com.nayem.tenancy.identity;

/**
 * An identity provider call failed.
 */
public class IdentityProviderException extends RuntimeException {

    private final int status;

    public IdentityProviderException(int status, String message) {
        super(message);
        this.status = status;
    }

    public IdentityProviderException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * HTTP-style status code reported by the provider.
     */
    public int getStatus() {
        return status;
    }
}
