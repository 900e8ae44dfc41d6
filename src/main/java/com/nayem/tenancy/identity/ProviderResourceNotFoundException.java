package com.nayem.tenancy.identity;

/**
 * The provider has no resource with the requested identifier (HTTP 404).
 */
public class ProviderResourceNotFoundException extends IdentityProviderException {

    public ProviderResourceNotFoundException(String message) {
        super(404, message);
    }
}
