package com.nayem.tenancy.saga;

/**
 * A business rule rejected the request before any side effect ran.
 * Nothing needs compensating.
 */
public class PreconditionViolationException extends RuntimeException {

    public PreconditionViolationException(String message) {
        super(message);
    }
}
