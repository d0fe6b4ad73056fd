package com.wayfarer.security;

/**
 * Base type for every non-allow outcome of the authorization engine.
 * <p>
 * Unchecked: a denial terminates the request, there is nothing for intermediate
 * layers to recover. The web tier maps {@link #reason()} to a status code.
 */
public abstract class AuthorizationException extends RuntimeException {

    private final DenialReason reason;

    protected AuthorizationException(DenialReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected AuthorizationException(DenialReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public DenialReason reason() {
        return reason;
    }
}
