package com.wayfarer.security;

/**
 * Thrown when the permission store cannot answer: not yet provisioned, provisioning
 * failed, or the backing database is unreachable.
 * <p>
 * Distinct from a denial so operators can tell a broken deployment from a missing grant.
 * Callers must answer with a 5xx and never treat it as an allow.
 */
public class PolicyUnavailableException extends AuthorizationException {

    public static final String DEFAULT_MESSAGE =
            "Permission system not initialized. Please contact administrator.";

    public PolicyUnavailableException(String message) {
        super(DenialReason.POLICY_UNAVAILABLE, message);
    }

    public PolicyUnavailableException(String message, Throwable cause) {
        super(DenialReason.POLICY_UNAVAILABLE, message, cause);
    }
}
