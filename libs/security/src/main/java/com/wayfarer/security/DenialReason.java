package com.wayfarer.security;

/**
 * Why a request did not proceed.
 * <p>
 * Each reason maps to exactly one HTTP status so the web tier never has to guess.
 */
public enum DenialReason {

    /** No principal attached, or the credential failed verification. */
    UNAUTHENTICATED(401),

    /** The role holds no grant at all in the requested module. */
    NO_MODULE_ACCESS(403),

    /** The role can see the module but lacks the requested action. */
    INSUFFICIENT_PERMISSION(403),

    /** The row is absent or excluded by the row-scoping predicate. */
    NOT_FOUND(404),

    /** The permission store is unreachable or not provisioned. */
    POLICY_UNAVAILABLE(500);

    private final int httpStatus;

    DenialReason(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    /** The HTTP status callers should answer with. */
    public int httpStatus() {
        return httpStatus;
    }
}
