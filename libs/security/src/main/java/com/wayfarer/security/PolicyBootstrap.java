package com.wayfarer.security;

/**
 * One-time provisioning of the permission store (schema creation, seed grants).
 * <p>
 * Must be idempotent: a failed attempt is retried on a later request.
 */
@FunctionalInterface
public interface PolicyBootstrap {

    /** Provisions the store; any exception marks the attempt as failed. */
    void initialize() throws Exception;

    /** A bootstrap with nothing to do, for stores that are ready on construction. */
    static PolicyBootstrap none() {
        return () -> { };
    }
}
