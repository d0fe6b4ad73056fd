package com.wayfarer.security;

/**
 * Thrown when an authenticated principal lacks a module or action grant.
 * <p>
 * The message names the missing module (and action) on purpose: coarse permissions are
 * not sensitive, and naming them lets administrators fix the matrix.
 */
public class ForbiddenException extends AuthorizationException {

    private final String module;
    private final Action action;

    public ForbiddenException(DenialReason reason, String module, Action action, String message) {
        super(reason, message);
        if (reason != DenialReason.NO_MODULE_ACCESS && reason != DenialReason.INSUFFICIENT_PERMISSION) {
            throw new IllegalArgumentException("not a forbidden reason: " + reason);
        }
        this.module = module;
        this.action = action;
    }

    public String module() {
        return module;
    }

    public Action action() {
        return action;
    }
}
