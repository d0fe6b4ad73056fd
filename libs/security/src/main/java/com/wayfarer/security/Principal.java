package com.wayfarer.security;

/**
 * The authenticated identity attached to a request.
 * <p>
 * Produced by a {@link TokenVerifier}; the access gate and the row-scoping policy only
 * ever consume it. Role is an open identifier: what a role may do lives in the
 * permission matrix, not in code.
 *
 * @param id   principal identifier (the user id, or the customer id for customer logins)
 * @param role role name, trimmed (e.g. "agent", "customer", "admin")
 */
public record Principal(String id, String role) {

    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role must not be null or blank");
        }
        role = role.strip();
    }

    /** Whether this principal holds the administrator role. */
    public boolean isAdmin() {
        return Roles.isAdmin(role);
    }
}
