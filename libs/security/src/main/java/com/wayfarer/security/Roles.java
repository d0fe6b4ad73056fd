package com.wayfarer.security;

import java.util.List;

/**
 * Well-known role names.
 * <p>
 * Roles are plain strings so new ones can be provisioned in the permission matrix without
 * a release. Only {@link #ADMIN} has behaviour attached in code.
 */
public final class Roles {

    public static final String ADMIN = "admin";
    public static final String MANAGER = "manager";
    public static final String SALES = "sales";
    public static final String AGENT = "agent";
    public static final String RESERVATION = "reservation";
    public static final String OPERATIONS = "operations";
    public static final String FINANCE = "finance";
    public static final String CUSTOMER = "customer";

    /** Every non-admin role the seed data provisions. */
    public static final List<String> STAFF_AND_CUSTOMER =
            List.of(MANAGER, SALES, AGENT, RESERVATION, OPERATIONS, FINANCE, CUSTOMER);

    private Roles() {
        // constants
    }

    /** Checks whether the given role name is the administrator role. */
    public static boolean isAdmin(String role) {
        return role != null && ADMIN.equals(role.strip());
    }
}
