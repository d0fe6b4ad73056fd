package com.wayfarer.security;

/**
 * One row of the permission matrix: {@code (role, module, action) -> granted}.
 *
 * @param role    role name
 * @param module  module identifier
 * @param action  action on the module
 * @param granted whether the action is granted; absent rows are never inferred as grants
 */
public record PermissionGrant(String role, String module, Action action, boolean granted) {

    public PermissionGrant {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("role must not be null or blank");
        }
        if (module == null || module.isBlank()) {
            throw new IllegalArgumentException("module must not be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        role = role.strip();
        module = module.strip();
    }

    /** Creates a granted row. */
    public static PermissionGrant allow(String role, String module, Action action) {
        return new PermissionGrant(role, module, action, true);
    }

    /** Renders the grant as {@code module:action}, the form used in denial messages. */
    public String key() {
        return module + ":" + action.value();
    }
}
