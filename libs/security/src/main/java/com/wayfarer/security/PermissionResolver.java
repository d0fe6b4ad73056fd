package com.wayfarer.security;

import java.util.Set;

/**
 * Answers the two questions the access gate asks of the permission matrix.
 * <p>
 * Knows nothing about the administrator role; that bypass lives in {@link AccessGate}.
 * Unknown modules and roles simply have no grants. Every call waits for the store to be
 * provisioned and then reads it fresh, so grant changes apply to the next request.
 */
public class PermissionResolver {

    private final PermissionStore store;
    private final PolicyInitializer initializer;

    public PermissionResolver(PermissionStore store, PolicyInitializer initializer) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (initializer == null) {
            throw new IllegalArgumentException("initializer must not be null");
        }
        this.store = store;
        this.initializer = initializer;
    }

    /** Resolver over a store that needs no provisioning. */
    public PermissionResolver(PermissionStore store) {
        this(store, PolicyInitializer.alreadyReady());
    }

    /**
     * Whether {@code role} holds {@code action} on {@code module}.
     *
     * @throws IllegalArgumentException   if any argument is null or blank
     * @throws PolicyUnavailableException if the store cannot answer
     */
    public boolean hasPermission(String role, String module, Action action) {
        requireText(role, "role");
        requireText(module, "module");
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        initializer.awaitReady();
        return store.isGranted(role.strip(), module.strip(), action);
    }

    /**
     * Modules in which {@code role} holds any grant.
     *
     * @throws IllegalArgumentException   if role is null or blank
     * @throws PolicyUnavailableException if the store cannot answer
     */
    public Set<String> modulesWithAnyGrant(String role) {
        requireText(role, "role");
        initializer.awaitReady();
        return Set.copyOf(store.modulesWithAnyGrant(role.strip()));
    }

    /**
     * Effective actions of {@code role} on {@code module}.
     *
     * @throws PolicyUnavailableException if the store cannot answer
     */
    public Set<Action> actionsFor(String role, String module) {
        requireText(role, "role");
        requireText(module, "module");
        initializer.awaitReady();
        return Set.copyOf(store.actionsFor(role.strip(), module.strip()));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be null or blank");
        }
    }
}
