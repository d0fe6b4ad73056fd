package com.wayfarer.security;

import java.util.Set;

/**
 * {@link PermissionStore} over an in-memory {@link PermissionMatrix} snapshot.
 * <p>
 * The snapshot reference is volatile and replaced wholesale, so readers never block and
 * never observe a half-applied update.
 */
public final class InMemoryPermissionStore implements PermissionStore {

    private volatile PermissionMatrix matrix;

    public InMemoryPermissionStore(PermissionMatrix matrix) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix must not be null");
        }
        this.matrix = matrix;
    }

    /** Swaps in a new snapshot. */
    public void replace(PermissionMatrix matrix) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix must not be null");
        }
        this.matrix = matrix;
    }

    /** The snapshot currently served. */
    public PermissionMatrix matrix() {
        return matrix;
    }

    @Override
    public boolean isGranted(String role, String module, Action action) {
        return matrix.isGranted(role, module, action);
    }

    @Override
    public Set<String> modulesWithAnyGrant(String role) {
        return matrix.modulesFor(role);
    }

    @Override
    public Set<Action> actionsFor(String role, String module) {
        return matrix.actionsFor(role, module);
    }
}
