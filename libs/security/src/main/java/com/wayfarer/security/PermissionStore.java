package com.wayfarer.security;

import java.util.Set;

/**
 * Read side of the permission matrix.
 * <p>
 * Implementations must be safe for concurrent readers without locking and must throw
 * {@link PolicyUnavailableException} when they cannot answer; returning {@code false}
 * for a broken store would hide the outage behind ordinary denials.
 */
public interface PermissionStore {

    /** Whether {@code role} holds {@code action} on {@code module}, directly or through MANAGE. */
    boolean isGranted(String role, String module, Action action);

    /** Modules on which {@code role} holds at least one granted action. */
    Set<String> modulesWithAnyGrant(String role);

    /** Effective actions of {@code role} on {@code module}. */
    Set<Action> actionsFor(String role, String module);
}
