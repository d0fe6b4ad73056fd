package com.wayfarer.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a principal may run an action on a module before any resource code runs.
 * <p>
 * Checks in order, each a terminal rejection point:
 * <ol>
 *   <li>no principal: {@link DenialReason#UNAUTHENTICATED}, the resolver is not consulted</li>
 *   <li>administrator: allowed, nothing else is checked</li>
 *   <li>no grant at all in the module: {@link DenialReason#NO_MODULE_ACCESS}</li>
 *   <li>module visible but action not granted: {@link DenialReason#INSUFFICIENT_PERMISSION}</li>
 * </ol>
 * A store that cannot answer yields a policy-unavailable decision, never an allow.
 * The gate does not narrow rows; see {@link com.wayfarer.security.scope.RowScopingPolicy}.
 */
public class AccessGate {

    private static final Logger log = LoggerFactory.getLogger(AccessGate.class);

    private final PermissionResolver resolver;

    public AccessGate(PermissionResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver must not be null");
        }
        this.resolver = resolver;
    }

    /**
     * Evaluates the request.
     *
     * @param principal       the authenticated principal, or null when authentication failed
     * @param requestedModule module identifier; surrounding whitespace is ignored
     * @param action          requested action
     * @throws IllegalArgumentException if module is null or blank, or action is null
     */
    public AccessDecision check(Principal principal, String requestedModule, Action action) {
        if (requestedModule == null || requestedModule.isBlank()) {
            throw new IllegalArgumentException("module must not be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        String module = requestedModule.strip();
        if (principal == null) {
            log.debug("Denied unauthenticated request for {}:{}", module, action);
            return AccessDecision.deny(DenialReason.UNAUTHENTICATED, UnauthenticatedException.DEFAULT_MESSAGE);
        }

        // The only role-based bypass in the engine.
        if (principal.isAdmin()) {
            return AccessDecision.allow();
        }

        try {
            if (!resolver.modulesWithAnyGrant(principal.role()).contains(module)) {
                log.warn("Role '{}' has no access to module '{}' (principal {})",
                        principal.role(), module, principal.id());
                return AccessDecision.deny(DenialReason.NO_MODULE_ACCESS,
                        "Access denied. No permissions for module: " + module);
            }
            if (!resolver.hasPermission(principal.role(), module, action)) {
                log.warn("Role '{}' lacks {}:{} (principal {})",
                        principal.role(), module, action, principal.id());
                return AccessDecision.deny(DenialReason.INSUFFICIENT_PERMISSION,
                        "Access denied. Required permission: " + module + ":" + action.value());
            }
            return AccessDecision.allow();
        } catch (PolicyUnavailableException e) {
            log.error("Permission check for {}:{} failed, role '{}'", module, action, principal.role(), e);
            return AccessDecision.policyUnavailable(PolicyUnavailableException.DEFAULT_MESSAGE);
        }
    }

    /**
     * Same as {@link #check} but throws on anything other than an allow.
     *
     * @throws UnauthenticatedException   when no principal is attached
     * @throws ForbiddenException         when the module or action is not granted
     * @throws PolicyUnavailableException when the permission store cannot answer
     */
    public void enforce(Principal principal, String module, Action action) {
        AccessDecision decision = check(principal, module, action);
        if (!decision.isAllowed()) {
            throw decision.toException(module, action);
        }
    }
}
