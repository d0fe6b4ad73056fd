package com.wayfarer.security;

/**
 * Thrown when a row is absent or excluded by the row-scoping predicate.
 * <p>
 * Both cases produce the same message so callers cannot discover rows they are not
 * allowed to see.
 */
public class ResourceNotFoundException extends AuthorizationException {

    private final String module;
    private final String resourceId;

    public ResourceNotFoundException(String module, String resourceId) {
        super(DenialReason.NOT_FOUND, "%s record '%s' not found".formatted(module, resourceId));
        this.module = module;
        this.resourceId = resourceId;
    }

    public String module() {
        return module;
    }

    public String resourceId() {
        return resourceId;
    }
}
