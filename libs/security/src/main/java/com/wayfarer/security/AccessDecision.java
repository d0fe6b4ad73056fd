package com.wayfarer.security;

/**
 * Outcome of an access-gate check.
 *
 * @param outcome allow, deny, or policy-unavailable
 * @param reason  why the request was stopped (null when allowed)
 * @param message caller-facing explanation (null when allowed)
 */
public record AccessDecision(Outcome outcome, DenialReason reason, String message) {

    private static final AccessDecision ALLOW = new AccessDecision(Outcome.ALLOW, null, null);

    /** The three observable gate results. */
    public enum Outcome {
        ALLOW,
        DENY,
        POLICY_UNAVAILABLE
    }

    public static AccessDecision allow() {
        return ALLOW;
    }

    public static AccessDecision deny(DenialReason reason, String message) {
        if (reason == null || reason == DenialReason.POLICY_UNAVAILABLE) {
            throw new IllegalArgumentException("deny requires a denial reason, got " + reason);
        }
        return new AccessDecision(Outcome.DENY, reason, message);
    }

    public static AccessDecision policyUnavailable(String message) {
        return new AccessDecision(Outcome.POLICY_UNAVAILABLE, DenialReason.POLICY_UNAVAILABLE, message);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOW;
    }

    /**
     * The exception a caller should throw for this decision.
     *
     * @throws IllegalStateException if the decision is an allow
     */
    public AuthorizationException toException(String module, Action action) {
        return switch (outcome) {
            case ALLOW -> throw new IllegalStateException("an allow decision has no exception");
            case POLICY_UNAVAILABLE -> new PolicyUnavailableException(message);
            case DENY -> reason == DenialReason.UNAUTHENTICATED
                    ? new UnauthenticatedException(message)
                    : new ForbiddenException(reason, module, action, message);
        };
    }
}
