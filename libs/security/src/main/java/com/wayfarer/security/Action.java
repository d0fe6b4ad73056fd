package com.wayfarer.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Operation categories checked against a module.
 * <p>
 * {@link #MANAGE} implies every other action on the same module.
 */
public enum Action {

    READ("read"),
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete"),
    MANAGE("manage");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    /** The identifier stored in the permission matrix (e.g. "read"). */
    public String value() {
        return value;
    }

    /** Whether holding this action satisfies a check for {@code other}. */
    public boolean implies(Action other) {
        return this == other || this == MANAGE;
    }

    /**
     * Looks up an action by its stored identifier, ignoring case and surrounding whitespace.
     *
     * @return the matching action, or empty for unknown identifiers
     */
    public static Optional<Action> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Action action : values()) {
            if (action.value.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
