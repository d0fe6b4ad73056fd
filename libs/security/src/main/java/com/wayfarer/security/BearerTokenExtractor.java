package com.wayfarer.security;

import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP Authorization headers.
 */
public final class BearerTokenExtractor {

    static final String PREFIX = "Bearer ";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the token from an Authorization header value of the form {@code "Bearer <token>"}.
     * The scheme is matched case-insensitively and must be followed by a space.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token, or empty if the header is missing, uses another scheme, or has no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            return Optional.empty();
        }
        String token = trimmed.substring(PREFIX.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
