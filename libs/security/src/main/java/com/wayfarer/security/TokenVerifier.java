package com.wayfarer.security;

import java.util.Optional;

/**
 * Turns a bearer credential into a {@link Principal}.
 * <p>
 * Invalid, expired and malformed credentials all yield empty; the access gate treats that
 * exactly like a request with no credential.
 */
@FunctionalInterface
public interface TokenVerifier {

    Optional<Principal> verify(String token);
}
