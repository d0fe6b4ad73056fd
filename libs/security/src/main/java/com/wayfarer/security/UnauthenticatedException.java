package com.wayfarer.security;

/** Thrown when a request carries no verified principal. */
public class UnauthenticatedException extends AuthorizationException {

    public static final String DEFAULT_MESSAGE = "Authentication required";

    public UnauthenticatedException() {
        this(DEFAULT_MESSAGE);
    }

    public UnauthenticatedException(String message) {
        super(DenialReason.UNAUTHENTICATED, message);
    }
}
