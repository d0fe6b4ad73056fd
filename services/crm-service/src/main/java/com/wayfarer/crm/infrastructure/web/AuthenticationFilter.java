package com.wayfarer.crm.infrastructure.web;

import com.wayfarer.observability.CorrelationContextHolder;
import com.wayfarer.security.BearerTokenExtractor;
import com.wayfarer.security.Principal;
import com.wayfarer.security.TokenVerifier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Attaches the verified {@link Principal} of a bearer token to the request.
 *
 * <p>Never rejects a request itself. A missing header and a token that fails verification
 * both leave the request without a principal; the access gate answers 401 for gated handlers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthenticationFilter extends OncePerRequestFilter {

    /** Request attribute holding the authenticated {@link Principal}. */
    public static final String PRINCIPAL_ATTRIBUTE = AuthenticationFilter.class.getName() + ".principal";

    private static final Logger log = LoggerFactory.getLogger(AuthenticationFilter.class);

    private final TokenVerifier tokenVerifier;

    public AuthenticationFilter(TokenVerifier tokenVerifier) {
        this.tokenVerifier = tokenVerifier;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<String> token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        Optional<Principal> principal = token.flatMap(tokenVerifier::verify);

        if (principal.isPresent()) {
            Principal p = principal.get();
            request.setAttribute(PRINCIPAL_ATTRIBUTE, p);
            CorrelationContextHolder.bindPrincipal(p.id(), p.role());
        } else if (token.isPresent()) {
            log.debug("Bearer token rejected for {} {}", request.getMethod(), request.getRequestURI());
        }

        filterChain.doFilter(request, response);
    }

    /** The principal attached by this filter, if any. */
    public static Optional<Principal> principalOf(HttpServletRequest request) {
        return request.getAttribute(PRINCIPAL_ATTRIBUTE) instanceof Principal p
                ? Optional.of(p)
                : Optional.empty();
    }
}
