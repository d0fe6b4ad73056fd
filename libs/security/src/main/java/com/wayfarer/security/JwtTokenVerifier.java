package com.wayfarer.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import javax.crypto.SecretKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HS256 JWT {@link TokenVerifier}.
 * <p>
 * Tokens carry the principal in a {@code userId} claim (falling back to {@code sub}) and a
 * {@code role} claim. A token lacking either is rejected rather than defaulted.
 */
public class JwtTokenVerifier implements TokenVerifier {

    public static final String CLAIM_USER_ID = "userId";
    public static final String CLAIM_ROLE = "role";

    private static final Logger log = LoggerFactory.getLogger(JwtTokenVerifier.class);
    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey key;
    private final String issuer;
    private final Clock clock;

    public JwtTokenVerifier(String secret, String issuer) {
        this(secret, issuer, Clock.systemUTC());
    }

    public JwtTokenVerifier(String secret, String issuer, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = issuer;
        this.clock = clock;
    }

    @Override
    public Optional<Principal> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return toPrincipal(claims);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Signs a token for {@code principal} valid for {@code ttl}.
     */
    public String issue(Principal principal, Duration ttl) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(principal.id())
                .claim(CLAIM_USER_ID, principal.id())
                .claim(CLAIM_ROLE, principal.role())
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(key)
                .compact();
    }

    private static Optional<Principal> toPrincipal(Claims claims) {
        Object userId = claims.get(CLAIM_USER_ID);
        String id = userId != null ? String.valueOf(userId) : claims.getSubject();
        String role = claims.get(CLAIM_ROLE, String.class);
        if (id == null || id.isBlank() || role == null || role.isBlank()) {
            log.debug("Rejected bearer token without principal claims");
            return Optional.empty();
        }
        return Optional.of(new Principal(id, role));
    }
}
