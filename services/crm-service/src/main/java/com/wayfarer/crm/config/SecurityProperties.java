package com.wayfarer.crm.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bearer-token verification settings, bound from {@code wayfarer.security.*}.
 *
 * @param jwtSecret HMAC secret shared with the login service, at least 32 bytes
 * @param issuer expected {@code iss} claim
 */
@ConfigurationProperties(prefix = "wayfarer.security")
@Validated
public record SecurityProperties(@NotBlank @Size(min = 32) String jwtSecret, @NotBlank String issuer) {}
