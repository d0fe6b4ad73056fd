package com.wayfarer.crm.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code wayfarer.service.*}:
 *
 * <pre>
 * wayfarer:
 *   service:
 *     name: crm-service
 *     environment: production
 *     description: Wayfarer travel CRM
 * </pre>
 *
 * @param name service name used for logging and the {@code service} metric tag. Required.
 * @param environment deployment environment, defaults to {@code development}
 * @param description human-readable description shown by {@code /api/v1/info}
 */
@ConfigurationProperties(prefix = "wayfarer.service")
@Validated
public record CrmServiceProperties(@NotBlank String name, String environment, String description) {

    /** Applies defaults before Bean Validation runs. */
    public CrmServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
