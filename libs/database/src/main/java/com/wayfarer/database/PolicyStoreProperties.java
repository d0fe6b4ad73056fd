package com.wayfarer.database;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and migration settings of the database holding the permission matrix.
 *
 * <p>Bean Validation fails startup on a missing URL or credentials instead of failing on the
 * first permission check.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * wayfarer:
 *   policy-store:
 *     url: jdbc:postgresql://localhost:5432/wayfarer
 *     username: wayfarer
 *     password: wayfarer_dev_password
 *     locations:
 *       - classpath:db/migration/policy
 *       - classpath:db/migration/crm
 * }</pre>
 *
 * @param url JDBC connection URL
 * @param username database username
 * @param password database password, may be empty for embedded databases
 * @param locations Flyway migration locations, the permission schema first
 */
@Validated
@ConfigurationProperties(prefix = "wayfarer.policy-store")
public record PolicyStoreProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        @NotEmpty @DefaultValue("classpath:db/migration/policy") List<String> locations) {}
