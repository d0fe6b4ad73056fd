package com.wayfarer.database;

import com.wayfarer.security.AccessGate;
import com.wayfarer.security.PermissionResolver;
import com.wayfarer.security.PolicyInitializer;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the JDBC-backed permission matrix.
 *
 * <p>Flyway is not run at startup. The migration is the {@link PolicyInitializer} bootstrap, so
 * it runs once on the first permission lookup and is retried on the next lookup if it fails.
 * Services using this module disable Spring Boot's own Flyway run:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * <p>The {@link DataSource} and {@link JdbcTemplate} defined here are the service's only ones;
 * resource repositories share them with the permission store.
 *
 * @see PolicyStoreProperties
 */
@Configuration
@EnableConfigurationProperties(PolicyStoreProperties.class)
public class PolicyStoreConfig {

    /** Bean name of the Flyway instance provisioning the permission schema. */
    public static final String POLICY_FLYWAY_BEAN = "policyFlyway";

    @Bean
    public DataSource policyStoreDataSource(PolicyStoreProperties properties) {
        return DataSourceBuilder.create()
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean(name = POLICY_FLYWAY_BEAN)
    public Flyway policyFlyway(DataSource dataSource, PolicyStoreProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations().toArray(String[]::new))
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }

    @Bean
    public PolicyInitializer policyInitializer(Flyway policyFlyway) {
        return new PolicyInitializer(policyFlyway::migrate);
    }

    @Bean
    public JdbcPermissionStore jdbcPermissionStore(JdbcTemplate jdbcTemplate) {
        return new JdbcPermissionStore(jdbcTemplate);
    }

    @Bean
    public PermissionResolver permissionResolver(
            JdbcPermissionStore jdbcPermissionStore, PolicyInitializer policyInitializer) {
        return new PermissionResolver(jdbcPermissionStore, policyInitializer);
    }

    @Bean
    public AccessGate accessGate(PermissionResolver permissionResolver) {
        return new AccessGate(permissionResolver);
    }
}
