package com.wayfarer.crm.infrastructure.health;

import com.wayfarer.security.PermissionResolver;
import com.wayfarer.security.PolicyInitializer;
import com.wayfarer.security.PolicyUnavailableException;
import com.wayfarer.security.Roles;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the permission store as {@code policyStore} in {@code /actuator/health}.
 *
 * <p>The check is a real lookup, so on a fresh instance it also triggers provisioning.
 */
@Component
public class PolicyStoreHealthIndicator implements HealthIndicator {

    static final String SAMPLE_ROLE = Roles.MANAGER;

    private final PermissionResolver resolver;
    private final PolicyInitializer initializer;

    public PolicyStoreHealthIndicator(PermissionResolver resolver, PolicyInitializer initializer) {
        this.resolver = resolver;
        this.initializer = initializer;
    }

    @Override
    public Health health() {
        try {
            int modules = resolver.modulesWithAnyGrant(SAMPLE_ROLE).size();
            return Health.up()
                    .withDetail("initialized", initializer.isReady())
                    .withDetail("sampleRole", SAMPLE_ROLE)
                    .withDetail("sampleModules", modules)
                    .build();
        } catch (PolicyUnavailableException e) {
            return Health.down(e).withDetail("initialized", initializer.isReady()).build();
        }
    }
}
