package com.wayfarer.crm.config;

import com.wayfarer.observability.MetricFactory;
import com.wayfarer.security.JwtTokenVerifier;
import com.wayfarer.security.scope.CrmScopeRules;
import com.wayfarer.security.scope.RowScopingPolicy;
import com.wayfarer.security.scope.ScopeValueBinding;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Authorization collaborators that are not tied to the permission database.
 *
 * <p>The access gate and resolver come from {@link com.wayfarer.database.PolicyStoreConfig}.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public JwtTokenVerifier jwtTokenVerifier(SecurityProperties properties) {
        return new JwtTokenVerifier(properties.jwtSecret(), properties.issuer());
    }

    @Bean
    public RowScopingPolicy rowScopingPolicy() {
        return new RowScopingPolicy(CrmScopeRules.defaults(), ScopeValueBinding.integerIds());
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, CrmServiceProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }
}
