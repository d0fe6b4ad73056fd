package com.wayfarer.crm;

import com.wayfarer.crm.config.CrmServiceProperties;
import com.wayfarer.crm.config.SecurityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Wayfarer CRM back end.
 *
 * <p>Key features configured by default:
 *
 * <ul>
 *   <li>Bearer-token authentication and a permission check before every gated handler
 *   <li>Row scoping of every resource query by the caller's role
 *   <li>Permission schema provisioned lazily on the first permission lookup
 *   <li>Correlation ID propagation into logs and error responses
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Actuator health (including the policy store), metrics and Prometheus endpoints
 * </ul>
 */
@SpringBootApplication(scanBasePackages = {"com.wayfarer.crm", "com.wayfarer.database"})
@EnableConfigurationProperties({CrmServiceProperties.class, SecurityProperties.class})
public class CrmServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(CrmServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(CrmServiceApplication.class, args);
        log.info("Wayfarer CRM service started");
    }
}
