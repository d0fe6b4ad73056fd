package com.wayfarer.crm.api;

import com.wayfarer.crm.config.CrmServiceProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight, ungated info endpoint. Actuator's {@code /actuator/info} carries build metadata;
 * this one carries service identity.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final CrmServiceProperties properties;

    public ServiceInfoController(CrmServiceProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
