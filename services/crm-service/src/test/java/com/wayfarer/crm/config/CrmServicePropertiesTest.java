package com.wayfarer.crm.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Compact-constructor defaults of the property records, without a Spring context.
 */
@DisplayName("Service properties")
class CrmServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new CrmServiceProperties("crm-service", "production", "Travel CRM");
        assertThat(props.name()).isEqualTo("crm-service");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.description()).isEqualTo("Travel CRM");
    }

    @Test
    @DisplayName("defaults environment to 'development' when null or blank")
    void defaultsEnvironment() {
        assertThat(new CrmServiceProperties("crm-service", null, null).environment()).isEqualTo("development");
        assertThat(new CrmServiceProperties("crm-service", " ", null).environment()).isEqualTo("development");
    }
}
