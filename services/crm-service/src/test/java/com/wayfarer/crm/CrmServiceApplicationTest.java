package com.wayfarer.crm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.wayfarer.crm.config.CrmServiceProperties;
import com.wayfarer.security.AccessGate;
import com.wayfarer.security.Modules;
import com.wayfarer.security.scope.RowScopingPolicy;
import com.wayfarer.security.scope.SqlFragment;
import com.wayfarer.security.scope.SqlScopeRenderer;
import com.wayfarer.security.testing.TestPrincipals;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Context and operational endpoints. The 'test' profile runs against in-memory H2.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("CRM Service Application")
class CrmServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("wires the authorization engine with integer id binding")
    void contextLoads() {
        assertThat(context.getBean(AccessGate.class)).isNotNull();
        var scoping = context.getBean(RowScopingPolicy.class);

        assertThat(SqlScopeRenderer.render(scoping.scopeFilter(Modules.LEADS, TestPrincipals.agent("07"))))
                .isEqualTo(new SqlFragment("agent_id = ?", List.of(7L)));
    }

    @Test
    @DisplayName("service properties are loaded from test profile")
    void servicePropertiesAreLoaded() {
        var props = context.getBean(CrmServiceProperties.class);
        assertThat(props.name()).isEqualTo("crm-service-test");
        assertThat(props.environment()).isEqualTo("test");
    }

    @Test
    @DisplayName("info endpoint is ungated")
    void serviceInfoEndpoint() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("crm-service-test"))
                .andExpect(jsonPath("$.status").value("running"));
    }

    @Test
    @DisplayName("health includes an UP policy store")
    void actuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.policyStore.status").value("UP"))
                .andExpect(jsonPath("$.components.policyStore.details.initialized").value(true));
    }

    @Test
    @DisplayName("correlation ID is echoed on responses")
    void correlationIdHeader() throws Exception {
        mockMvc.perform(get("/api/v1/info").header("X-Correlation-ID", "corr-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Correlation-ID", "corr-123"));
    }
}
