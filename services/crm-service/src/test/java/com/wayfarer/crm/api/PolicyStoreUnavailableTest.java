package com.wayfarer.crm.api;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.wayfarer.security.JwtTokenVerifier;
import com.wayfarer.security.PolicyUnavailableException;
import com.wayfarer.security.testing.TestPrincipals;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * A store whose schema was never provisioned: migrations point at an empty location, so every
 * permission lookup fails.
 */
@SpringBootTest(properties = {
    "wayfarer.policy-store.url=jdbc:h2:mem:wayfarer-unprovisioned;MODE=PostgreSQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE",
    "wayfarer.policy-store.locations=classpath:db/migration/absent"
})
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Unavailable permission store")
class PolicyStoreUnavailableTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private JwtTokenVerifier tokens;

    @Test
    @DisplayName("gated requests fail closed with 500")
    void failsClosed() throws Exception {
        String token = tokens.issue(TestPrincipals.agent("7"), Duration.ofMinutes(5));

        mockMvc.perform(get("/api/v1/leads").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.title").value("Permission System Unavailable"))
                .andExpect(jsonPath("$.detail").value(PolicyUnavailableException.DEFAULT_MESSAGE));
    }

    @Test
    @DisplayName("health reports the policy store DOWN")
    void healthDown() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.components.policyStore.status").value("DOWN"));
    }

    @Test
    @DisplayName("ungated endpoints keep working")
    void infoStillServed() throws Exception {
        mockMvc.perform(get("/api/v1/info")).andExpect(status().isOk());
    }
}
