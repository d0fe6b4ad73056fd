package com.wayfarer.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "crm-service");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Test
    @DisplayName("counter carries service tag and extra tags")
    void counterTags() {
        factory.counter("wayfarer.authz.decisions", "decisions", "outcome", "allow").increment();

        var counter = registry.get("wayfarer.authz.decisions")
                .tag("service", "crm-service")
                .tag("outcome", "allow")
                .counter();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("same name and tags resolve to the same counter")
    void counterIsReused() {
        factory.counter("hits", "hits", "module", "leads").increment();
        factory.counter("hits", "hits", "module", "leads").increment();

        assertThat(registry.get("hits").tag("module", "leads").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("timer records durations")
    void timerRecords() {
        factory.timer("wayfarer.authz.check", "gate latency").record(Duration.ofMillis(3));

        assertThat(registry.get("wayfarer.authz.check").timer().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("odd tag list is rejected")
    void oddTagsRejected() {
        assertThatThrownBy(() -> factory.counter("c", "c", "dangling"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
