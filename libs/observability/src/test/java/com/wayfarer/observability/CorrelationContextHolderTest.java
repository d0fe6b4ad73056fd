package com.wayfarer.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set() / get() / clear()")
    class Lifecycle {

        @Test
        @DisplayName("set populates MDC and get returns the context")
        void setPopulatesMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "42", "customer", "req-1"));

            assertThat(CorrelationContextHolder.get()).isPresent();
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("42");
            assertThat(MDC.get(CorrelationContext.MDC_ROLE)).isEqualTo("customer");
            assertThat(MDC.get(CorrelationContext.MDC_REQUEST_ID)).isEqualTo("req-1");
        }

        @Test
        @DisplayName("null values are removed from MDC")
        void nullValuesRemoved() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "42", "customer", null));
            CorrelationContextHolder.set(CorrelationContext.anonymous("corr-2", null));

            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_ROLE)).isNull();
        }

        @Test
        @DisplayName("clear removes context and MDC keys")
        void clearRemovesEverything() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "42", "customer", "req-1"));
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_ROLE)).isNull();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("bindPrincipal()")
    class BindPrincipal {

        @Test
        @DisplayName("attaches principal to the current context")
        void attaches() {
            CorrelationContextHolder.set(CorrelationContext.anonymous("corr-1", "req-1"));

            CorrelationContextHolder.bindPrincipal("7", "agent");

            assertThat(CorrelationContextHolder.get()).get()
                    .extracting(CorrelationContext::userId, CorrelationContext::role)
                    .containsExactly("7", "agent");
            assertThat(MDC.get(CorrelationContext.MDC_ROLE)).isEqualTo("agent");
        }

        @Test
        @DisplayName("does nothing without a current context")
        void noContext() {
            CorrelationContextHolder.bindPrincipal("7", "agent");

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isNull();
        }
    }
}
