package com.chartgate.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("returns empty when no context is set")
        void emptyWhenUnset() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("stores and clears the context")
        void storesAndClears() {
            var ctx = CorrelationContext.of("corr-1", "req-1");
            CorrelationContextHolder.set(ctx);
            assertThat(CorrelationContextHolder.get()).contains(ctx);

            CorrelationContextHolder.clear();
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("rejects blank correlation ID")
        void rejectsBlankCorrelationId() {
            assertThatThrownBy(() -> CorrelationContext.of(" ", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("populates correlation keys and leaves caller keys unset before resolution")
        void populatesBeforeResolution() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-2", "req-2"));

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-2");
            assertThat(MDC.get(CorrelationContext.MDC_REQUEST_ID)).isEqualTo("req-2");
            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_AUTH_SOURCE)).isNull();
        }

        @Test
        @DisplayName("enrichCaller adds tenant and auth source to the current context")
        void enrichCaller() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-3", null));

            CorrelationContextHolder.enrichCaller("tenant-9", "saas_db");

            assertThat(CorrelationContextHolder.get()).hasValueSatisfying(ctx -> {
                assertThat(ctx.correlationId()).isEqualTo("corr-3");
                assertThat(ctx.tenantId()).isEqualTo("tenant-9");
                assertThat(ctx.authSource()).isEqualTo("saas_db");
            });
            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isEqualTo("tenant-9");
            assertThat(MDC.get(CorrelationContext.MDC_AUTH_SOURCE)).isEqualTo("saas_db");
        }

        @Test
        @DisplayName("enrichCaller is a no-op without a context")
        void enrichCallerWithoutContext() {
            CorrelationContextHolder.enrichCaller("tenant-9", "saas_db");

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isNull();
        }

        @Test
        @DisplayName("clear removes every MDC key")
        void clearRemovesMdc() {
            CorrelationContextHolder.set(new CorrelationContext("c", "r", "t", "dev_mode"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_REQUEST_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_TENANT_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_AUTH_SOURCE)).isNull();
        }
    }
}
