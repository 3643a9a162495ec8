package com.chartgate.gateway.api;

import com.chartgate.gateway.gate.Gate;
import com.chartgate.metering.BillingPeriod;
import com.chartgate.metering.QuotaTracker;
import com.chartgate.metering.UsageRecord;
import com.chartgate.security.AuthSource;
import com.chartgate.security.Plan;
import com.chartgate.security.RateLimitSpec;
import com.chartgate.security.TenantContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("UsageController")
class UsageControllerTest {

    private static final BillingPeriod JUNE = BillingPeriod.of(Instant.parse("2026-06-15T12:00:00Z"));
    private static final BillingPeriod MAY = BillingPeriod.of(Instant.parse("2026-05-15T12:00:00Z"));

    private final Gate gate = mock(Gate.class);
    private final QuotaTracker quota = mock(QuotaTracker.class);
    private final UsageController controller = new UsageController(gate, quota);

    @Test
    @DisplayName("should report current usage, remaining quota and history for a tenant key")
    void shouldReportTenantUsage() {
        Plan plan = new Plan("starter", "Starter", RateLimitSpec.parse("60/minute"), 100L);
        when(gate.identify("cg_live_key")).thenReturn(
                new TenantContext("t-1", plan, AuthSource.SAAS_DB, "k-1", "tenant:t-1"));
        when(quota.currentUsage("t-1")).thenReturn(new UsageRecord("t-1", JUNE, 40));
        when(quota.history("t-1")).thenReturn(List.of(
                new UsageRecord("t-1", JUNE, 40), new UsageRecord("t-1", MAY, 90)));

        UsageResponse response = controller.usage("cg_live_key");

        assertThat(response.metered()).isTrue();
        assertThat(response.tenantId()).isEqualTo("t-1");
        assertThat(response.authSource()).isEqualTo("saas_db");
        assertThat(response.current().requestCount()).isEqualTo(40);
        assertThat(response.remaining()).isEqualTo(60L);
        assertThat(response.history()).extracting(UsagePeriodView::period)
                .containsExactly(JUNE.id(), MAY.id());
    }

    @Test
    @DisplayName("should report static-key usage by key fingerprint without a quota")
    void shouldReportStaticKeyUsageByFingerprint() {
        TenantContext context =
                TenantContext.forStaticKey("static-key", Plan.envFallback(RateLimitSpec.parse("10/minute")));
        when(gate.identify("static-key")).thenReturn(context);
        when(quota.currentUsage(context.usageKey())).thenReturn(new UsageRecord(context.usageKey(), JUNE, 7));
        when(quota.history(context.usageKey())).thenReturn(List.of(new UsageRecord(context.usageKey(), JUNE, 7)));

        UsageResponse response = controller.usage("static-key");

        assertThat(response.metered()).isFalse();
        assertThat(response.tenantId()).isNull();
        assertThat(response.usageKey()).startsWith("key:").doesNotContain("static-key");
        assertThat(response.current().requestCount()).isEqualTo(7);
        assertThat(response.remaining()).isNull();
        assertThat(response.history()).hasSize(1);
        verify(quota).currentUsage(context.usageKey());
    }
}
