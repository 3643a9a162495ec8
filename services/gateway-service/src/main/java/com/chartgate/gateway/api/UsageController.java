package com.chartgate.gateway.api;

import com.chartgate.gateway.gate.Gate;
import com.chartgate.metering.QuotaTracker;
import com.chartgate.security.TenantContext;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Usage of the calling API key. Identifies the caller without counting the request.
 */
@RestController
public class UsageController {

    private final Gate gate;
    private final QuotaTracker quota;

    public UsageController(Gate gate, QuotaTracker quota) {
        this.gate = gate;
        this.quota = quota;
    }

    @GetMapping("/v1/usage")
    public UsageResponse usage(
            @RequestHeader(value = ChartController.API_KEY_HEADER, required = false) String apiKey) {
        TenantContext context = gate.identify(apiKey);
        String usageKey = context.usageKey();
        return UsageResponse.of(context, quota.currentUsage(usageKey), quota.history(usageKey));
    }
}
