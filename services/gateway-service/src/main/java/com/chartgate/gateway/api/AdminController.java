package com.chartgate.gateway.api;

import com.chartgate.metering.QuotaTracker;
import com.chartgate.security.CreatedKey;
import com.chartgate.security.KeyRepository;
import com.chartgate.security.Tenant;
import com.chartgate.security.TenantStatus;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for tenants, their keys and usage. Plan and status changes apply to the
 * tenant's next request.
 */
@RestController
@RequestMapping("/admin/v1")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final AdminAuthenticator authenticator;
    private final KeyRepository keys;
    private final QuotaTracker quota;

    public AdminController(AdminAuthenticator authenticator, KeyRepository keys, QuotaTracker quota) {
        this.authenticator = authenticator;
        this.keys = keys;
        this.quota = quota;
    }

    @GetMapping("/tenants")
    public Map<String, List<TenantView>> listTenants(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        authenticator.authenticate(authorization);
        return Map.of("tenants", keys.listTenants().stream().map(this::view).toList());
    }

    @GetMapping("/tenants/{tenantId}")
    public TenantView getTenant(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String tenantId) {
        authenticator.authenticate(authorization);
        return view(tenant(tenantId));
    }

    @PatchMapping("/tenants/{tenantId}")
    public TenantView updateTenant(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String tenantId,
            @RequestBody TenantUpdateRequest request) {
        authenticator.authenticate(authorization);
        Tenant tenant = tenant(tenantId);
        if (request.status() != null) {
            TenantStatus status = TenantStatus.fromValue(request.status());
            tenant = keys.setStatus(tenantId, status).orElseThrow(() -> notFound(tenantId));
            log.info("Tenant {} set to {}", tenantId, status.value());
        }
        if (request.planId() != null) {
            tenant = keys.setPlan(tenantId, request.planId()).orElseThrow(() -> notFound(tenantId));
            log.info("Tenant {} moved to plan {}", tenantId, request.planId());
        }
        return view(tenant);
    }

    @GetMapping("/tenants/{tenantId}/keys")
    public Map<String, List<KeyView>> listKeys(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String tenantId) {
        authenticator.authenticate(authorization);
        tenant(tenantId);
        return Map.of("keys", keys.listKeys(tenantId).stream().map(KeyView::from).toList());
    }

    @PostMapping("/tenants/{tenantId}/keys")
    @ResponseStatus(HttpStatus.CREATED)
    public CreatedKeyResponse createKey(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String tenantId,
            @Valid @RequestBody(required = false) KeyCreateRequest request) {
        authenticator.authenticate(authorization);
        tenant(tenantId);
        KeyCreateRequest body = request != null ? request : new KeyCreateRequest(null, null);
        CreatedKey created = keys.createKey(tenantId, body.name(), body.expiresAt());
        log.info("Operator created key {} for tenant {}", created.apiKey().keyId(), tenantId);
        return CreatedKeyResponse.from(created);
    }

    @DeleteMapping("/tenants/{tenantId}/keys/{keyId}")
    public Map<String, String> revokeKey(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String tenantId,
            @PathVariable String keyId) {
        authenticator.authenticate(authorization);
        if (!keys.revokeKey(keyId, tenantId)) {
            throw new ResourceNotFoundException("Key not found.");
        }
        log.info("Operator revoked key {} of tenant {}", keyId, tenantId);
        return Map.of("status", "revoked");
    }

    @GetMapping("/tenants/{tenantId}/usage")
    public Map<String, Object> usage(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String tenantId) {
        authenticator.authenticate(authorization);
        tenant(tenantId);
        return Map.of(
                "current", UsagePeriodView.from(quota.currentUsage(tenantId)),
                "history", quota.history(tenantId).stream().map(UsagePeriodView::from).toList());
    }

    @GetMapping("/plans")
    public Map<String, List<PlanView>> listPlans(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        authenticator.authenticate(authorization);
        return Map.of("plans", keys.listPlans().stream().map(PlanView::from).toList());
    }

    private Tenant tenant(String tenantId) {
        return keys.getTenant(tenantId).orElseThrow(() -> notFound(tenantId));
    }

    private TenantView view(Tenant tenant) {
        return TenantView.from(tenant, keys.getPlan(tenant.planId()).orElse(null));
    }

    private static ResourceNotFoundException notFound(String tenantId) {
        return new ResourceNotFoundException("Tenant not found: " + tenantId);
    }
}
