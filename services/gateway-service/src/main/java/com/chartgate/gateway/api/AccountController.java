package com.chartgate.gateway.api;

import com.chartgate.metering.QuotaTracker;
import com.chartgate.security.AccountSession;
import com.chartgate.security.ApiKey;
import com.chartgate.security.CreatedKey;
import com.chartgate.security.KeyRepository;
import com.chartgate.security.SessionAuthenticator;
import com.chartgate.security.Tenant;
import com.chartgate.security.TenantCredentials;
import com.chartgate.security.TokenIssuer;
import com.chartgate.security.UnauthorizedException;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Self-service account endpoints: registration, login and, with a session token, profile, keys
 * and usage.
 */
@RestController
@RequestMapping("/v1/account")
public class AccountController {

    private static final Logger log = LoggerFactory.getLogger(AccountController.class);

    /** Plan every new account starts on. */
    static final String SIGNUP_PLAN = "free";

    private final KeyRepository keys;
    private final TokenIssuer tokens;
    private final SessionAuthenticator sessions;
    private final PasswordEncoder passwordEncoder;
    private final QuotaTracker quota;

    public AccountController(
            KeyRepository keys,
            TokenIssuer tokens,
            SessionAuthenticator sessions,
            PasswordEncoder passwordEncoder,
            QuotaTracker quota) {
        this.keys = keys;
        this.tokens = tokens;
        this.sessions = sessions;
        this.passwordEncoder = passwordEncoder;
        this.quota = quota;
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public TokenResponse register(@Valid @RequestBody RegisterRequest request) {
        Tenant tenant = keys.createTenant(
                request.name().strip(),
                request.email().strip(),
                passwordEncoder.encode(request.password()),
                SIGNUP_PLAN);
        log.info("Registered tenant {} on plan {}", tenant.tenantId(), tenant.planId());
        return issue(tenant);
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        Optional<TenantCredentials> credentials = keys.findCredentialsByEmail(request.email().strip());
        if (credentials.isEmpty()
                || !credentials.get().tenant().isActive()
                || !passwordEncoder.matches(request.password(), credentials.get().passwordHash())) {
            throw new UnauthorizedException("Invalid email or password.");
        }
        return issue(credentials.get().tenant());
    }

    @GetMapping("/me")
    public TenantView me(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        Tenant tenant = currentTenant(authorization);
        return TenantView.from(tenant, keys.getPlan(tenant.planId()).orElse(null));
    }

    @GetMapping("/usage")
    public Map<String, Object> usage(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        Tenant tenant = currentTenant(authorization);
        return Map.of(
                "current", UsagePeriodView.from(quota.currentUsage(tenant.tenantId())),
                "history", quota.history(tenant.tenantId()).stream().map(UsagePeriodView::from).toList());
    }

    @GetMapping("/keys")
    public Map<String, List<KeyView>> listKeys(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        Tenant tenant = currentTenant(authorization);
        List<ApiKey> tenantKeys = keys.listKeys(tenant.tenantId());
        return Map.of("keys", tenantKeys.stream().map(KeyView::from).toList());
    }

    @PostMapping("/keys")
    @ResponseStatus(HttpStatus.CREATED)
    public CreatedKeyResponse createKey(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @Valid @RequestBody(required = false) KeyCreateRequest request) {
        Tenant tenant = currentTenant(authorization);
        KeyCreateRequest body = request != null ? request : new KeyCreateRequest(null, null);
        CreatedKey created = keys.createKey(tenant.tenantId(), body.name(), body.expiresAt());
        log.info("Tenant {} created key {}", tenant.tenantId(), created.apiKey().keyId());
        return CreatedKeyResponse.from(created);
    }

    @DeleteMapping("/keys/{keyId}")
    public Map<String, String> revokeKey(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String keyId) {
        Tenant tenant = currentTenant(authorization);
        if (!keys.revokeKey(keyId, tenant.tenantId())) {
            throw new ResourceNotFoundException("Key not found.");
        }
        log.info("Tenant {} revoked key {}", tenant.tenantId(), keyId);
        return Map.of("status", "revoked");
    }

    private Tenant currentTenant(String authorization) {
        AccountSession session = sessions.authenticate(authorization);
        return keys.getTenant(session.accountId())
                .orElseThrow(() -> new ResourceNotFoundException("Account not found."));
    }

    private TokenResponse issue(Tenant tenant) {
        String token = tokens.issue(tenant.tenantId(), tenant.email());
        return TokenResponse.bearer(token, tokens.ttl().toSeconds(), tenant.tenantId());
    }
}
