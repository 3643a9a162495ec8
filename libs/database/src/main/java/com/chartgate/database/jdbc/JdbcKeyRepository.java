package com.chartgate.database.jdbc;

import com.chartgate.security.AccountExistsException;
import com.chartgate.security.ApiKey;
import com.chartgate.security.CreatedKey;
import com.chartgate.security.KeyMatch;
import com.chartgate.security.KeyRepository;
import com.chartgate.security.Plan;
import com.chartgate.security.RateLimitSpec;
import com.chartgate.security.SecretHasher;
import com.chartgate.security.StorageUnavailableException;
import com.chartgate.security.Tenant;
import com.chartgate.security.TenantCredentials;
import com.chartgate.security.TenantStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * {@link KeyRepository} on the accounts store.
 *
 * <p>Secrets are never stored: each key row holds a clear 8-character prefix, a random salt and
 * {@code SHA-256(salt || secret)}. {@link #findBySecret} loads every non-revoked candidate with the
 * presented prefix and hashes against all of them before deciding.
 */
public class JdbcKeyRepository implements KeyRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcKeyRepository.class);

    private static final String TENANT_COLUMNS =
            "t.tenant_id, t.name AS tenant_name, t.email, t.plan_id, t.status, t.created_at AS tenant_created_at";

    private static final String PLAN_COLUMNS =
            "p.plan_id AS p_plan_id, p.name AS plan_name, p.rate_limit, p.monthly_quota";

    private final JdbcClient jdbc;
    private final Clock clock;
    private final SecretHasher hasher;

    public JdbcKeyRepository(JdbcClient jdbc, Clock clock) {
        this(jdbc, clock, new SecretHasher());
    }

    public JdbcKeyRepository(JdbcClient jdbc, Clock clock, SecretHasher hasher) {
        this.jdbc = jdbc;
        this.clock = clock;
        this.hasher = hasher;
    }

    private record Candidate(ApiKey apiKey, String salt, String hash, Tenant tenant, Plan plan) {}

    // ── API keys ──

    @Override
    public Optional<KeyMatch> findBySecret(String presentedSecret) {
        if (presentedSecret == null || presentedSecret.isEmpty()) {
            return Optional.empty();
        }
        List<Candidate> candidates = access("find key", () -> jdbc.sql(
                        "SELECT k.key_id, k.tenant_id AS k_tenant_id, k.name AS key_name, k.key_prefix,"
                                + " k.key_salt, k.key_hash, k.created_at AS key_created_at,"
                                + " k.expires_at, k.revoked_at, "
                                + TENANT_COLUMNS + ", " + PLAN_COLUMNS
                                + " FROM api_keys k"
                                + " JOIN tenants t ON t.tenant_id = k.tenant_id"
                                + " JOIN plans p ON p.plan_id = t.plan_id"
                                + " WHERE k.key_prefix = :prefix AND k.revoked_at IS NULL")
                .param("prefix", SecretHasher.lookupPrefix(presentedSecret))
                .query((rs, row) -> new Candidate(
                        new ApiKey(rs.getString("key_id"), rs.getString("k_tenant_id"),
                                rs.getString("key_name"), rs.getString("key_prefix"),
                                instant(rs, "key_created_at"), instant(rs, "expires_at"),
                                instant(rs, "revoked_at")),
                        rs.getString("key_salt"),
                        rs.getString("key_hash"),
                        mapTenant(rs),
                        mapPlan(rs, "p_plan_id")))
                .list());

        Candidate matched = null;
        for (Candidate candidate : candidates) {
            if (hasher.matches(candidate.salt(), presentedSecret, candidate.hash()) && matched == null) {
                matched = candidate;
            }
        }
        if (matched == null || !matched.apiKey().isLive(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(new KeyMatch(matched.apiKey(), matched.tenant(), matched.plan()));
    }

    @Override
    public CreatedKey createKey(String tenantId, String displayName, Instant expiresAt) {
        if (getTenant(tenantId).isEmpty()) {
            throw new IllegalArgumentException("Unknown tenant: " + tenantId);
        }
        String secret = hasher.newSecret();
        String salt = hasher.newSalt();
        ApiKey apiKey = new ApiKey(UUID.randomUUID().toString(), tenantId, displayName,
                SecretHasher.lookupPrefix(secret), clock.instant(), expiresAt, null);
        access("create key", () -> jdbc.sql(
                        """
                        INSERT INTO api_keys
                            (key_id, tenant_id, name, key_prefix, key_salt, key_hash, created_at, expires_at)
                        VALUES (:keyId, :tenantId, :name, :prefix, :salt, :hash, :createdAt, :expiresAt)
                        """)
                .param("keyId", apiKey.keyId())
                .param("tenantId", tenantId)
                .param("name", displayName)
                .param("prefix", apiKey.keyPrefix())
                .param("salt", salt)
                .param("hash", hasher.hash(salt, secret))
                .param("createdAt", timestamp(apiKey.createdAt()))
                .param("expiresAt", timestamp(expiresAt), Types.TIMESTAMP)
                .update());
        log.info("Created API key {} ({}...) for tenant {}", apiKey.keyId(), apiKey.keyPrefix(), tenantId);
        return new CreatedKey(apiKey, secret);
    }

    @Override
    public boolean revokeKey(String keyId) {
        int rows = access("revoke key", () -> jdbc.sql(
                        "UPDATE api_keys SET revoked_at = :now WHERE key_id = :keyId AND revoked_at IS NULL")
                .param("now", timestamp(clock.instant()))
                .param("keyId", keyId)
                .update());
        return rows == 1;
    }

    @Override
    public boolean revokeKey(String keyId, String tenantId) {
        int rows = access("revoke key", () -> jdbc.sql(
                        """
                        UPDATE api_keys SET revoked_at = :now
                        WHERE key_id = :keyId AND tenant_id = :tenantId AND revoked_at IS NULL
                        """)
                .param("now", timestamp(clock.instant()))
                .param("keyId", keyId)
                .param("tenantId", tenantId)
                .update());
        return rows == 1;
    }

    @Override
    public List<ApiKey> listKeys(String tenantId) {
        return access("list keys", () -> jdbc.sql(
                        """
                        SELECT key_id, tenant_id, name, key_prefix, created_at, expires_at, revoked_at
                        FROM api_keys WHERE tenant_id = :tenantId ORDER BY created_at DESC, key_id
                        """)
                .param("tenantId", tenantId)
                .query((rs, row) -> new ApiKey(rs.getString("key_id"), rs.getString("tenant_id"),
                        rs.getString("name"), rs.getString("key_prefix"), instant(rs, "created_at"),
                        instant(rs, "expires_at"), instant(rs, "revoked_at")))
                .list());
    }

    // ── Tenants ──

    @Override
    public Tenant createTenant(String name, String email, String passwordHash, String planId) {
        if (getPlan(planId).isEmpty()) {
            throw new IllegalArgumentException("Unknown plan: " + planId);
        }
        String normalized = email.strip().toLowerCase(Locale.ROOT);
        Tenant tenant = new Tenant(UUID.randomUUID().toString(), name, normalized, planId,
                TenantStatus.ACTIVE, clock.instant());
        try {
            jdbc.sql(
                            """
                            INSERT INTO tenants
                                (tenant_id, name, email, password_hash, plan_id, status, created_at)
                            VALUES (:tenantId, :name, :email, :passwordHash, :planId, :status, :createdAt)
                            """)
                    .param("tenantId", tenant.tenantId())
                    .param("name", name)
                    .param("email", normalized)
                    .param("passwordHash", passwordHash)
                    .param("planId", planId)
                    .param("status", TenantStatus.ACTIVE.value())
                    .param("createdAt", timestamp(tenant.createdAt()))
                    .update();
        } catch (DuplicateKeyException e) {
            throw new AccountExistsException(normalized);
        } catch (DataAccessException e) {
            throw unavailable("create tenant", e);
        }
        log.info("Registered tenant {} on plan {}", tenant.tenantId(), planId);
        return tenant;
    }

    @Override
    public Optional<Tenant> getTenant(String tenantId) {
        return access("get tenant", () -> jdbc.sql(
                        "SELECT " + TENANT_COLUMNS + " FROM tenants t WHERE t.tenant_id = :tenantId")
                .param("tenantId", tenantId)
                .query((rs, row) -> mapTenant(rs))
                .optional());
    }

    @Override
    public Optional<TenantCredentials> findCredentialsByEmail(String email) {
        String normalized = email.strip().toLowerCase(Locale.ROOT);
        return access("find tenant by email", () -> jdbc.sql(
                        "SELECT " + TENANT_COLUMNS + ", t.password_hash FROM tenants t WHERE t.email = :email")
                .param("email", normalized)
                .query((rs, row) -> new TenantCredentials(mapTenant(rs), rs.getString("password_hash")))
                .optional());
    }

    @Override
    public List<Tenant> listTenants() {
        return access("list tenants", () -> jdbc.sql(
                        "SELECT " + TENANT_COLUMNS + " FROM tenants t ORDER BY t.created_at DESC, t.tenant_id")
                .query((rs, row) -> mapTenant(rs))
                .list());
    }

    @Override
    public Optional<Tenant> setPlan(String tenantId, String planId) {
        if (getPlan(planId).isEmpty()) {
            throw new IllegalArgumentException("Unknown plan: " + planId);
        }
        int rows = access("set plan", () -> jdbc.sql(
                        "UPDATE tenants SET plan_id = :planId WHERE tenant_id = :tenantId")
                .param("planId", planId)
                .param("tenantId", tenantId)
                .update());
        if (rows == 1) {
            log.info("Tenant {} moved to plan {}", tenantId, planId);
        }
        return rows == 1 ? getTenant(tenantId) : Optional.empty();
    }

    @Override
    public Optional<Tenant> setStatus(String tenantId, TenantStatus status) {
        int rows = access("set status", () -> jdbc.sql(
                        "UPDATE tenants SET status = :status WHERE tenant_id = :tenantId")
                .param("status", status.value())
                .param("tenantId", tenantId)
                .update());
        if (rows == 1) {
            log.info("Tenant {} is now {}", tenantId, status.value());
        }
        return rows == 1 ? getTenant(tenantId) : Optional.empty();
    }

    // ── Plans ──

    @Override
    public Optional<Plan> getPlan(String planId) {
        return access("get plan", () -> jdbc.sql(
                        "SELECT " + PLAN_COLUMNS + " FROM plans p WHERE p.plan_id = :planId")
                .param("planId", planId)
                .query((rs, row) -> mapPlan(rs, "p_plan_id"))
                .optional());
    }

    @Override
    public List<Plan> listPlans() {
        return access("list plans", () -> jdbc.sql(
                        "SELECT " + PLAN_COLUMNS + " FROM plans p ORDER BY p.plan_id")
                .query((rs, row) -> mapPlan(rs, "p_plan_id"))
                .list());
    }

    // ── Mapping ──

    private static Tenant mapTenant(ResultSet rs) throws SQLException {
        return new Tenant(
                rs.getString("tenant_id"),
                rs.getString("tenant_name"),
                rs.getString("email"),
                rs.getString("plan_id"),
                TenantStatus.fromValue(rs.getString("status")),
                instant(rs, "tenant_created_at"));
    }

    private static Plan mapPlan(ResultSet rs, String idColumn) throws SQLException {
        String rateLimit = rs.getString("rate_limit");
        return new Plan(
                rs.getString(idColumn),
                rs.getString("plan_name"),
                rateLimit == null ? null : RateLimitSpec.parse(rateLimit),
                rs.getObject("monthly_quota", Long.class));
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static <T> T access(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            throw unavailable(operation, e);
        }
    }

    private static StorageUnavailableException unavailable(String operation, DataAccessException e) {
        log.error("Accounts store failed to {}: {}", operation, e.getMessage());
        return new StorageUnavailableException("Accounts store unavailable (" + operation + ")", e);
    }
}
