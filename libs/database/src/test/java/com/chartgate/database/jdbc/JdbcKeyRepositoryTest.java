package com.chartgate.database.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chartgate.database.TestStores;
import com.chartgate.metering.testing.MutableClock;
import com.chartgate.security.AccountExistsException;
import com.chartgate.security.ApiKey;
import com.chartgate.security.CreatedKey;
import com.chartgate.security.KeyMatch;
import com.chartgate.security.Plan;
import com.chartgate.security.RateLimitSpec;
import com.chartgate.security.StorageUnavailableException;
import com.chartgate.security.Tenant;
import com.chartgate.security.TenantStatus;
import com.zaxxer.hikari.HikariDataSource;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.simple.JdbcClient;

@DisplayName("JdbcKeyRepository")
class JdbcKeyRepositoryTest {

    private final MutableClock clock = MutableClock.at("2026-06-01T08:00:00Z");
    private HikariDataSource dataSource;
    private JdbcKeyRepository repository;

    @BeforeEach
    void setUp() {
        dataSource = TestStores.accounts();
        repository = new JdbcKeyRepository(JdbcClient.create(dataSource), clock);
    }

    @AfterEach
    void tearDown() {
        dataSource.close();
    }

    @Nested
    @DisplayName("plans")
    class Plans {

        @Test
        @DisplayName("seeded plans carry their rate limit and quota")
        void seeded() {
            assertThat(repository.listPlans())
                    .extracting(Plan::planId)
                    .containsExactly("enterprise", "free", "pro");

            Plan free = repository.getPlan("free").orElseThrow();
            assertThat(free.rateLimit()).isEqualTo(RateLimitSpec.parse("10/minute"));
            assertThat(free.monthlyQuota()).isEqualTo(100L);
            assertThat(repository.getPlan("gold")).isEmpty();
        }
    }

    @Nested
    @DisplayName("tenants")
    class Tenants {

        @Test
        @DisplayName("registers an active tenant with a lower-cased email")
        void registers() {
            Tenant tenant = repository.createTenant("Acme", " Ops@Acme.io ", "hash", "free");

            assertThat(tenant.status()).isEqualTo(TenantStatus.ACTIVE);
            assertThat(tenant.email()).isEqualTo("ops@acme.io");
            assertThat(repository.getTenant(tenant.tenantId())).contains(tenant);
            assertThat(repository.findCredentialsByEmail("OPS@acme.io").orElseThrow().passwordHash())
                    .isEqualTo("hash");
        }

        @Test
        @DisplayName("rejects a second registration for the same email")
        void duplicateEmail() {
            repository.createTenant("Acme", "ops@acme.io", "hash", "free");

            assertThatThrownBy(() -> repository.createTenant("Other", "OPS@acme.io", "hash", "pro"))
                    .isInstanceOf(AccountExistsException.class);
        }

        @Test
        @DisplayName("rejects unknown plans")
        void unknownPlan() {
            assertThatThrownBy(() -> repository.createTenant("Acme", "a@acme.io", "h", "gold"))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("plan and status updates are visible on the next read")
        void updates() {
            Tenant tenant = repository.createTenant("Acme", "a@acme.io", "h", "free");

            assertThat(repository.setPlan(tenant.tenantId(), "pro").orElseThrow().planId()).isEqualTo("pro");
            assertThat(repository.setStatus(tenant.tenantId(), TenantStatus.SUSPENDED).orElseThrow().isActive())
                    .isFalse();
            assertThat(repository.setPlan("missing", "pro")).isEmpty();
            assertThat(repository.setStatus("missing", TenantStatus.ACTIVE)).isEmpty();
        }
    }

    @Nested
    @DisplayName("API keys")
    class Keys {

        @Test
        @DisplayName("a created key resolves to its tenant and current plan")
        void resolves() {
            Tenant tenant = repository.createTenant("Acme", "a@acme.io", "h", "free");
            CreatedKey created = repository.createKey(tenant.tenantId(), "ci");

            KeyMatch match = repository.findBySecret(created.rawSecret()).orElseThrow();
            assertThat(match.apiKey().keyId()).isEqualTo(created.apiKey().keyId());
            assertThat(match.tenant().tenantId()).isEqualTo(tenant.tenantId());
            assertThat(match.plan().planId()).isEqualTo("free");

            repository.setPlan(tenant.tenantId(), "enterprise");
            assertThat(repository.findBySecret(created.rawSecret()).orElseThrow().plan().planId())
                    .isEqualTo("enterprise");
        }

        @Test
        @DisplayName("the raw secret is not stored")
        void secretNotStored() {
            Tenant tenant = repository.createTenant("Acme", "a@acme.io", "h", "free");
            CreatedKey created = repository.createKey(tenant.tenantId(), "ci");

            long rows = JdbcClient.create(dataSource)
                    .sql("SELECT COUNT(*) FROM api_keys WHERE key_hash = :s OR key_salt = :s")
                    .param("s", created.rawSecret())
                    .query(Long.class)
                    .single();
            assertThat(rows).isZero();
        }

        @Test
        @DisplayName("a secret sharing only the prefix does not match")
        void prefixOnly() {
            Tenant tenant = repository.createTenant("Acme", "a@acme.io", "h", "free");
            CreatedKey created = repository.createKey(tenant.tenantId(), "ci");

            assertThat(repository.findBySecret(created.rawSecret() + "x")).isEmpty();
            assertThat(repository.findBySecret(created.apiKey().keyPrefix())).isEmpty();
        }

        @Test
        @DisplayName("revoked keys stop resolving and keep their history")
        void revoked() {
            Tenant tenant = repository.createTenant("Acme", "a@acme.io", "h", "free");
            CreatedKey created = repository.createKey(tenant.tenantId(), "ci");

            assertThat(repository.revokeKey(created.apiKey().keyId())).isTrue();
            assertThat(repository.revokeKey(created.apiKey().keyId())).isFalse();

            assertThat(repository.findBySecret(created.rawSecret())).isEmpty();
            assertThat(repository.listKeys(tenant.tenantId()))
                    .singleElement()
                    .extracting(ApiKey::isRevoked)
                    .isEqualTo(true);
        }

        @Test
        @DisplayName("tenant-scoped revocation ignores other tenants' keys")
        void scopedRevocation() {
            Tenant a = repository.createTenant("A", "a@acme.io", "h", "free");
            Tenant b = repository.createTenant("B", "b@acme.io", "h", "free");
            CreatedKey key = repository.createKey(a.tenantId(), "ci");

            assertThat(repository.revokeKey(key.apiKey().keyId(), b.tenantId())).isFalse();
            assertThat(repository.findBySecret(key.rawSecret())).isPresent();
        }

        @Test
        @DisplayName("expired keys stop resolving")
        void expired() {
            Tenant tenant = repository.createTenant("Acme", "a@acme.io", "h", "free");
            CreatedKey created = repository.createKey(
                    tenant.tenantId(), "temp", clock.instant().plus(Duration.ofDays(1)));

            assertThat(repository.findBySecret(created.rawSecret())).isPresent();
            clock.advance(Duration.ofDays(1));
            assertThat(repository.findBySecret(created.rawSecret())).isEmpty();
        }

        @Test
        @DisplayName("creating a key for an unknown tenant fails")
        void unknownTenant() {
            assertThatThrownBy(() -> repository.createKey("missing", "ci"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("storage failures surface as StorageUnavailableException")
    void storageFailure() {
        dataSource.close();

        assertThatThrownBy(() -> repository.findBySecret("cg_anything"))
                .isInstanceOf(StorageUnavailableException.class);
    }
}
