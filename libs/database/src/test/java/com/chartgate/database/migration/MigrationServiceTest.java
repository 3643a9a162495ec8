package com.chartgate.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import com.chartgate.database.TestStores;
import com.zaxxer.hikari.HikariDataSource;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.jdbc.DataSourceBuilder;

@DisplayName("MigrationService")
class MigrationServiceTest {

    private HikariDataSource accounts;
    private HikariDataSource usage;
    private Map<String, Flyway> flyways;

    @BeforeEach
    void setUp() {
        accounts = emptyDatabase();
        usage = emptyDatabase();
        flyways = new LinkedHashMap<>();
        flyways.put("accounts", Flyway.configure().dataSource(accounts)
                .locations("classpath:db/migration/accounts").table("flyway_accounts_history").load());
        flyways.put("usage", Flyway.configure().dataSource(usage)
                .locations("classpath:db/migration/usage").table("flyway_usage_history").load());
    }

    @AfterEach
    void tearDown() {
        accounts.close();
        usage.close();
    }

    @Test
    @DisplayName("migrates enabled stores only")
    void migratesEnabledStores() {
        MigrationService service = new MigrationService(flyways, Set.of("accounts"));

        service.migrate();

        MigrationService.StoreStatus accountsStatus = service.status("accounts").orElseThrow();
        assertThat(accountsStatus.appliedMigrations()).isEqualTo(2);
        assertThat(accountsStatus.currentVersion()).isEqualTo("2");
        assertThat(accountsStatus.lastInstalledOn()).isNotNull();
        assertThat(accountsStatus.upToDate()).isTrue();

        MigrationService.StoreStatus usageStatus = service.status("usage").orElseThrow();
        assertThat(usageStatus.pendingMigrations()).isEqualTo(1);
        assertThat(usageStatus.currentVersion()).isNull();
        assertThat(usageStatus.upToDate()).isFalse();
    }

    @Test
    @DisplayName("migrating twice applies nothing new")
    void idempotent() {
        MigrationService service = new MigrationService(flyways, Set.of("accounts", "usage"));

        service.migrate();
        service.migrate();

        assertThat(service.statuses()).extracting(MigrationService.StoreStatus::appliedMigrations)
                .containsExactly(2, 1);
    }

    @Test
    @DisplayName("unknown store has no status")
    void unknownStore() {
        assertThat(new MigrationService(flyways, Set.of()).status("billing")).isEmpty();
    }

    private static HikariDataSource emptyDatabase() {
        return DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(TestStores.newUrl())
                .username("sa")
                .password("")
                .build();
    }
}
