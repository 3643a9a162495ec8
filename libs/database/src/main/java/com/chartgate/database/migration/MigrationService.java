package com.chartgate.database.migration;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs and reports Flyway migrations of the configured stores.
 *
 * <p>A POJO: the Spring wiring lives in {@code StoreConfiguration}, which calls {@link #migrate()}
 * as the bean's init method so repositories never see an unmigrated schema.
 */
public class MigrationService {

    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    /**
     * Migration state of one store.
     *
     * @param store             store name (e.g., "accounts")
     * @param appliedMigrations successfully applied migrations
     * @param pendingMigrations migrations not yet applied
     * @param currentVersion    current schema version, null if none applied
     * @param lastInstalledOn   when the latest migration was applied, null if none
     */
    public record StoreStatus(
            String store,
            int appliedMigrations,
            int pendingMigrations,
            String currentVersion,
            Instant lastInstalledOn) {

        public boolean upToDate() {
            return pendingMigrations == 0;
        }
    }

    private final Map<String, Flyway> flywayByStore;
    private final Set<String> enabledStores;

    /**
     * @param flywayByStore Flyway instance per store name, in migration order
     * @param enabledStores stores whose pending migrations {@link #migrate()} applies
     */
    public MigrationService(Map<String, Flyway> flywayByStore, Set<String> enabledStores) {
        this.flywayByStore = new LinkedHashMap<>(flywayByStore);
        this.enabledStores = Set.copyOf(enabledStores);
    }

    /** Applies pending migrations of every enabled store. */
    public void migrate() {
        flywayByStore.forEach((store, flyway) -> {
            if (!enabledStores.contains(store)) {
                log.info("Migrations disabled for {} store", store);
                return;
            }
            MigrateResult result = flyway.migrate();
            log.info("Migrated {} store: {} migration(s) applied, schema version {}",
                    store, result.migrationsExecuted, result.targetSchemaVersion);
        });
    }

    /** Status of every store, in configuration order. */
    public List<StoreStatus> statuses() {
        return flywayByStore.keySet().stream().map(this::status).flatMap(Optional::stream).toList();
    }

    /** Status of one store, empty if no such store is configured. */
    public Optional<StoreStatus> status(String store) {
        Flyway flyway = flywayByStore.get(store);
        if (flyway == null) {
            return Optional.empty();
        }
        MigrationInfoService info = flyway.info();
        MigrationInfo current = info.current();
        return Optional.of(new StoreStatus(
                store,
                info.applied().length,
                info.pending().length,
                current == null || current.getVersion() == null
                        ? null
                        : current.getVersion().getVersion(),
                current == null || current.getInstalledOn() == null
                        ? null
                        : current.getInstalledOn().toInstant()));
    }
}
