package com.chartgate.database;

import com.chartgate.database.migration.FlywayConfigProperties.DatabaseConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.UUID;
import org.springframework.boot.jdbc.DataSourceBuilder;

/**
 * Fresh, migrated H2 databases for store tests.
 */
public final class TestStores {

    private TestStores() {
        // utility class
    }

    /** A unique in-memory H2 URL in PostgreSQL mode. */
    public static String newUrl() {
        return "jdbc:h2:mem:" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000";
    }

    public static HikariDataSource accounts() {
        return migrated(newUrl(), "classpath:db/migration/accounts", "flyway_accounts_history");
    }

    public static HikariDataSource usage() {
        return migrated(newUrl(), "classpath:db/migration/usage", "flyway_usage_history");
    }

    private static HikariDataSource migrated(String url, String locations, String historyTable) {
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(url)
                .username("sa")
                .password("")
                .build();
        StoreConfiguration.flyway(dataSource,
                new DatabaseConfig(url, "sa", "", locations, historyTable, true)).migrate();
        return dataSource;
    }
}
