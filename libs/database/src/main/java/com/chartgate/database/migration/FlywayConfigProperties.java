package com.chartgate.database.migration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and migration settings of the two stores.
 *
 * <pre>{@code
 * chartgate:
 *   flyway:
 *     accounts:
 *       url: ${ACCOUNTS_DB_URL:jdbc:postgresql://localhost:5432/chartgate}
 *       username: chartgate
 *       password: ${ACCOUNTS_DB_PASSWORD:}
 *       locations: classpath:db/migration/accounts
 *       history-table: flyway_accounts_history
 *       enabled: true
 *     usage:
 *       url: ${USAGE_DB_URL:jdbc:postgresql://localhost:5432/chartgate}
 *       ...
 * }</pre>
 *
 * @param accounts plans, tenants and API keys
 * @param usage    usage counters and quota reservations
 */
@Validated
@ConfigurationProperties(prefix = "chartgate.flyway")
public record FlywayConfigProperties(
        @NotNull @Valid DatabaseConfig accounts, @NotNull @Valid DatabaseConfig usage) {

    /**
     * One store.
     *
     * @param url          JDBC URL
     * @param username     database user
     * @param password     database password, may be empty
     * @param locations    Flyway migration locations
     * @param historyTable Flyway history table; distinct per store so both can share a database
     * @param enabled      whether pending migrations run on startup
     */
    public record DatabaseConfig(
            @NotBlank String url,
            @NotBlank String username,
            String password,
            @NotBlank String locations,
            @NotBlank String historyTable,
            boolean enabled) {}
}
