package com.chartgate.database;

import com.chartgate.database.jdbc.JdbcKeyRepository;
import com.chartgate.database.jdbc.JdbcUsageStore;
import com.chartgate.database.migration.FlywayConfigProperties;
import com.chartgate.database.migration.FlywayConfigProperties.DatabaseConfig;
import com.chartgate.database.migration.MigrationService;
import com.chartgate.metering.UsageStore;
import com.chartgate.security.KeyRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the accounts and usage stores: one DataSource, Flyway instance and {@link JdbcClient} per
 * store, then the {@link KeyRepository} and {@link UsageStore} on top.
 *
 * <p>Spring Boot's single-datasource auto-configuration does not fit two stores, so applications
 * importing this class exclude {@link FlywayAutoConfiguration} and {@code DataSourceAutoConfiguration}.
 * Migrations run through {@link MigrationService#migrate()} before any repository bean is created.
 *
 * <p>Requires a {@link Clock} bean.
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
public class StoreConfiguration {

    public static final String ACCOUNTS_STORE = "accounts";
    public static final String USAGE_STORE = "usage";

    public static final String ACCOUNTS_DATA_SOURCE = "accountsDataSource";
    public static final String USAGE_DATA_SOURCE = "usageDataSource";
    public static final String MIGRATION_SERVICE = "migrationService";

    @Bean(name = ACCOUNTS_DATA_SOURCE)
    @Primary
    public DataSource accountsDataSource(FlywayConfigProperties properties) {
        return dataSource(properties.accounts());
    }

    @Bean(name = USAGE_DATA_SOURCE)
    public DataSource usageDataSource(FlywayConfigProperties properties) {
        return dataSource(properties.usage());
    }

    @Bean(name = MIGRATION_SERVICE, initMethod = "migrate")
    public MigrationService migrationService(
            FlywayConfigProperties properties,
            @Qualifier(ACCOUNTS_DATA_SOURCE) DataSource accounts,
            @Qualifier(USAGE_DATA_SOURCE) DataSource usage) {
        Map<String, Flyway> flyways = new LinkedHashMap<>();
        flyways.put(ACCOUNTS_STORE, flyway(accounts, properties.accounts()));
        flyways.put(USAGE_STORE, flyway(usage, properties.usage()));
        Set<String> enabled = new LinkedHashSet<>();
        if (properties.accounts().enabled()) {
            enabled.add(ACCOUNTS_STORE);
        }
        if (properties.usage().enabled()) {
            enabled.add(USAGE_STORE);
        }
        return new MigrationService(flyways, enabled);
    }

    @Bean
    @DependsOn(MIGRATION_SERVICE)
    public KeyRepository keyRepository(@Qualifier(ACCOUNTS_DATA_SOURCE) DataSource accounts, Clock clock) {
        return new JdbcKeyRepository(JdbcClient.create(accounts), clock);
    }

    @Bean
    @DependsOn(MIGRATION_SERVICE)
    public UsageStore usageStore(@Qualifier(USAGE_DATA_SOURCE) DataSource usage) {
        TransactionTemplate tx = new TransactionTemplate(new DataSourceTransactionManager(usage));
        return new JdbcUsageStore(JdbcClient.create(usage), tx);
    }

    /**
     * A Flyway instance for one store. Baselines at version 0 so a store sharing a database with
     * the other one still runs all of its own migrations.
     */
    static Flyway flyway(DataSource dataSource, DatabaseConfig config) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(config.locations())
                .table(config.historyTable())
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .cleanDisabled(true)
                .load();
    }

    private static DataSource dataSource(DatabaseConfig config) {
        return DataSourceBuilder.create()
                .url(config.url())
                .username(config.username())
                .password(config.password())
                .build();
    }
}
