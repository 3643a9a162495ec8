package com.chartgate.database;

import static org.assertj.core.api.Assertions.assertThat;

import com.chartgate.database.migration.MigrationService;
import com.chartgate.database.migration.MigrationService.StoreStatus;
import com.chartgate.metering.UsageStore;
import com.chartgate.security.KeyRepository;
import java.time.Clock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

@DisplayName("StoreConfiguration")
class StoreConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(StoreConfiguration.class)
            .withBean(Clock.class, Clock::systemUTC);

    private static String[] storeProperties(String accountsUrl, String usageUrl) {
        return new String[] {
            "chartgate.flyway.accounts.url=" + accountsUrl,
            "chartgate.flyway.accounts.username=sa",
            "chartgate.flyway.accounts.locations=classpath:db/migration/accounts",
            "chartgate.flyway.accounts.history-table=flyway_accounts_history",
            "chartgate.flyway.accounts.enabled=true",
            "chartgate.flyway.usage.url=" + usageUrl,
            "chartgate.flyway.usage.username=sa",
            "chartgate.flyway.usage.locations=classpath:db/migration/usage",
            "chartgate.flyway.usage.history-table=flyway_usage_history",
            "chartgate.flyway.usage.enabled=true"
        };
    }

    @Test
    @DisplayName("migrates both stores and exposes the repositories")
    void separateDatabases() {
        runner.withPropertyValues(storeProperties(TestStores.newUrl(), TestStores.newUrl()))
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context).hasSingleBean(KeyRepository.class);
                    assertThat(context).hasSingleBean(UsageStore.class);
                    assertThat(context.getBean(KeyRepository.class).listPlans()).hasSize(3);
                    assertThat(context.getBean(MigrationService.class).statuses())
                            .extracting(StoreStatus::store)
                            .containsExactly(StoreConfiguration.ACCOUNTS_STORE, StoreConfiguration.USAGE_STORE);
                    assertThat(context.getBean(MigrationService.class).statuses())
                            .allMatch(StoreStatus::upToDate);
                });
    }

    @Test
    @DisplayName("both stores can share one database")
    void sharedDatabase() {
        String url = TestStores.newUrl();
        runner.withPropertyValues(storeProperties(url, url))
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(KeyRepository.class).listPlans()).hasSize(3);
                    assertThat(context.getBean(UsageStore.class).history("t1", 12)).isEmpty();
                    assertThat(context.getBean(MigrationService.class).status("usage").orElseThrow()
                            .currentVersion()).isEqualTo("1");
                });
    }

    @Test
    @DisplayName("fails to start without store settings")
    void missingSettings() {
        runner.run(context -> assertThat(context).hasFailed());
    }
}
