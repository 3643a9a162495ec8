package com.chartgate.database.migration;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Migration scripts must be packaged where the Flyway locations point.
 */
@DisplayName("Migration SQL resources")
class MigrationResourceTest {

    @ParameterizedTest
    @ValueSource(strings = {
        "db/migration/accounts/V1__accounts_schema.sql",
        "db/migration/accounts/V2__seed_plans.sql",
        "db/migration/usage/V1__usage_schema.sql"
    })
    @DisplayName("script is on the classpath and not empty")
    void onClasspath(String path) throws IOException {
        assertThat(read(path)).isNotBlank();
    }

    @Test
    @DisplayName("usage counters are keyed by tenant and period")
    void usageKey() throws IOException {
        assertThat(read("db/migration/usage/V1__usage_schema.sql"))
                .contains("PRIMARY KEY (tenant_id, period_start)");
    }

    @Test
    @DisplayName("API keys store a salted hash, never the secret")
    void apiKeyColumns() throws IOException {
        assertThat(read("db/migration/accounts/V1__accounts_schema.sql"))
                .contains("key_salt", "key_hash")
                .doesNotContain("secret");
    }

    private String read(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as(path + " must be on the classpath").isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
