package com.chartgate.gateway.config;

import com.chartgate.database.StoreConfiguration;
import com.chartgate.database.migration.MigrationService;
import com.chartgate.gateway.chart.ChartStore;
import com.chartgate.gateway.gate.Gate;
import com.chartgate.gateway.gate.GateMetrics;
import com.chartgate.metering.QuotaTracker;
import com.chartgate.metering.RateLimiter;
import com.chartgate.metering.UsageStore;
import com.chartgate.observability.HealthCheckRegistry;
import com.chartgate.observability.MetricFactory;
import com.chartgate.security.AuthResolver;
import com.chartgate.security.KeyRepository;
import com.chartgate.security.SessionAuthenticator;
import com.chartgate.security.TokenIssuer;
import io.micrometer.core.instrument.MeterRegistry;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import javax.sql.DataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Composition root of the gate. Settings are read once here and handed to the components as
 * immutable values.
 */
@Configuration
public class GateConfiguration {

    private static final int PROBE_TIMEOUT_SECONDS = 2;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AuthResolver authResolver(KeyRepository keys, GateProperties properties) {
        return new AuthResolver(keys, properties.toAuthSettings());
    }

    @Bean
    public RateLimiter rateLimiter(Clock clock, GateProperties properties) {
        return new RateLimiter(clock, properties.rateLimiterMaxIdentities());
    }

    @Bean
    public QuotaTracker quotaTracker(UsageStore usageStore, Clock clock, GateProperties properties) {
        return new QuotaTracker(usageStore, clock, properties.quotaLease());
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public GateMetrics gateMetrics(MetricFactory metricFactory) {
        return new GateMetrics(metricFactory);
    }

    @Bean
    public Gate gate(
            AuthResolver resolver,
            RateLimiter rateLimiter,
            QuotaTracker quotaTracker,
            GateMetrics metrics,
            Clock clock) {
        return new Gate(resolver, rateLimiter, quotaTracker, metrics, clock);
    }

    @Bean
    public TokenIssuer tokenIssuer(SessionProperties session, Clock clock) {
        return new TokenIssuer(session.secret(), session.ttl(), clock);
    }

    @Bean
    public SessionAuthenticator sessionAuthenticator(TokenIssuer tokenIssuer) {
        return new SessionAuthenticator(tokenIssuer);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public ChartStore chartStore(Clock clock) {
        return new ChartStore(clock, ChartStore.DEFAULT_TTL);
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(
            Clock clock,
            @Qualifier(StoreConfiguration.ACCOUNTS_DATA_SOURCE) DataSource accounts,
            @Qualifier(StoreConfiguration.USAGE_DATA_SOURCE) DataSource usage,
            MigrationService migrations) {
        return new HealthCheckRegistry(clock)
                .register(StoreConfiguration.ACCOUNTS_STORE, () -> ping(accounts))
                .register(StoreConfiguration.USAGE_STORE, () -> ping(usage))
                .register("migrations", () -> {
                    if (!migrations.statuses().stream().allMatch(MigrationService.StoreStatus::upToDate)) {
                        throw new IllegalStateException("Pending migrations");
                    }
                });
    }

    private static void ping(DataSource dataSource) throws SQLException {
        try (Connection connection = dataSource.getConnection()) {
            if (!connection.isValid(PROBE_TIMEOUT_SECONDS)) {
                throw new SQLException("Connection is not valid");
            }
        }
    }
}
