package com.chartgate.gateway;

import com.chartgate.database.StoreConfiguration;
import com.chartgate.gateway.config.AdminProperties;
import com.chartgate.gateway.config.GateProperties;
import com.chartgate.gateway.config.ServiceProperties;
import com.chartgate.gateway.config.SessionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Chart API gateway.
 *
 * <p>Every chart request passes the gate (API key resolution, rate limit, monthly quota) before
 * its handler runs. Account, admin and usage endpoints sit next to it.
 *
 * <p>The accounts and usage stores each get their own DataSource and Flyway history from {@link
 * StoreConfiguration}, so Boot's single-datasource auto-configuration is switched off.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@Import(StoreConfiguration.class)
@EnableConfigurationProperties({
    ServiceProperties.class,
    GateProperties.class,
    SessionProperties.class,
    AdminProperties.class
})
public class GatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
        log.info("Chartgate gateway started");
    }
}
