package com.chartgate.gateway.api;

import com.chartgate.gateway.config.ServiceProperties;
import com.chartgate.observability.HealthCheckRegistry;
import com.chartgate.observability.HealthResult;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public liveness and service info. {@code /health} answers 503 while a store is unreachable.
 */
@RestController
public class HealthController {

    private final HealthCheckRegistry healthChecks;
    private final ServiceProperties service;
    private final Clock clock;

    public HealthController(HealthCheckRegistry healthChecks, ServiceProperties service, Clock clock) {
        this.healthChecks = healthChecks;
        this.service = service;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResult> health() {
        HealthResult result = healthChecks.checkAll();
        HttpStatus status = result.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/")
    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", service.name());
        info.put("version", service.version());
        info.put("environment", service.environment());
        info.put("docs", "/v1/charts");
        info.put("timestamp", clock.instant().toString());
        return info;
    }
}
