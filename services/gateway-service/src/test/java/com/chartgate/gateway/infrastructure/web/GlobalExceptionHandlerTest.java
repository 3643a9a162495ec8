package com.chartgate.gateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.chartgate.gateway.api.AdminUnavailableException;
import com.chartgate.gateway.api.ResourceNotFoundException;
import com.chartgate.metering.BillingPeriod;
import com.chartgate.metering.QuotaExceededException;
import com.chartgate.metering.RateDecision;
import com.chartgate.metering.ThrottledException;
import com.chartgate.observability.CorrelationContext;
import com.chartgate.observability.CorrelationContextHolder;
import com.chartgate.security.AccountExistsException;
import com.chartgate.security.ExpiredTokenException;
import com.chartgate.security.GateRejectedException;
import com.chartgate.security.StorageUnavailableException;
import com.chartgate.security.TenantSuspendedException;
import com.chartgate.security.UnauthorizedException;
import java.net.URI;
import java.time.Instant;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    static Stream<Arguments> rejections() {
        return Stream.of(
                Arguments.of(new UnauthorizedException("Invalid API key."), 401, "unauthorized"),
                Arguments.of(new ExpiredTokenException(Instant.parse("2026-01-01T00:00:00Z")), 401, "expired-token"),
                Arguments.of(new TenantSuspendedException("t1"), 403, "tenant-suspended"),
                Arguments.of(new QuotaExceededException("t1", 100, BillingPeriod.parse("2026-06")), 429, "quota-exceeded"),
                Arguments.of(new StorageUnavailableException("down", new RuntimeException()), 503, "storage-unavailable"));
    }

    @Nested
    @DisplayName("gate rejections")
    class Rejections {

        @ParameterizedTest(name = "{2} -> {1}")
        @MethodSource("com.chartgate.gateway.infrastructure.web.GlobalExceptionHandlerTest#rejections")
        @DisplayName("maps the reason to status and problem type")
        void mapsReason(GateRejectedException ex, int status, String slug) {
            ResponseEntity<ProblemDetail> response = handler.handleRejection(ex);

            assertThat(response.getStatusCode().value()).isEqualTo(status);
            assertThat(response.getBody().getType())
                    .isEqualTo(URI.create("https://chartgate.dev/errors/" + slug));
            assertThat(response.getBody().getProperties()).containsEntry("reason", slug);
            assertThat(response.getHeaders().containsKey(HttpHeaders.RETRY_AFTER)).isFalse();
        }

        @Test
        @DisplayName("throttled responses carry Retry-After")
        void throttledRetryAfter() {
            ResponseEntity<ProblemDetail> response =
                    handler.handleRejection(new ThrottledException(RateDecision.throttled(12)));

            assertThat(response.getStatusCode().value()).isEqualTo(429);
            assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("12");
            assertThat(response.getBody().getType())
                    .isEqualTo(URI.create("https://chartgate.dev/errors/throttled"));
        }

        @Test
        @DisplayName("authentication failures ask for credentials")
        void wwwAuthenticate() {
            ResponseEntity<ProblemDetail> response =
                    handler.handleRejection(new UnauthorizedException("Invalid API key."));

            assertThat(response.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE)).isEqualTo("Bearer");
        }

        @Test
        @DisplayName("includes the correlation id when a context is set")
        void includesCorrelationId() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-9", "req-9"));

            ResponseEntity<ProblemDetail> response =
                    handler.handleRejection(new UnauthorizedException("Invalid API key."));

            assertThat(response.getBody().getProperties())
                    .containsEntry("correlationId", "corr-9")
                    .containsKey("timestamp");
        }
    }

    @Nested
    @DisplayName("other failures")
    class Others {

        @Test
        @DisplayName("maps IllegalArgumentException to 400")
        void illegalArgument() {
            ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

            assertThat(result.getStatus()).isEqualTo(400);
            assertThat(result.getDetail()).isEqualTo("invalid input");
            assertThat(result.getTitle()).isEqualTo("Bad Request");
        }

        @Test
        @DisplayName("maps a duplicate email to 409")
        void accountExists() {
            ProblemDetail result = handler.handleAccountExists(new AccountExistsException("a@example.com"));

            assertThat(result.getStatus()).isEqualTo(409);
            assertThat(result.getDetail()).doesNotContain("a@example.com");
        }

        @Test
        @DisplayName("maps missing resources to 404")
        void notFound() {
            ProblemDetail result = handler.handleNotFound(new ResourceNotFoundException("Key not found."));

            assertThat(result.getStatus()).isEqualTo(404);
        }

        @Test
        @DisplayName("maps unconfigured admin auth to 503")
        void adminUnavailable() {
            ProblemDetail result = handler.handleAdminUnavailable(new AdminUnavailableException());

            assertThat(result.getStatus()).isEqualTo(503);
        }

        @Test
        @DisplayName("keeps the status of framework errors")
        void frameworkError() {
            ProblemDetail result = handler.handleGeneric(new NoResourceFoundException(HttpMethod.GET, "nope"));

            assertThat(result.getStatus()).isEqualTo(404);
        }

        @Test
        @DisplayName("maps anything else to 500 without leaking the message")
        void generic() {
            ProblemDetail result = handler.handleGeneric(new RuntimeException("db password is hunter2"));

            assertThat(result.getStatus()).isEqualTo(500);
            assertThat(result.getTitle()).isEqualTo("Internal Server Error");
            assertThat(result.getDetail()).doesNotContain("hunter2");
        }
    }
}
