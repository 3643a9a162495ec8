package com.chartgate.gateway.infrastructure.web;

import com.chartgate.gateway.api.AdminUnavailableException;
import com.chartgate.gateway.api.ResourceNotFoundException;
import com.chartgate.gateway.chart.ChartNotFoundException;
import com.chartgate.metering.ThrottledException;
import com.chartgate.observability.CorrelationContextHolder;
import com.chartgate.security.AccountExistsException;
import com.chartgate.security.GateRejectedException;
import com.chartgate.security.RejectionReason;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Gate rejections take their status and problem type from {@link RejectionReason}, so a client
 * can tell a throttled request (retry after {@code Retry-After}) from an exhausted quota (wait for
 * the next period) by the {@code type} alone:
 *
 * <pre>
 * {
 *   "type": "https://chartgate.dev/errors/throttled",
 *   "title": "Too Many Requests",
 *   "status": 429,
 *   "detail": "Rate limit exceeded. Retry in 12s.",
 *   "reason": "throttled",
 *   "timestamp": "2026-06-15T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://chartgate.dev/errors/";

    @ExceptionHandler(GateRejectedException.class)
    public ResponseEntity<ProblemDetail> handleRejection(GateRejectedException ex) {
        RejectionReason reason = ex.reason();
        HttpStatus status = HttpStatus.valueOf(reason.httpStatus());
        ProblemDetail problem = problem(status, ex.getMessage(), reason.slug());
        problem.setProperty("reason", reason.slug());

        HttpHeaders headers = new HttpHeaders();
        if (ex instanceof ThrottledException throttled) {
            headers.set(HttpHeaders.RETRY_AFTER, Long.toString(throttled.retryAfterSeconds()));
            problem.setProperty("retryAfterSeconds", throttled.retryAfterSeconds());
        }
        if (reason == RejectionReason.UNAUTHORIZED
                || reason == RejectionReason.INVALID_TOKEN
                || reason == RejectionReason.EXPIRED_TOKEN) {
            headers.set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return ResponseEntity.status(status).headers(headers).body(problem);
    }

    @ExceptionHandler(AccountExistsException.class)
    public ProblemDetail handleAccountExists(AccountExistsException ex) {
        log.info("Registration conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Email already registered.", "account-exists");
    }

    @ExceptionHandler({ChartNotFoundException.class, ResourceNotFoundException.class})
    public ProblemDetail handleNotFound(RuntimeException ex) {
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "not-found");
    }

    @ExceptionHandler(AdminUnavailableException.class)
    public ProblemDetail handleAdminUnavailable(AdminUnavailableException ex) {
        log.warn("Admin request refused: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "admin-unavailable");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "bad-request");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Malformed request body", "bad-request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, detail, "validation");
        problem.setTitle("Validation Error");
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            // unknown route, unsupported method and the like keep their own status
            log.debug("Request rejected by framework: {}", ex.getMessage());
            return problem(framework.getStatusCode(), framework.getBody().getDetail(), "request");
        }
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", "internal");
    }

    private static ProblemDetail problem(HttpStatusCode status, String detail, String slug) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        HttpStatus known = HttpStatus.resolve(status.value());
        problem.setTitle(known != null ? known.getReasonPhrase() : "Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + slug));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
