package com.bluequee.tabconfig.infrastructure.web;

import com.bluequee.observability.CorrelationContextHolder;
import com.bluequee.observability.MetricFactory;
import com.bluequee.tabconfig.domain.error.InvalidTabException;
import com.bluequee.tabconfig.domain.error.PartialIdSetException;
import com.bluequee.tabconfig.domain.error.TabConfigException;
import com.bluequee.tabconfig.domain.error.TabErrorKind;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://bluequee.com/errors/would-hide-all-tabs",
 *   "title": "Would Hide All Tabs",
 *   "status": 400,
 *   "detail": "Changing tab 'billing' would leave no visible tabs; at least one must remain",
 *   "errorKind": "WOULD_HIDE_ALL_TABS",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Every rejected tab operation increments {@value #REJECTED_METRIC} tagged with its kind.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static final String REJECTED_METRIC = "tabconfig.mutations.rejected";

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_TYPE_BASE = "https://bluequee.com/errors/";

    private final MetricFactory metrics;

    public GlobalExceptionHandler(MetricFactory metrics) {
        this.metrics = metrics;
    }

    @ExceptionHandler(TabConfigException.class)
    public ProblemDetail handleTabConfig(TabConfigException ex) {
        TabErrorKind kind = ex.kind();
        log.warn("Tab operation rejected ({}): {}", kind, ex.getMessage());
        metrics.counter(REJECTED_METRIC, "Rejected tab configuration operations", "kind", kind.name())
                .increment();

        String slug = kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(statusFor(kind), ex.getMessage());
        problem.setTitle(titleFor(kind));
        problem.setType(URI.create(ERROR_TYPE_BASE + slug));
        problem.setProperty("errorKind", kind.name());
        if (ex instanceof PartialIdSetException partial) {
            problem.setProperty("missingIds", partial.missingIds());
        }
        if (ex instanceof InvalidTabException invalid) {
            problem.setProperty("errors", invalid.errors());
        }
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MissingSecurityContextException.class)
    public ProblemDetail handleMissingIdentity(MissingSecurityContextException ex) {
        log.warn("Unauthenticated request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, ex.getMessage());
        problem.setTitle("Unauthorized");
        problem.setType(URI.create(ERROR_TYPE_BASE + "unauthenticated"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        String detail =
                ex instanceof HttpMessageNotReadableException
                        ? "Malformed request body"
                        : ex.getMessage();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleDataAccess(DataAccessException ex) {
        log.error("Tab configuration store unavailable", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.SERVICE_UNAVAILABLE, "Tab configuration store unavailable");
        problem.setTitle("Service Unavailable");
        problem.setType(URI.create(ERROR_TYPE_BASE + "store-unavailable"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem =
                ProblemDetail.forStatusAndDetail(
                        HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    static HttpStatus statusFor(TabErrorKind kind) {
        return switch (kind) {
            case UNAUTHORIZED, SYSTEM_DEFAULT_IMMUTABLE, MANDATORY_TAB_VIOLATION, PARTIAL_ID_SET ->
                    HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case WOULD_HIDE_ALL_TABS, INVALID_TAB -> HttpStatus.BAD_REQUEST;
            case DUPLICATE_KEY -> HttpStatus.CONFLICT;
        };
    }

    private static String titleFor(TabErrorKind kind) {
        return switch (kind) {
            case UNAUTHORIZED -> "Forbidden";
            case NOT_FOUND -> "Not Found";
            case SYSTEM_DEFAULT_IMMUTABLE -> "System Default Immutable";
            case MANDATORY_TAB_VIOLATION -> "Mandatory Tab";
            case WOULD_HIDE_ALL_TABS -> "Would Hide All Tabs";
            case DUPLICATE_KEY -> "Duplicate Tab Key";
            case PARTIAL_ID_SET -> "Unknown Tab Ids";
            case INVALID_TAB -> "Invalid Tab";
        };
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
