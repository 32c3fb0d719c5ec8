package com.bluequee.tabconfig.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.bluequee.observability.CorrelationContext;
import com.bluequee.observability.CorrelationContextHolder;
import com.bluequee.observability.MetricFactory;
import com.bluequee.tabconfig.domain.TabScope;
import com.bluequee.tabconfig.domain.error.DuplicateTabKeyException;
import com.bluequee.tabconfig.domain.error.InvalidTabException;
import com.bluequee.tabconfig.domain.error.MandatoryTabViolationException;
import com.bluequee.tabconfig.domain.error.PartialIdSetException;
import com.bluequee.tabconfig.domain.error.SystemDefaultImmutableException;
import com.bluequee.tabconfig.domain.error.TabErrorKind;
import com.bluequee.tabconfig.domain.error.TabNotFoundException;
import com.bluequee.tabconfig.domain.error.UnauthorizedTabAccessException;
import com.bluequee.tabconfig.domain.error.WouldHideAllTabsException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Unit tests for {@link GlobalExceptionHandler}.
 *
 * <p>WHY: Clients branch on the status code and {@code errorKind}; the mapping is tested as a plain
 * unit, no Spring context.
 */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final GlobalExceptionHandler handler =
            new GlobalExceptionHandler(new MetricFactory(registry, "tab-config-service"));

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("tab errors")
    class TabErrors {

        @Test
        @DisplayName("every kind maps to its status")
        void statuses() {
            assertThat(handler.handleTabConfig(new UnauthorizedTabAccessException("no")).getStatus())
                    .isEqualTo(403);
            assertThat(handler.handleTabConfig(new TabNotFoundException(5L)).getStatus()).isEqualTo(404);
            assertThat(handler.handleTabConfig(new SystemDefaultImmutableException("lab")).getStatus())
                    .isEqualTo(403);
            assertThat(handler.handleTabConfig(new MandatoryTabViolationException("lab")).getStatus())
                    .isEqualTo(403);
            assertThat(handler.handleTabConfig(new WouldHideAllTabsException("lab")).getStatus())
                    .isEqualTo(400);
            assertThat(
                            handler.handleTabConfig(new DuplicateTabKeyException("lab", TabScope.USER, 1L))
                                    .getStatus())
                    .isEqualTo(409);
            assertThat(handler.handleTabConfig(new PartialIdSetException(List.of(999L))).getStatus())
                    .isEqualTo(403);
            assertThat(handler.handleTabConfig(new InvalidTabException(List.of("bad"))).getStatus())
                    .isEqualTo(400);
        }

        @Test
        @DisplayName("every kind has a mapping")
        void exhaustive() {
            for (TabErrorKind kind : TabErrorKind.values()) {
                assertThat(GlobalExceptionHandler.statusFor(kind)).isNotNull();
            }
            assertThat(GlobalExceptionHandler.statusFor(TabErrorKind.DUPLICATE_KEY))
                    .isEqualTo(HttpStatus.CONFLICT);
        }

        @Test
        @DisplayName("body carries errorKind, type and correlation id")
        void body() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-42"));

            ProblemDetail result = handler.handleTabConfig(new WouldHideAllTabsException("billing"));

            assertThat(result.getProperties())
                    .containsEntry("errorKind", "WOULD_HIDE_ALL_TABS")
                    .containsEntry("correlationId", "corr-42")
                    .containsKey("timestamp");
            assertThat(result.getType().toString()).endsWith("/would-hide-all-tabs");
            assertThat(result.getDetail()).contains("billing");
        }

        @Test
        @DisplayName("partial id set lists the missing ids")
        void missingIds() {
            ProblemDetail result = handler.handleTabConfig(new PartialIdSetException(List.of(999L, 1000L)));

            assertThat(result.getProperties()).containsEntry("missingIds", List.of(999L, 1000L));
        }

        @Test
        @DisplayName("rejections are counted by kind")
        void counted() {
            handler.handleTabConfig(new MandatoryTabViolationException("overview"));
            handler.handleTabConfig(new MandatoryTabViolationException("overview"));

            assertThat(
                            registry.get(GlobalExceptionHandler.REJECTED_METRIC)
                                    .tag("kind", "MANDATORY_TAB_VIOLATION")
                                    .counter()
                                    .count())
                    .isEqualTo(2.0);
        }
    }

    @Test
    @DisplayName("missing identity maps to 401")
    void missingIdentity() {
        ProblemDetail result =
                handler.handleMissingIdentity(new MissingSecurityContextException("Authentication required"));

        assertThat(result.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("IllegalArgumentException maps to 400")
    void badRequest() {
        ProblemDetail result = handler.handleBadRequest(new IllegalArgumentException("Unknown tab scope: x"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("Unknown tab scope: x");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("store failure maps to 503 without leaking the cause")
    void storeUnavailable() {
        ProblemDetail result =
                handler.handleDataAccess(new DataAccessResourceFailureException("connection refused"));

        assertThat(result.getStatus()).isEqualTo(503);
        assertThat(result.getDetail()).doesNotContain("connection refused");
    }

    @Test
    @DisplayName("generic exception maps to 500")
    void generic() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getProperties()).containsKey("timestamp");
    }
}
