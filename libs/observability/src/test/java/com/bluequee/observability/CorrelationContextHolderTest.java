package com.bluequee.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set / get / clear")
    class SetGetClear {

        @Test
        @DisplayName("mirrors the context into MDC")
        void populatesMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", 4L, 9L, "req-1"));

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-1");
            assertThat(MDC.get(CorrelationContext.MDC_ORGANIZATION_ID)).isEqualTo("4");
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("9");
            assertThat(MDC.get(CorrelationContext.MDC_REQUEST_ID)).isEqualTo("req-1");
        }

        @Test
        @DisplayName("removes MDC keys for null values")
        void removesNullKeys() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", 4L, 9L, null));
            CorrelationContextHolder.set(CorrelationContext.of("corr-2"));

            assertThat(MDC.get(CorrelationContext.MDC_ORGANIZATION_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isNull();
        }

        @Test
        @DisplayName("clear removes context and MDC keys")
        void clearRemovesEverything() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", 4L, 9L, null));
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
        }

        @Test
        @DisplayName("rejects null context")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("attachIdentity()")
    class AttachIdentity {

        @Test
        @DisplayName("adds organization and user to the bound context")
        void attaches() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-1"));

            CorrelationContextHolder.attachIdentity(12L, 34L);

            var ctx = CorrelationContextHolder.get().orElseThrow();
            assertThat(ctx.correlationId()).isEqualTo("corr-1");
            assertThat(ctx.organizationId()).isEqualTo(12L);
            assertThat(MDC.get(CorrelationContext.MDC_USER_ID)).isEqualTo("34");
        }

        @Test
        @DisplayName("does nothing when no context is bound")
        void noContext() {
            CorrelationContextHolder.attachIdentity(12L, 34L);

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("open()")
    class Open {

        @Test
        @DisplayName("restores the previous context on close")
        void restoresPrevious() {
            CorrelationContextHolder.set(CorrelationContext.of("outer"));

            try (var ignored = CorrelationContextHolder.open(CorrelationContext.of("inner"))) {
                assertThat(CorrelationContextHolder.get().orElseThrow().correlationId())
                        .isEqualTo("inner");
            }

            assertThat(CorrelationContextHolder.get().orElseThrow().correlationId())
                    .isEqualTo("outer");
        }

        @Test
        @DisplayName("clears on close when nothing was bound before")
        void clearsWhenNoPrevious() {
            try (var ignored = CorrelationContextHolder.open(CorrelationContext.of("inner"))) {
                assertThat(CorrelationContextHolder.get()).isPresent();
            }

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Test
    @DisplayName("CorrelationContext rejects blank correlation id")
    void rejectsBlankCorrelationId() {
        assertThatThrownBy(() -> CorrelationContext.of(" "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }
}
